package com.protogen.generator.model;

import lombok.Getter;

@Getter
public class EnumValueDescriptor extends Descriptor {
    private final int number;

    public EnumValueDescriptor(String name, int number, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
        this.number = number;
    }

    @Override
    public String toString() {
        return name + " = " + number;
    }
}
