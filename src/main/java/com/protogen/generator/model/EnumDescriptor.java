package com.protogen.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class EnumDescriptor extends TypeDescriptor {
    private final List<EnumValueDescriptor> values = new ArrayList<>();

    public EnumDescriptor(String name, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
    }

    public List<EnumValueDescriptor> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void addValue(EnumValueDescriptor value) {
        values.add(value);
    }

    public Optional<EnumValueDescriptor> findValue(String valueName) {
        return values.stream().filter(v -> v.getName().equals(valueName)).findFirst();
    }

    public Optional<EnumValueDescriptor> findValue(int number) {
        return values.stream().filter(v -> v.getNumber() == number).findFirst();
    }

    public boolean isAliasAllowed() {
        return Boolean.TRUE.equals(getOption("allow_alias"));
    }

    @Override
    public String toString() {
        return "EnumDescriptor(" + getFullName() + ")";
    }
}
