package com.protogen.generator.model;

import lombok.Getter;
import lombok.Setter;

/**
 * A named type that fields and methods can refer to: a message or an enum.
 */
@Getter
@Setter
public abstract class TypeDescriptor extends Descriptor {

    /** Enclosing scope (package plus outer message names), assigned during indexing. */
    protected String packageName;

    protected TypeDescriptor(String name, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
    }

    public String getFullName() {
        return QualifiedNames.join(packageName, name);
    }
}
