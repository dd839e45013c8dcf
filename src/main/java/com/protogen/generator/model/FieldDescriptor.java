package com.protogen.generator.model;

import lombok.Builder;
import lombok.Getter;

/**
 * A field of a message or of an extend block.
 */
@Getter
public class FieldDescriptor extends Descriptor {
    private final int number;
    private final FieldLabel label;
    private TypeReference type;
    private final String oneofName;
    private final boolean extension;
    private final boolean synthetic;

    @Builder
    public FieldDescriptor(String name, String rawType, int number, FieldLabel label, String oneofName,
                           boolean extension, boolean synthetic, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
        this.number = number;
        this.label = label != null ? label : FieldLabel.SINGULAR;
        this.type = TypeReference.of(rawType);
        this.oneofName = oneofName;
        this.extension = extension;
        this.synthetic = synthetic;
    }

    public String getRawType() {
        return type.getRawType();
    }

    public boolean isNativeType() {
        return type.isNative();
    }

    public boolean isResolved() {
        return type.isResolved();
    }

    /**
     * The message or enum this field refers to, or {@code null} for native types.
     *
     * @throws IllegalStateException if the type has not been resolved
     */
    public TypeDescriptor getTypeDescriptor() {
        return type.getTarget();
    }

    public void setTypeDescriptor(TypeDescriptor descriptor) {
        this.type = type.bind(descriptor);
    }

    public boolean isRepeated() {
        return label == FieldLabel.REPEATED;
    }

    public boolean isOptional() {
        return label == FieldLabel.OPTIONAL;
    }

    public boolean isRequired() {
        return label == FieldLabel.REQUIRED;
    }

    public Object getDefaultValue() {
        return getOption("default");
    }

    @Override
    public String toString() {
        return "FieldDescriptor(" + label.keyword() + " " + type.getRawType() + " " + name + " = " + number + ")";
    }
}
