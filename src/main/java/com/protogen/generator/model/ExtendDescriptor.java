package com.protogen.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * An {@code extend Target { ... }} block. Its name is the target as written in source.
 *
 * A block declared inside a message keeps that message as its enclosing scope; the package is
 * assigned during indexing, like every other scope.
 */
public class ExtendDescriptor extends Descriptor {
    @Getter
    @Setter
    private String packageName;
    /** Message the block is declared in, or {@code null} at file level. */
    @Getter
    private final MessageDescriptor enclosingMessage;
    private final List<FieldDescriptor> fields = new ArrayList<>();

    public ExtendDescriptor(String targetName, MessageDescriptor enclosingMessage, String sourceFile, int sourceLine) {
        super(targetName, sourceFile, sourceLine);
        this.enclosingMessage = enclosingMessage;
    }

    public String getTargetName() {
        return name;
    }

    /**
     * Scope the target and field types are looked up from: the enclosing message's full name
     * for a nested block, otherwise the declaring file's package.
     */
    public String getScope() {
        return enclosingMessage != null ? enclosingMessage.getFullName() : packageName;
    }

    public List<FieldDescriptor> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public void addField(FieldDescriptor field) {
        fields.add(field);
    }

    /**
     * Appends this block's fields to {@code target}, in declaration order.
     */
    public void mergeInto(MessageDescriptor target) {
        for (FieldDescriptor field : fields) {
            target.appendExtensionField(field);
        }
    }

    @Override
    public String toString() {
        return "ExtendDescriptor(" + name + ", " + fields.size() + " fields)";
    }
}
