package com.protogen.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A message declaration. Owns its fields and nested messages and enums.
 *
 * Public field edits are allowed until the message is frozen by a compile run.
 */
public class MessageDescriptor extends TypeDescriptor {
    private final List<FieldDescriptor> fields = new ArrayList<>();
    private final List<MessageDescriptor> messages = new ArrayList<>();
    private final List<EnumDescriptor> enums = new ArrayList<>();
    private final List<String> oneofs = new ArrayList<>();
    private final List<String> extensionRanges = new ArrayList<>();
    private final List<String> reserved = new ArrayList<>();
    private boolean frozen;

    public MessageDescriptor(String name, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
    }

    public List<FieldDescriptor> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<MessageDescriptor> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<EnumDescriptor> getEnums() {
        return Collections.unmodifiableList(enums);
    }

    public List<String> getOneofs() {
        return Collections.unmodifiableList(oneofs);
    }

    public List<String> getExtensionRanges() {
        return Collections.unmodifiableList(extensionRanges);
    }

    public List<String> getReserved() {
        return Collections.unmodifiableList(reserved);
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<FieldDescriptor> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    public Optional<MessageDescriptor> findMessage(String messageName) {
        return messages.stream().filter(m -> m.getName().equals(messageName)).findFirst();
    }

    public Optional<EnumDescriptor> findEnum(String enumName) {
        return enums.stream().filter(e -> e.getName().equals(enumName)).findFirst();
    }

    /**
     * Message or enum declared directly inside this message.
     */
    public Optional<TypeDescriptor> findNestedType(String typeName) {
        Optional<MessageDescriptor> message = findMessage(typeName);
        if (message.isPresent()) {
            return Optional.of(message.get());
        }
        return findEnum(typeName).map(TypeDescriptor.class::cast);
    }

    public void addField(FieldDescriptor field) {
        checkNotFrozen();
        fields.add(field);
    }

    /**
     * Appends a field of a native type that did not come from a schema file.
     */
    public FieldDescriptor addSyntheticField(String type, String fieldName, int number) {
        if (!TypeReference.isNativeType(type)) {
            throw new IllegalArgumentException("Synthetic fields must use a native type, got: " + type);
        }
        FieldDescriptor field = FieldDescriptor.builder()
                .name(fieldName)
                .rawType(type)
                .number(number)
                .label(FieldLabel.OPTIONAL)
                .synthetic(true)
                .sourceFile(sourceFile)
                .build();
        addField(field);
        return field;
    }

    /**
     * Removes the first field named {@code fieldName}. Does nothing if there is none.
     *
     * @return whether a field was removed
     */
    public boolean removeFieldByName(String fieldName) {
        checkNotFrozen();
        Iterator<FieldDescriptor> it = fields.iterator();
        while (it.hasNext()) {
            if (it.next().getName().equals(fieldName)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    public void addMessage(MessageDescriptor message) {
        messages.add(message);
    }

    public void addEnum(EnumDescriptor enumDescriptor) {
        enums.add(enumDescriptor);
    }

    public void addOneof(String oneofName) {
        oneofs.add(oneofName);
    }

    public void addExtensionRange(String range) {
        extensionRanges.add(range);
    }

    public void addReserved(String entry) {
        reserved.add(entry);
    }

    /**
     * Freezes this message and everything nested in it.
     */
    public void freeze() {
        frozen = true;
        messages.forEach(MessageDescriptor::freeze);
    }

    // Extension merging is part of the load pipeline and is allowed after freezing.
    void appendExtensionField(FieldDescriptor field) {
        fields.add(field);
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Message " + getFullName() + " is frozen and can no longer be edited");
        }
    }

    @Override
    public String toString() {
        return "MessageDescriptor(" + getFullName() + ")";
    }
}
