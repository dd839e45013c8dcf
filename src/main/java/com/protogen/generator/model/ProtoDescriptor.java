package com.protogen.generator.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;

/**
 * One parsed schema file.
 *
 * {@code name} is the base file name; {@code filePath} is the canonical location the file was read from.
 */
public class ProtoDescriptor extends Descriptor {
    @Getter
    private final String filePath;
    @Getter
    @Setter
    private String packageName = "";
    @Getter
    @Setter
    private String syntax;
    /** Filesystem location, or {@code null} when loaded from the classpath. */
    @Getter
    @Setter
    private Path sourcePath;
    /** Name the file was requested under, e.g. {@code google/protobuf/descriptor.proto}. */
    @Getter
    @Setter
    private String logicalName;

    private final List<String> importNames = new ArrayList<>();
    private final List<ProtoDescriptor> imports = new ArrayList<>();
    private final List<MessageDescriptor> messages = new ArrayList<>();
    private final List<EnumDescriptor> enums = new ArrayList<>();
    private final List<ServiceDescriptor> services = new ArrayList<>();
    private final List<ExtendDescriptor> extendBlocks = new ArrayList<>();

    public ProtoDescriptor(String filePath) {
        super(baseName(filePath), filePath, 0);
        this.filePath = filePath;
    }

    private static String baseName(String filePath) {
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        return slash >= 0 ? filePath.substring(slash + 1) : filePath;
    }

    public List<String> getImportNames() {
        return Collections.unmodifiableList(importNames);
    }

    public List<ProtoDescriptor> getImports() {
        return Collections.unmodifiableList(imports);
    }

    public List<MessageDescriptor> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<EnumDescriptor> getEnums() {
        return Collections.unmodifiableList(enums);
    }

    public List<ServiceDescriptor> getServices() {
        return Collections.unmodifiableList(services);
    }

    public List<ExtendDescriptor> getExtends() {
        return Collections.unmodifiableList(extendBlocks);
    }

    public void addImportName(String importName) {
        importNames.add(importName);
    }

    public void addImport(ProtoDescriptor imported) {
        imports.add(imported);
    }

    public void addMessage(MessageDescriptor message) {
        messages.add(message);
    }

    public void addEnum(EnumDescriptor enumDescriptor) {
        enums.add(enumDescriptor);
    }

    public void addService(ServiceDescriptor service) {
        services.add(service);
    }

    public void addExtend(ExtendDescriptor extend) {
        extendBlocks.add(extend);
    }

    public void removeExtend(ExtendDescriptor extend) {
        extendBlocks.remove(extend);
    }

    public Optional<MessageDescriptor> findMessage(String messageName) {
        return messages.stream().filter(m -> m.getName().equals(messageName)).findFirst();
    }

    public Optional<EnumDescriptor> findEnum(String enumName) {
        return enums.stream().filter(e -> e.getName().equals(enumName)).findFirst();
    }

    public Optional<ServiceDescriptor> findService(String serviceName) {
        return services.stream().filter(s -> s.getName().equals(serviceName)).findFirst();
    }

    /**
     * Finds a message or enum declared in this file by its dotted name, either relative to the
     * file ({@code Person.PhoneType}) or qualified with the file's package.
     */
    public Optional<TypeDescriptor> findType(String typeName) {
        String relative = typeName.startsWith(".") ? typeName.substring(1) : typeName;
        if (!packageName.isEmpty() && relative.startsWith(packageName + ".")) {
            relative = relative.substring(packageName.length() + 1);
        }

        String[] parts = relative.split("\\.");
        Optional<TypeDescriptor> current = findTopLevelType(parts[0]);
        for (int i = 1; i < parts.length && current.isPresent(); i++) {
            if (!(current.get() instanceof MessageDescriptor message)) {
                return Optional.empty();
            }
            current = message.findNestedType(parts[i]);
        }
        return current;
    }

    private Optional<TypeDescriptor> findTopLevelType(String typeName) {
        Optional<MessageDescriptor> message = findMessage(typeName);
        if (message.isPresent()) {
            return Optional.of(message.get());
        }
        return findEnum(typeName).map(TypeDescriptor.class::cast);
    }

    /**
     * Freezes every message declared in this file.
     */
    public void freeze() {
        messages.forEach(MessageDescriptor::freeze);
    }

    @Override
    public String toString() {
        return "ProtoDescriptor(" + filePath + ")";
    }
}
