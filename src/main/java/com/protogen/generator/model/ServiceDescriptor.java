package com.protogen.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;

public class ServiceDescriptor extends Descriptor {
    @Getter
    @Setter
    private String packageName;
    private final List<MethodDescriptor> methods = new ArrayList<>();

    public ServiceDescriptor(String name, String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
    }

    public String getFullName() {
        return QualifiedNames.join(packageName, name);
    }

    public List<MethodDescriptor> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    public void addMethod(MethodDescriptor method) {
        methods.add(method);
    }

    public Optional<MethodDescriptor> findMethod(String methodName) {
        return methods.stream().filter(m -> m.getName().equals(methodName)).findFirst();
    }

    @Override
    public String toString() {
        return "ServiceDescriptor(" + getFullName() + ")";
    }
}
