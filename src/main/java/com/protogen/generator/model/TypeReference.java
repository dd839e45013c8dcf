package com.protogen.generator.model;

import java.util.Set;

/**
 * The type of a field or a method argument, in one of three states:
 * a native scalar, an unresolved raw name, or a name bound to a message or enum.
 *
 * Bound targets are shared, never owned.
 */
public abstract class TypeReference {

    private static final Set<String> NATIVE_TYPES = Set.of(
            "double", "float",
            "int32", "int64", "uint32", "uint64", "sint32", "sint64",
            "fixed32", "fixed64", "sfixed32", "sfixed64",
            "bool", "string", "bytes"
    );

    protected final String rawType;

    private TypeReference(String rawType) {
        this.rawType = rawType;
    }

    public static boolean isNativeType(String rawType) {
        return NATIVE_TYPES.contains(rawType);
    }

    /**
     * A fresh reference for a type token as written in source.
     */
    public static TypeReference of(String rawType) {
        return isNativeType(rawType) ? new Scalar(rawType) : new Unresolved(rawType);
    }

    public String getRawType() {
        return rawType;
    }

    public boolean isNative() {
        return false;
    }

    public boolean isResolved() {
        return true;
    }

    /**
     * Bound message or enum; {@code null} for native scalars.
     *
     * @throws IllegalStateException if the reference has not been resolved yet
     */
    public abstract TypeDescriptor getTarget();

    /**
     * Returns a reference bound to {@code target}.
     */
    public TypeReference bind(TypeDescriptor target) {
        if (target == null) {
            throw new IllegalArgumentException("Cannot bind " + rawType + " to null");
        }
        return new Resolved(rawType, target);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + rawType + ")";
    }

    public static final class Scalar extends TypeReference {
        private Scalar(String rawType) {
            super(rawType);
        }

        @Override
        public boolean isNative() {
            return true;
        }

        @Override
        public TypeDescriptor getTarget() {
            return null;
        }

        @Override
        public TypeReference bind(TypeDescriptor target) {
            throw new IllegalStateException("Native type " + rawType + " cannot be bound to a descriptor");
        }
    }

    public static final class Unresolved extends TypeReference {
        private Unresolved(String rawType) {
            super(rawType);
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public TypeDescriptor getTarget() {
            throw new IllegalStateException("Type " + rawType + " has not been resolved");
        }
    }

    public static final class Resolved extends TypeReference {
        private final TypeDescriptor target;

        private Resolved(String rawType, TypeDescriptor target) {
            super(rawType);
            this.target = target;
        }

        @Override
        public TypeDescriptor getTarget() {
            return target;
        }

        @Override
        public String toString() {
            return "Resolved(" + rawType + " -> " + target.getFullName() + ")";
        }
    }
}
