package com.protogen.generator.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.protogen.generator.exception.DuplicateDefinitionException;
import com.protogen.generator.model.TypeDescriptor;

/**
 * Fully-qualified type name to message or enum, for one compilation session.
 *
 * Filled by {@link TypeIndexer} and only read by {@link TypeResolver}. Not shared between sessions.
 */
public class SymbolTable {

    private final Map<String, TypeDescriptor> typesByName = new LinkedHashMap<>();

    /**
     * Registers a type under its full name. Registering the same instance twice is a no-op.
     *
     * @throws DuplicateDefinitionException if a different type already owns the name
     */
    public void register(TypeDescriptor type) {
        String fullName = type.getFullName();
        TypeDescriptor existing = typesByName.putIfAbsent(fullName, type);
        if (existing != null && existing != type) {
            throw new DuplicateDefinitionException(type.getSourceFile(), type.getSourceLine(), 1, fullName,
                    "type " + fullName + " is already defined in " + existing.getSourceFile()
                            + " line " + existing.getSourceLine());
        }
    }

    public Optional<TypeDescriptor> find(String fullName) {
        return Optional.ofNullable(typesByName.get(fullName));
    }

    public boolean contains(String fullName) {
        return typesByName.containsKey(fullName);
    }

    public int size() {
        return typesByName.size();
    }

    public Set<String> getQualifiedNames() {
        return Collections.unmodifiableSet(typesByName.keySet());
    }
}
