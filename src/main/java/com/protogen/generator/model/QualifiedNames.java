package com.protogen.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Helpers for dotted package and type names.
 */
@UtilityClass
public class QualifiedNames {

    /**
     * Joins a scope and a name, treating an empty or null scope as the root.
     */
    public static String join(String scope, String name) {
        if (scope == null || scope.isEmpty()) {
            return name;
        }
        return scope + "." + name;
    }

    public static boolean isFullyQualified(String typeName) {
        return typeName != null && typeName.startsWith(".");
    }

    /**
     * Scope chain for a package, innermost first: {@code a.b.c, a.b, a, ""}.
     */
    public static List<String> scopeChain(String scope) {
        List<String> chain = new ArrayList<>();
        String current = scope == null ? "" : scope;
        while (!current.isEmpty()) {
            chain.add(current);
            int dot = current.lastIndexOf('.');
            current = dot < 0 ? "" : current.substring(0, dot);
        }
        chain.add("");
        return chain;
    }
}
