package com.protogen.generator.model;

import java.util.Locale;

/**
 * Cardinality of a field. SINGULAR is a field declared without a label.
 */
public enum FieldLabel {
    REQUIRED,
    OPTIONAL,
    REPEATED,
    SINGULAR;

    public static boolean isLabelKeyword(String word) {
        return "required".equals(word) || "optional".equals(word) || "repeated".equals(word);
    }

    public static FieldLabel fromKeyword(String word) {
        if (word == null || word.isEmpty()) {
            return SINGULAR;
        }
        return valueOf(word.toUpperCase(Locale.ROOT));
    }

    public String keyword() {
        return this == SINGULAR ? "" : name().toLowerCase(Locale.ROOT);
    }
}
