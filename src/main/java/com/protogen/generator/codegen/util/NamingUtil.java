package com.protogen.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derived names exposed to templates.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts shoe_id, WORK_FAX or LaceShoe to PascalCase: ShoeId, WorkFax, LaceShoe.
     */
    public static String toTitleCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_]+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts shoe_id or LaceShoe to camelCase: shoeId, laceShoe.
     */
    public static String toCamelCase(String name) {
        String title = toTitleCase(name);
        if (title == null || title.isEmpty()) {
            return title;
        }
        return title.substring(0, 1).toLowerCase(Locale.ROOT) + title.substring(1);
    }

    /**
     * Converts LaceShoe or shoeId to SCREAMING_SNAKE_CASE: LACE_SHOE, SHOE_ID.
     */
    public static String toUpperUnderscore(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        // fooBar, foo2Bar
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        // HTTPServer
        result = result.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_");
        return result.toUpperCase(Locale.ROOT);
    }

    // An all-caps part is a constant word (WORK), anything else keeps its inner casing (LaceShoe).
    private static String capitalize(String part) {
        String word = part.equals(part.toUpperCase(Locale.ROOT)) ? part.toLowerCase(Locale.ROOT) : part;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
    }
}
