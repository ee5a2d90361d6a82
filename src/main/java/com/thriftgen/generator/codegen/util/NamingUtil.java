package com.thriftgen.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;

/**
 * Utility for Scala naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts snake_case to camelCase. Leading underscores are kept, existing humps
     * are left alone: {@code foo_bar} and {@code fooBar} both give {@code fooBar}.
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        int leading = 0;
        while (leading < name.length() && name.charAt(leading) == '_') {
            leading++;
        }
        String[] parts = Arrays.stream(name.substring(leading).split("_"))
                .filter(p -> !p.isEmpty())
                .toArray(String[]::new);
        if (parts.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.substring(0, leading));
        sb.append(decapitalize(parts[0]));
        for (int i = 1; i < parts.length; i++) {
            sb.append(capitalize(parts[i]));
        }
        return sb.toString();
    }

    /**
     * Wraps a name in backticks so Scala accepts it even when it is a reserved word.
     */
    public static String quoteIdentifier(String name) {
        return "`" + name + "`";
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }

    private static String decapitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toLowerCase(Locale.ROOT) + str.substring(1);
    }
}
