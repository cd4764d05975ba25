package com.deepansh.lineage.tool;

import java.util.List;
import java.util.Map;

/**
 * Lenient readers for untyped tool input maps.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    /** First non-blank string among {@code keys}, or null. */
    public static String string(Map<String, Object> input, String... keys) {
        for (String key : keys) {
            Object value = input.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return null;
    }

    /** Integer from a Number or numeric string, else {@code defaultValue}. */
    public static int integer(Map<String, Object> input, String key, int defaultValue) {
        Object value = input.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static List<String> stringList(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(v -> v != null).map(Object::toString).toList();
        }
        return List.of();
    }
}
