package com.deepansh.kernel.tool.impl;

import java.util.List;
import java.util.Map;

/** Argument accessors for model-supplied tool input. */
final class ToolArgs {

    private ToolArgs() {
    }

    static String required(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return value.toString();
    }

    static String optional(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        return value == null ? fallback : value.toString();
    }

    static boolean flag(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }

    static List<?> list(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value instanceof List<?> l ? l : List.of();
    }
}
