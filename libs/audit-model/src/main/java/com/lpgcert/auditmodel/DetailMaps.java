package com.lpgcert.auditmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Helpers shared by the {@link AuditDetails} variants. */
final class DetailMaps {

    private DetailMaps() {
        // utility class
    }

    /** Unmodifiable copy that tolerates null input and null values. */
    static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Returns every entry whose key is not one of the typed keys. */
    static Map<String, Object> remaining(Map<String, Object> source, Set<String> typedKeys) {
        Map<String, Object> rest = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (!typedKeys.contains(key)) {
                rest.put(key, value);
            }
        });
        return rest;
    }

    static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    /** Appends extension fields that do not collide with typed ones. */
    static Map<String, Object> withExtra(Map<String, Object> typed, Map<String, Object> extra) {
        extra.forEach(typed::putIfAbsent);
        return Collections.unmodifiableMap(typed);
    }

    static String string(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value == null ? null : value.toString();
    }

    static Long number(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
