package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open payload for categories without a fixed shape (system, security and general user activity).
 *
 * @param extra the payload fields
 */
public record GenericDetails(Map<String, Object> extra) implements AuditDetails {

    public GenericDetails {
        extra = DetailMaps.copyOf(extra);
    }

    public static GenericDetails of(Map<String, ?> values) {
        return new GenericDetails(values == null ? Map.of() : withoutNulls(values));
    }

    @Override
    public Map<String, Object> toMap() {
        return extra;
    }

    private static Map<String, Object> withoutNulls(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
