package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Before/after pair for an application setting change.
 *
 * @param category setting category (e.g. "email")
 * @param key setting key within the category (e.g. "smtp_port")
 * @param oldValue serialized value before the change, nullable for new settings
 * @param newValue serialized value after the change
 * @param extra extension fields
 */
public record SettingsChangeDetails(
        String category, String key, String oldValue, String newValue, Map<String, Object> extra)
        implements AuditDetails {

    public static final String SETTING_CATEGORY = "setting_category";
    public static final String SETTING_KEY = "setting_key";
    public static final String OLD_VALUE = "old_value";
    public static final String NEW_VALUE = "new_value";

    private static final Set<String> TYPED_KEYS =
            Set.of(SETTING_CATEGORY, SETTING_KEY, OLD_VALUE, NEW_VALUE);

    public SettingsChangeDetails {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        extra = DetailMaps.copyOf(extra);
    }

    public static SettingsChangeDetails of(String category, String key, String oldValue, String newValue) {
        return new SettingsChangeDetails(category, key, oldValue, newValue, Map.of());
    }

    /** The dotted identifier used as resource id, e.g. "email.smtp_port". */
    public String qualifiedKey() {
        return category + "." + key;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SETTING_CATEGORY, category);
        map.put(SETTING_KEY, key);
        DetailMaps.putIfPresent(map, OLD_VALUE, oldValue);
        DetailMaps.putIfPresent(map, NEW_VALUE, newValue);
        return DetailMaps.withExtra(map, extra);
    }

    static SettingsChangeDetails fromMap(Map<String, Object> values) {
        String category = DetailMaps.string(values, SETTING_CATEGORY);
        String key = DetailMaps.string(values, SETTING_KEY);
        return new SettingsChangeDetails(
                category == null || category.isBlank() ? "unknown" : category,
                key == null || key.isBlank() ? "unknown" : key,
                DetailMaps.string(values, OLD_VALUE),
                DetailMaps.string(values, NEW_VALUE),
                DetailMaps.remaining(values, TYPED_KEYS));
    }
}
