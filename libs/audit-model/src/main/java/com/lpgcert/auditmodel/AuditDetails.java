package com.lpgcert.auditmodel;

import java.util.Map;

/**
 * Category-specific payload of an audit entry.
 *
 * <p>Each emitter owns one variant, so the compiler knows which keys a given category can carry.
 * Every variant also keeps an {@link #extra()} map for forward-compatible fields that have no typed
 * slot yet. On the wire (JSONB column, REST responses) a variant is flattened to a single JSON
 * object with snake_case keys via {@link #toMap()}.
 */
public sealed interface AuditDetails
        permits AuthDetails,
                EmailDetails,
                FileOperationDetails,
                SettingsChangeDetails,
                ApiRequestDetails,
                GenericDetails {

    /** Extension fields without a typed slot. Never null. */
    Map<String, Object> extra();

    /**
     * Flattens this payload into an ordered map. Typed fields come first and are never
     * overwritten by an extra field with the same key; null typed fields are omitted.
     */
    Map<String, Object> toMap();

    /**
     * Rebuilds the variant that belongs to {@code logType} from its flattened form.
     *
     * @param logType the category of the entry the payload was stored with
     * @param values the flattened payload, may be null
     * @return the typed payload, or null when {@code values} is null
     */
    static AuditDetails fromMap(LogType logType, Map<String, Object> values) {
        if (values == null) {
            return null;
        }
        return switch (logType) {
            case AUTH -> AuthDetails.fromMap(values);
            case EMAIL -> EmailDetails.fromMap(values);
            case FILE_OPERATION -> FileOperationDetails.fromMap(values);
            case API -> ApiRequestDetails.fromMap(values);
            case USER_ACTIVITY -> values.containsKey(SettingsChangeDetails.SETTING_KEY)
                    ? SettingsChangeDetails.fromMap(values)
                    : GenericDetails.of(values);
            default -> GenericDetails.of(values);
        };
    }
}
