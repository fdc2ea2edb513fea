package com.lpgcert.auditmodel;

import java.util.Optional;

/**
 * Closed classification of audit log entries.
 *
 * <p>The {@code value} is the canonical lower-case string stored in the {@code log_type} column and
 * accepted by the query surface. A log type is fixed by the emitter that creates an entry and never
 * changes afterwards.
 */
public enum LogType {
    SYSTEM("system"),
    USER_ACTIVITY("user_activity"),
    EMAIL("email"),
    AUTH("auth"),
    SECURITY("security"),
    API("api"),
    FILE_OPERATION("file_operation");

    private final String value;

    LogType(String value) {
        this.value = value;
    }

    /** Canonical string representation (e.g. "user_activity"). */
    public String value() {
        return value;
    }

    /** Whether entries of this type are sensitive unless an emitter says otherwise. */
    public boolean sensitiveByDefault() {
        return this == SECURITY;
    }

    /**
     * Looks up a LogType by its canonical value.
     *
     * @param value the string to match (e.g. "email")
     * @return the matching LogType, or empty if not found
     */
    public static Optional<LogType> find(String value) {
        for (LogType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a canonical value, rejecting anything outside the closed set.
     *
     * @throws IllegalArgumentException if the value is not a known log type
     */
    public static LogType fromValue(String value) {
        return find(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown log_type: " + value));
    }

    /** Checks whether a string corresponds to a known log type. */
    public static boolean isKnown(String value) {
        return find(value).isPresent();
    }
}
