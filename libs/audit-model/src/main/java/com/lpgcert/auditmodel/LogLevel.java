package com.lpgcert.auditmodel;

import java.util.Locale;
import java.util.Optional;

/** Severity of an audit log entry, declared in increasing order of severity. */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /** Canonical string representation, identical to the constant name. */
    public String value() {
        return name();
    }

    /** Returns true when this level is the same as or more severe than {@code other}. */
    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Looks up a level by name, ignoring case.
     *
     * @param value the level name (e.g. "warning")
     * @return the matching level, or empty if not found
     */
    public static Optional<LogLevel> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a level name, rejecting anything outside the closed set.
     *
     * @throws IllegalArgumentException if the value is not a known level
     */
    public static LogLevel fromValue(String value) {
        return find(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown level: " + value));
    }
}
