package com.lpgcert.auditmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an {@link AuditLogEntry} against the schema before it is written.
 *
 * <p>Only {@code log_type} and {@code level} are mandatory. The remaining checks catch entries
 * whose payload variant does not belong to their category, which can only happen when an entry
 * bypasses the emitters.
 */
public final class AuditLogEntryValidator {

    private AuditLogEntryValidator() {
        // utility class
    }

    /**
     * Validates the entry and returns every problem found.
     *
     * @param entry the entry to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(AuditLogEntry entry) {
        if (entry == null) {
            return ValidationResult.fail(List.of("entry must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (entry.logType() == null) {
            errors.add("logType must not be null");
        }
        if (entry.level() == null) {
            errors.add("level must not be null");
        }
        if (entry.retentionDays() != null && entry.retentionDays() < 1) {
            errors.add("retentionDays must be >= 1 when present");
        }
        if (entry.logType() != null && entry.details() != null
                && !belongsTo(entry.details(), entry.logType())) {
            errors.add("details of type " + entry.details().getClass().getSimpleName()
                    + " do not match logType " + entry.logType().value());
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean belongsTo(AuditDetails details, LogType logType) {
        if (details instanceof GenericDetails) {
            return true;
        }
        if (details instanceof AuthDetails) {
            return logType == LogType.AUTH;
        }
        if (details instanceof EmailDetails) {
            return logType == LogType.EMAIL;
        }
        if (details instanceof FileOperationDetails) {
            return logType == LogType.FILE_OPERATION;
        }
        if (details instanceof SettingsChangeDetails) {
            return logType == LogType.USER_ACTIVITY;
        }
        return details instanceof ApiRequestDetails && logType == LogType.API;
    }
}
