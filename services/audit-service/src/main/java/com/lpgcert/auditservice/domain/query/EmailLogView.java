package com.lpgcert.auditservice.domain.query;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.EmailDetails;
import java.time.Instant;
import java.util.Map;

/**
 * Email-centric projection of an {@code email} entry, as shown on the admin email log.
 *
 * @param recipientEmail recipient, or {@code Unknown}
 * @param subject subject, else the entry message, else {@code No subject}
 * @param status delivery status, or {@code unknown}
 * @param sentAt the entry's created_at
 * @param provider sending provider, or {@code system}
 */
public record EmailLogView(
        String id,
        String recipientEmail,
        String subject,
        String status,
        Instant sentAt,
        Instant createdAt,
        String errorMessage,
        String messageId,
        String provider,
        String userEmail,
        String username,
        String userDisplayName) {

    static final String UNKNOWN_RECIPIENT = "Unknown";
    static final String NO_SUBJECT = "No subject";
    static final String UNKNOWN_STATUS = "unknown";
    static final String DEFAULT_PROVIDER = "system";

    public static EmailLogView from(AuditLogView view) {
        AuditLogEntry entry = view.entry();
        Map<String, Object> details = entry.detailsMap();
        return new EmailLogView(
                entry.id(),
                firstNonBlank(string(details, EmailDetails.RECIPIENT), UNKNOWN_RECIPIENT),
                firstNonBlank(
                        string(details, EmailDetails.SUBJECT),
                        firstNonBlank(entry.message(), NO_SUBJECT)),
                firstNonBlank(string(details, EmailDetails.STATUS), UNKNOWN_STATUS),
                entry.createdAt(),
                entry.createdAt(),
                string(details, EmailDetails.ERROR_MESSAGE),
                string(details, EmailDetails.MESSAGE_ID),
                firstNonBlank(string(details, EmailDetails.PROVIDER), DEFAULT_PROVIDER),
                view.userEmail(),
                view.username(),
                view.userDisplayName());
    }

    private static String string(Map<String, Object> details, String key) {
        Object value = details.get(key);
        return value == null ? null : value.toString();
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
