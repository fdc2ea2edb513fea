package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Payload of {@code email} events.
 *
 * @param recipient destination address
 * @param subject message subject
 * @param status delivery outcome, defaults to {@link EmailStatus#SENT}
 * @param errorMessage provider error for failed deliveries, nullable
 * @param extra extension fields (e.g. message_id, provider)
 */
public record EmailDetails(
        String recipient,
        String subject,
        EmailStatus status,
        String errorMessage,
        Map<String, Object> extra)
        implements AuditDetails {

    public static final String RECIPIENT = "recipient";
    public static final String SUBJECT = "subject";
    public static final String STATUS = "status";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String MESSAGE_ID = "message_id";
    public static final String PROVIDER = "provider";

    private static final Set<String> TYPED_KEYS = Set.of(RECIPIENT, SUBJECT, STATUS, ERROR_MESSAGE);

    public EmailDetails {
        if (status == null) {
            status = EmailStatus.SENT;
        }
        extra = DetailMaps.copyOf(extra);
    }

    public static EmailDetails sent(String recipient, String subject) {
        return new EmailDetails(recipient, subject, EmailStatus.SENT, null, Map.of());
    }

    public static EmailDetails failed(String recipient, String subject, String errorMessage) {
        return new EmailDetails(recipient, subject, EmailStatus.FAILED, errorMessage, Map.of());
    }

    /** Returns a copy carrying the given extension fields. */
    public EmailDetails withExtra(Map<String, Object> extraFields) {
        return new EmailDetails(recipient, subject, status, errorMessage, extraFields);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        DetailMaps.putIfPresent(map, RECIPIENT, recipient);
        DetailMaps.putIfPresent(map, SUBJECT, subject);
        map.put(STATUS, status.value());
        DetailMaps.putIfPresent(map, ERROR_MESSAGE, errorMessage);
        return DetailMaps.withExtra(map, extra);
    }

    static EmailDetails fromMap(Map<String, Object> values) {
        return new EmailDetails(
                DetailMaps.string(values, RECIPIENT),
                DetailMaps.string(values, SUBJECT),
                EmailStatus.find(DetailMaps.string(values, STATUS)).orElse(null),
                DetailMaps.string(values, ERROR_MESSAGE),
                DetailMaps.remaining(values, TYPED_KEYS));
    }
}
