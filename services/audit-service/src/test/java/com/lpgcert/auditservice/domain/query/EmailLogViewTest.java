package com.lpgcert.auditservice.domain.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.EmailDetails;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmailLogView")
class EmailLogViewTest {

    private static final Instant SENT_AT = Instant.parse("2025-04-02T08:15:00Z");

    @Test
    @DisplayName("maps the email details")
    void mapsDetails() {
        var entry =
                AuditLogEntry.builder(LogType.EMAIL, LogLevel.INFO)
                        .id("e-1")
                        .createdAt(SENT_AT)
                        .details(
                                EmailDetails.sent("client@example.com", "Your certificate")
                                        .withExtra(Map.of("message_id", "msg-1", "provider", "resend")))
                        .build();

        EmailLogView view = EmailLogView.from(new AuditLogView(entry, "jane", "jane@lpgcert.test", "Jane Doe"));

        assertThat(view.recipientEmail()).isEqualTo("client@example.com");
        assertThat(view.subject()).isEqualTo("Your certificate");
        assertThat(view.status()).isEqualTo("sent");
        assertThat(view.sentAt()).isEqualTo(SENT_AT);
        assertThat(view.messageId()).isEqualTo("msg-1");
        assertThat(view.provider()).isEqualTo("resend");
        assertThat(view.userDisplayName()).isEqualTo("Jane Doe");
    }

    @Test
    @DisplayName("falls back when details are missing")
    void fallbacks() {
        var entry =
                AuditLogEntry.builder(LogType.EMAIL, LogLevel.INFO)
                        .id("e-2")
                        .createdAt(SENT_AT)
                        .message("Weekly digest")
                        .build();

        EmailLogView view = EmailLogView.from(AuditLogView.of(entry));

        assertThat(view.recipientEmail()).isEqualTo("Unknown");
        assertThat(view.subject()).isEqualTo("Weekly digest");
        assertThat(view.status()).isEqualTo("unknown");
        assertThat(view.provider()).isEqualTo("system");
    }

    @Test
    @DisplayName("uses 'No subject' when neither subject nor message is known")
    void noSubject() {
        var entry = AuditLogEntry.builder(LogType.EMAIL, LogLevel.INFO).id("e-3").createdAt(SENT_AT).build();

        assertThat(EmailLogView.from(AuditLogView.of(entry)).subject()).isEqualTo("No subject");
    }
}
