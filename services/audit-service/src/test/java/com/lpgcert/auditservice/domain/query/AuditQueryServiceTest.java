package com.lpgcert.auditservice.domain.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.EmailDetails;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditservice.testing.InMemoryAuditLogStore;
import com.lpgcert.observability.MetricFactory;
import com.lpgcert.security.Role;
import com.lpgcert.security.testing.InMemoryUserDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditQueryService")
class AuditQueryServiceTest {

    private static final Instant BASE = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryUserDirectory directory;
    private InMemoryAuditLogStore store;
    private SimpleMeterRegistry registry;
    private AuditQueryService service;

    @BeforeEach
    void setUp() {
        directory = new InMemoryUserDirectory();
        directory.add("u-1", "jane@lpgcert.test", "Jane", "Doe", Role.ADMIN);
        store = new InMemoryAuditLogStore(directory);
        registry = new SimpleMeterRegistry();
        service =
                new AuditQueryService(
                        store, PageLimits.STANDARD, new MetricFactory(registry, "audit-service"));
    }

    private AuditLogEntry.Builder entry(int minute, LogType type) {
        return AuditLogEntry.builder(type, LogLevel.INFO)
                .id("id-%03d".formatted(minute))
                .createdAt(BASE.plusSeconds(60L * minute));
    }

    private void append(AuditLogEntry.Builder builder) {
        store.append(builder.build());
    }

    private static List<String> ids(AuditLogPage<AuditLogView> page) {
        return page.items().stream().map(view -> view.entry().id()).toList();
    }

    @Nested
    @DisplayName("filtering")
    class Filtering {

        @Test
        @DisplayName("log_type email returns only email entries, newest first")
        void byLogType() {
            append(entry(1, LogType.EMAIL).message("first email"));
            append(entry(2, LogType.SYSTEM).message("backup"));
            append(entry(3, LogType.EMAIL).message("second email"));
            append(entry(4, LogType.AUTH).message("login"));

            var page = service.query(AuditLogQuery.builder().logType(LogType.EMAIL).build());

            assertThat(page.available()).isTrue();
            assertThat(ids(page)).containsExactly("id-003", "id-001");
        }

        @Test
        @DisplayName("filters are AND-combined")
        void combinedFilters() {
            append(entry(1, LogType.AUTH).userId("u-1").action("LOGIN"));
            append(entry(2, LogType.AUTH).userId("u-1").action("LOGOUT"));
            append(entry(3, LogType.AUTH).userId("u-2").action("LOGIN"));

            var page = service.query(AuditLogQuery.builder().userId("u-1").action("LOGIN").build());

            assertThat(ids(page)).containsExactly("id-001");
        }

        @Test
        @DisplayName("date bounds are inclusive")
        void dateRange() {
            IntStream.rangeClosed(1, 5).forEach(i -> append(entry(i, LogType.SYSTEM)));

            var page =
                    service.query(
                            AuditLogQuery.builder()
                                    .start(BASE.plusSeconds(120))
                                    .end(BASE.plusSeconds(240))
                                    .build());

            assertThat(ids(page)).containsExactly("id-004", "id-003", "id-002");
        }

        @Test
        @DisplayName("admin search matches action, username and email case-insensitively")
        void adminSearch() {
            append(entry(1, LogType.USER_ACTIVITY).message("Created report").userId("u-1"));
            append(entry(2, LogType.USER_ACTIVITY).message("Other").action("REPORT_DELETE"));
            append(entry(3, LogType.SYSTEM).message("Nothing relevant"));

            var byUsername = service.query(AuditLogQuery.builder().search("JANE", SearchScope.ADMIN).build());
            var byAction = service.query(AuditLogQuery.builder().search("delete", SearchScope.ADMIN).build());
            var messageOnly = service.query(AuditLogQuery.builder().search("jane", SearchScope.MESSAGE).build());

            assertThat(ids(byUsername)).containsExactly("id-001");
            assertThat(ids(byAction)).containsExactly("id-002");
            assertThat(messageOnly.items()).isEmpty();
        }

        @Test
        @DisplayName("entries sharing a correlation id are grouped")
        void correlationGrouping() {
            append(entry(1, LogType.USER_ACTIVITY).correlationId("req-9"));
            append(entry(2, LogType.EMAIL).correlationId("req-9"));
            append(entry(3, LogType.USER_ACTIVITY).correlationId("req-10"));

            var page = service.byCorrelationId("req-9");

            assertThat(ids(page)).containsExactly("id-002", "id-001");
            assertThat(page.limit()).isEqualTo(100);
        }

        @Test
        @DisplayName("a blank correlation id is rejected")
        void blankCorrelationId() {
            assertThatThrownBy(() -> service.byCorrelationId(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("pagination")
    class Pagination {

        @BeforeEach
        void seed() {
            IntStream.rangeClosed(1, 120).forEach(i -> append(entry(i, LogType.SYSTEM)));
        }

        @Test
        @DisplayName("limit 50 offset 50 returns entries 51 to 100 without overlap")
        void secondPage() {
            var first = service.query(AuditLogQuery.builder().limit(50).offset(0).build());
            var second = service.query(AuditLogQuery.builder().limit(50).offset(50).build());

            assertThat(second.items()).hasSize(50);
            // newest first: position 51 is minute 70, position 100 is minute 21
            assertThat(ids(second).get(0)).isEqualTo("id-070");
            assertThat(ids(second).get(49)).isEqualTo("id-021");
            Set<String> overlap = new HashSet<>(ids(first));
            overlap.retainAll(ids(second));
            assertThat(overlap).isEmpty();
        }

        @Test
        @DisplayName("missing limit defaults to 50")
        void defaultLimit() {
            var page = service.query(AuditLogQuery.all());

            assertThat(page.limit()).isEqualTo(50);
            assertThat(page.items()).hasSize(50);
        }

        @Test
        @DisplayName("limit is clamped to 100 and offset to 0")
        void clamped() {
            var page = service.query(AuditLogQuery.builder().limit(500).offset(-5).build());

            assertThat(page.limit()).isEqualTo(100);
            assertThat(page.offset()).isZero();
            assertThat(page.items()).hasSize(100);
        }
    }

    @Nested
    @DisplayName("views")
    class Views {

        @Test
        @DisplayName("email logs filter by delivery status")
        void emailLogs() {
            append(
                    entry(1, LogType.EMAIL)
                            .details(EmailDetails.sent("a@example.com", "Certificate").withExtra(Map.of("provider", "resend"))));
            append(entry(2, LogType.EMAIL).details(EmailDetails.failed("b@example.com", null, "bounced")));

            var failed = service.emailLogs("failed", null, null);

            assertThat(failed.items())
                    .singleElement()
                    .satisfies(
                            view -> {
                                assertThat(view.recipientEmail()).isEqualTo("b@example.com");
                                assertThat(view.status()).isEqualTo("failed");
                                assertThat(view.errorMessage()).isEqualTo("bounced");
                                assertThat(view.provider()).isEqualTo("system");
                            });
            assertThat(service.emailLogs(null, null, null).items()).hasSize(2);
        }

        @Test
        @DisplayName("system logs filter by level")
        void systemLogs() {
            append(entry(1, LogType.SYSTEM));
            append(AuditLogEntry.builder(LogType.SYSTEM, LogLevel.ERROR).id("id-err").createdAt(BASE));
            append(entry(3, LogType.AUTH));

            assertThat(ids(service.systemLogs(LogLevel.ERROR, null, null))).containsExactly("id-err");
            assertThat(service.systemLogs(null, null, null).items()).hasSize(2);
        }

        @Test
        @DisplayName("join carries the user's display name or the unknown-user placeholder")
        void userJoin() {
            append(entry(1, LogType.USER_ACTIVITY).userId("u-1"));
            append(entry(2, LogType.USER_ACTIVITY).userId("deleted-user").userEmail("gone@lpgcert.test"));
            append(entry(3, LogType.SYSTEM));

            var page = service.query(AuditLogQuery.all());

            assertThat(page.items())
                    .extracting(AuditLogView::userDisplayName)
                    .containsExactly(null, "Unknown User", "Jane Doe");
            assertThat(page.items().get(1).userEmail()).isEqualTo("gone@lpgcert.test");
        }
    }

    @Test
    @DisplayName("a failing store yields an unavailable empty page")
    void degradedRead() {
        store.failWith(new IllegalStateException("connection reset"));

        var page = service.query(AuditLogQuery.builder().limit(20).build());

        assertThat(page.available()).isFalse();
        assertThat(page.items()).isEmpty();
        assertThat(page.limit()).isEqualTo(20);
        assertThat(registry.find("audit.queries.failed").counter().count()).isEqualTo(1.0);
    }
}
