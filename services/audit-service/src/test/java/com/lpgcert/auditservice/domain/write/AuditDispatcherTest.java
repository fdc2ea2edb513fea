package com.lpgcert.auditservice.domain.write;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.enrichment.ContextEnricher;
import com.lpgcert.auditservice.domain.query.AuditLogQuery;
import com.lpgcert.auditservice.domain.query.AuditLogView;
import com.lpgcert.auditservice.testing.InMemoryAuditLogStore;
import com.lpgcert.observability.CorrelationContext;
import com.lpgcert.observability.CorrelationContextHolder;
import com.lpgcert.observability.MetricFactory;
import com.lpgcert.observability.SensitiveDataRedactor;
import com.lpgcert.security.testing.InMemoryUserDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditDispatcher")
class AuditDispatcherTest {

    private SimpleMeterRegistry registry;
    private MetricFactory metrics;
    private InMemoryUserDirectory directory;
    private AuditDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricFactory(registry, "audit-service");
        directory = new InMemoryUserDirectory();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
        CorrelationContextHolder.clear();
    }

    private AuditDispatcher dispatcher(AuditLogStore store, int capacity) {
        var writer =
                new AuditLogWriter(
                        store,
                        new ContextEnricher(directory, new SensitiveDataRedactor(), false),
                        Clock.systemUTC(),
                        metrics);
        return new AuditDispatcher(writer, capacity, 1, Duration.ofSeconds(2), metrics);
    }

    private static AuditLogEntry entry(String action) {
        return AuditLogEntry.builder(LogType.SYSTEM, LogLevel.INFO).action(action).build();
    }

    @Test
    @DisplayName("writes submitted entries in the background")
    void writesInBackground() {
        var store = new InMemoryAuditLogStore(directory);
        dispatcher = dispatcher(store, 10);

        Optional<String> id = dispatcher.submit(entry("SYSTEM_EVENT"), null).join();

        assertThat(id).isPresent();
        assertThat(store.entries()).extracting(AuditLogEntry::id).containsExactly(id.get());
    }

    @Test
    @DisplayName("restores the caller's correlation context on the worker")
    void propagatesCorrelationContext() {
        var seen = new AtomicReference<String>();
        var store =
                new InMemoryAuditLogStore(directory) {
                    @Override
                    public void append(AuditLogEntry entry) {
                        seen.set(CorrelationContextHolder.currentCorrelationId().orElse(null));
                        super.append(entry);
                    }
                };
        dispatcher = dispatcher(store, 10);
        CorrelationContextHolder.set(CorrelationContext.of("corr-42"));

        dispatcher.submit(entry("SYSTEM_EVENT"), null).join();

        assertThat(seen.get()).isEqualTo("corr-42");
    }

    @Test
    @DisplayName("drops entries when the queue is full")
    void dropsWhenSaturated() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        AuditLogStore blocking =
                new AuditLogStore() {
                    @Override
                    public void append(AuditLogEntry entry) {
                        started.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }

                    @Override
                    public List<AuditLogView> search(AuditLogQuery query) {
                        return List.of();
                    }

                    @Override
                    public int deleteExpired(Instant now, int defaultRetentionDays) {
                        return 0;
                    }
                };
        dispatcher = dispatcher(blocking, 1);

        CompletableFuture<Optional<String>> inFlight = dispatcher.submit(entry("FIRST"), null);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Optional<String>> queued = dispatcher.submit(entry("SECOND"), null);
        CompletableFuture<Optional<String>> dropped = dispatcher.submit(entry("THIRD"), null);

        assertThat(dropped).isCompletedWithValue(Optional.empty());
        assertThat(dispatcher.stats().dropped()).isEqualTo(1);
        assertThat(registry.find("audit.entries.dropped").counter().count()).isEqualTo(1.0);

        release.countDown();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isPresent();
        assertThat(queued.get(5, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    @DisplayName("rejects a non-positive queue capacity")
    void rejectsInvalidCapacity() {
        var store = new InMemoryAuditLogStore(directory);
        assertThatThrownBy(() -> dispatcher(store, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
