package com.lpgcert.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MetricFactory}.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "audit-service");
    }

    @Test
    @DisplayName("should tag counters with the service name")
    void shouldTagCounters() {
        factory.counter("audit.entries.written", "written", "log_type", "email").increment();

        var counter = registry.find("audit.entries.written")
                .tag("service", "audit-service")
                .tag("log_type", "email")
                .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return the same counter for the same name and tags")
    void shouldReuseCounters() {
        factory.counter("audit.entries.failed", "failed").increment();
        factory.counter("audit.entries.failed", "failed").increment();

        assertThat(registry.get("audit.entries.failed").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should sample gauges from the supplier")
    void shouldSampleGauges() {
        AtomicInteger depth = new AtomicInteger(3);
        factory.gauge("audit.dispatcher.queue.size", "queue depth", depth::get);
        depth.set(7);

        assertThat(registry.get("audit.dispatcher.queue.size").gauge().value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("should reject a blank service name")
    void shouldRejectBlankServiceName() {
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }
}
