package com.lpgcert.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "tenant-1", "user-1", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(CorrelationContextHolder.currentCorrelationId()).contains("corr-1");
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "tenant-1", "user-1", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("tenantId")).isEqualTo("tenant-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should remove MDC keys for null fields and on clear")
        void shouldClearMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "tenant-1", "user-1", null));
            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-2");
            assertThat(MDC.get("userId")).isNull();

            CorrelationContextHolder.clear();
            assertThat(MDC.get("correlationId")).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class ScopedExecution {

        @Test
        @DisplayName("should set context for the runnable and restore the previous one")
        void shouldRestorePrevious() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));
            AtomicReference<String> seen = new AtomicReference<>();

            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"),
                    () -> seen.set(CorrelationContextHolder.currentCorrelationId().orElse(null)));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.currentCorrelationId()).contains("outer");
        }

        @Test
        @DisplayName("should run without context when given null and clear afterwards")
        void shouldRunWithoutContext() {
            String result = CorrelationContextHolder.callWithContext(null,
                    () -> CorrelationContextHolder.currentCorrelationId().orElse("none"));

            assertThat(result).isEqualTo("none");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even when the work throws")
        void shouldRestoreOnException() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"), () -> {
                throw new IllegalStateException("boom");
            })).hasMessage("boom");

            assertThat(CorrelationContextHolder.currentCorrelationId()).contains("outer");
        }

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(CorrelationContext.of("main"));
            AtomicReference<Boolean> otherHasContext = new AtomicReference<>();

            Thread other = new Thread(() -> otherHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherHasContext.get()).isFalse();
        }
    }
}
