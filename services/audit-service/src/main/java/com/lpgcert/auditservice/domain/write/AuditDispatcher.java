package com.lpgcert.auditservice.domain.write;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;
import com.lpgcert.observability.CorrelationContext;
import com.lpgcert.observability.CorrelationContextHolder;
import com.lpgcert.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Bounded fire-and-forget hand-off from request threads to the {@link AuditLogWriter}.
 *
 * <p>Entries are queued on an {@link ArrayBlockingQueue} and written by a fixed pool of daemon
 * workers. When the queue is full the entry is dropped: the caller's future completes with {@link
 * Optional#empty()}, the drop is counted in {@code audit.entries.dropped} and logged at WARN. The
 * caller's {@link CorrelationContext} is restored on the worker so writer logs keep the request's
 * correlation id.
 */
public class AuditDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditDispatcher.class);

    private final AuditLogWriter writer;
    private final ThreadPoolExecutor executor;
    private final Duration drainTimeout;
    private final Counter droppedCounter;
    private final AtomicLong dropped = new AtomicLong();

    public AuditDispatcher(
            AuditLogWriter writer,
            int queueCapacity,
            int workerThreads,
            Duration drainTimeout,
            MetricFactory metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        this.writer = writer;
        this.drainTimeout = drainTimeout;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("audit-writer-");
        threadFactory.setDaemon(true);
        this.executor =
                new ThreadPoolExecutor(
                        workerThreads,
                        workerThreads,
                        0L,
                        TimeUnit.MILLISECONDS,
                        new ArrayBlockingQueue<>(queueCapacity),
                        threadFactory,
                        new ThreadPoolExecutor.AbortPolicy());
        this.droppedCounter =
                metrics.counter("audit.entries.dropped", "Audit entries dropped by a saturated dispatcher");
        metrics.gauge(
                "audit.dispatcher.queue.size",
                "Audit entries waiting to be written",
                () -> executor.getQueue().size());
    }

    /**
     * Queues the entry for writing.
     *
     * @return a future completed with the stored id, or with empty if the entry was dropped or
     *     could not be written
     */
    public CompletableFuture<Optional<String>> submit(AuditLogEntry entry, RequestSnapshot request) {
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        CompletableFuture<Optional<String>> result = new CompletableFuture<>();
        try {
            executor.execute(
                    () -> {
                        try {
                            result.complete(
                                    CorrelationContextHolder.callWithContext(
                                            context, () -> writer.write(entry, request)));
                        } catch (RuntimeException e) {
                            result.completeExceptionally(e);
                        }
                    });
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            droppedCounter.increment();
            log.warn(
                    "Audit dispatcher saturated, dropping entry log_type={} action={}",
                    entry.logType() == null ? null : entry.logType().value(),
                    entry.action());
            result.complete(Optional.empty());
        }
        return result;
    }

    public DispatcherStats stats() {
        return new DispatcherStats(
                executor.getQueue().size(),
                executor.getQueue().remainingCapacity(),
                executor.getActiveCount(),
                executor.getCompletedTaskCount(),
                dropped.get());
    }

    /**
     * Stops accepting entries and waits up to the drain timeout for queued ones to be written.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int abandoned = executor.shutdownNow().size();
                log.warn("Audit dispatcher drain timed out, {} queued entries abandoned", abandoned);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
