package com.lpgcert.auditservice.domain.write;

/**
 * Point-in-time view of the dispatcher.
 *
 * @param queued entries waiting for a worker
 * @param remainingCapacity free queue slots
 * @param activeWorkers workers currently writing
 * @param completed entries handed to the writer so far
 * @param dropped entries rejected because the queue was full or the dispatcher stopped
 */
public record DispatcherStats(
        int queued, int remainingCapacity, int activeWorkers, long completed, long dropped) {}
