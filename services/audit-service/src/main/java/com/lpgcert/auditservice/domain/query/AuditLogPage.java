package com.lpgcert.auditservice.domain.query;

import java.util.List;
import java.util.function.Function;

/**
 * One page of query results.
 *
 * @param items results, newest first
 * @param limit effective page size
 * @param offset effective offset
 * @param available false when the store could not be read; {@code items} is then empty
 */
public record AuditLogPage<T>(List<T> items, int limit, int offset, boolean available) {

    public AuditLogPage {
        items = List.copyOf(items);
    }

    public static <T> AuditLogPage<T> unavailable(int limit, int offset) {
        return new AuditLogPage<>(List.of(), limit, offset, false);
    }

    public <R> AuditLogPage<R> map(Function<T, R> mapper) {
        return new AuditLogPage<>(items.stream().map(mapper).toList(), limit, offset, available);
    }
}
