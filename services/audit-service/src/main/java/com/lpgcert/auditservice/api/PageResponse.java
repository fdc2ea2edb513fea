package com.lpgcert.auditservice.api;

import com.lpgcert.auditservice.domain.query.AuditLogPage;
import java.util.List;
import java.util.function.Function;

/**
 * One page of results.
 *
 * @param count number of items on this page
 * @param available false when the audit store could not be read
 */
public record PageResponse<T>(List<T> items, int limit, int offset, int count, boolean available) {

    public static <S, T> PageResponse<T> from(AuditLogPage<S> page, Function<S, T> mapper) {
        List<T> items = page.items().stream().map(mapper).toList();
        return new PageResponse<>(items, page.limit(), page.offset(), items.size(), page.available());
    }
}
