package com.lpgcert.auditservice.domain.enrichment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable copy of the parts of an inbound request that enrichment reads.
 *
 * <p>Header names are lower-cased. The path never carries a query string. Servlet requests are
 * recycled once the response is committed, so emitters hand this copy to the background writer
 * instead of the request itself.
 *
 * @param headers request headers keyed by lower-case name; repeated headers are joined with ", "
 * @param method HTTP method, nullable
 * @param path request path without query string, nullable
 */
public record RequestSnapshot(Map<String, String> headers, String method, String path) {

    public RequestSnapshot {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach(
                    (name, value) -> {
                        if (name != null && value != null) {
                            normalized.merge(
                                    name.toLowerCase(Locale.ROOT), value, (a, b) -> a + ", " + b);
                        }
                    });
        }
        headers = Collections.unmodifiableMap(normalized);
        if (path != null) {
            int query = path.indexOf('?');
            path = query >= 0 ? path.substring(0, query) : path;
        }
    }

    public static RequestSnapshot of(String method, String path, Map<String, String> headers) {
        return new RequestSnapshot(headers, method, path);
    }

    /** Header value by case-insensitive name, or null. */
    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }
}
