package com.lpgcert.auditservice.domain.enrichment;

import java.util.List;
import java.util.Optional;

/**
 * Derives the client address from proxy headers.
 *
 * <p>Headers are consulted in {@link #HEADER_PRIORITY} order. For each present header the first
 * comma-separated value is trimmed; the first value that is non-empty and not {@code unknown} wins.
 */
public final class ClientIpResolver {

    public static final List<String> HEADER_PRIORITY =
            List.of(
                    "x-forwarded-for",
                    "x-real-ip",
                    "cf-connecting-ip",
                    "x-client-ip",
                    "x-forwarded",
                    "forwarded-for",
                    "forwarded");

    private static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
        // utility class
    }

    public static Optional<String> resolve(RequestSnapshot request) {
        if (request == null) {
            return Optional.empty();
        }
        for (String header : HEADER_PRIORITY) {
            String value = request.header(header);
            if (value == null) {
                continue;
            }
            String candidate = value.split(",", -1)[0].trim();
            if (!candidate.isEmpty() && !UNKNOWN.equalsIgnoreCase(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
