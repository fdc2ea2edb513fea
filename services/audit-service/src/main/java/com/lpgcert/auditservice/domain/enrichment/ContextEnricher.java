package com.lpgcert.auditservice.domain.enrichment;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.observability.SensitiveDataRedactor;
import com.lpgcert.security.UserDirectory;
import com.lpgcert.security.UserIdentity;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills network and identity fields of an entry before it is written.
 *
 * <p>Values already present on the entry always win; derived values fill the gaps; anything that
 * cannot be derived stays null. A failing user lookup is logged and leaves the identity fields
 * empty.
 */
public class ContextEnricher {

    static final String USER_AGENT = "user-agent";

    private static final Logger log = LoggerFactory.getLogger(ContextEnricher.class);

    private final UserDirectory userDirectory;
    private final SensitiveDataRedactor redactor;
    private final boolean captureHeaders;

    public ContextEnricher(
            UserDirectory userDirectory, SensitiveDataRedactor redactor, boolean captureHeaders) {
        this.userDirectory = userDirectory;
        this.redactor = redactor;
        this.captureHeaders = captureHeaders;
    }

    /**
     * @param entry the partial entry built by an emitter
     * @param request snapshot of the triggering request, nullable
     * @return the enriched entry
     */
    public AuditLogEntry enrich(AuditLogEntry entry, RequestSnapshot request) {
        AuditLogEntry.Builder builder = entry.toBuilder();
        if (request != null) {
            builder.ipAddress(
                    firstNonNull(entry.ipAddress(), ClientIpResolver.resolve(request).orElse(null)));
            builder.userAgent(firstNonNull(entry.userAgent(), request.header(USER_AGENT)));
            builder.requestMethod(firstNonNull(entry.requestMethod(), request.method()));
            builder.requestPath(firstNonNull(entry.requestPath(), request.path()));
            if (captureHeaders && entry.requestHeaders() == null) {
                builder.requestHeaders(redactor.redactHeaders(request.headers()));
            }
        }
        if (needsIdentity(entry)) {
            lookUp(entry.userId())
                    .ifPresent(
                            user -> {
                                builder.userEmail(firstNonNull(entry.userEmail(), user.email()));
                                builder.userName(firstNonNull(entry.userName(), user.displayName()));
                                builder.userRole(firstNonNull(entry.userRole(), user.role()));
                            });
        }
        return builder.build();
    }

    private static boolean needsIdentity(AuditLogEntry entry) {
        return entry.userId() != null
                && (entry.userEmail() == null || entry.userName() == null || entry.userRole() == null);
    }

    private Optional<UserIdentity> lookUp(String userId) {
        try {
            return userDirectory.findById(userId);
        } catch (RuntimeException e) {
            log.warn("User lookup failed during audit enrichment for userId={}: {}", userId, e.toString());
            return Optional.empty();
        }
    }

    private static String firstNonNull(String explicit, String derived) {
        return explicit != null ? explicit : derived;
    }
}
