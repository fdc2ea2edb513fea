package com.lpgcert.auditservice.infrastructure.web;

import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Copies the audit-relevant parts of a servlet request into a {@link RequestSnapshot}. */
public final class ServletRequestSnapshots {

    private ServletRequestSnapshots() {
        // utility class
    }

    /** Returns the snapshot, or null when there is no request. */
    public static RequestSnapshot from(HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, String.join(", ", Collections.list(request.getHeaders(name))));
        }
        return RequestSnapshot.of(request.getMethod(), request.getRequestURI(), headers);
    }
}
