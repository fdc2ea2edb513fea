package com.lpgcert.auditmodel;

import java.util.UUID;

/** Generates opaque identifiers that link causally related audit entries. */
public final class CorrelationIds {

    private CorrelationIds() {
        // utility class
    }

    /** Returns a new random (version 4) UUID string. */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
