package com.lpgcert.auditservice.domain.query;

import com.lpgcert.auditmodel.AuditLogEntry;

/**
 * An entry joined with the current user projection.
 *
 * @param entry the stored entry
 * @param username current username of the entry's user, nullable
 * @param userEmail current email of the user, falling back to the email captured at write time
 * @param userDisplayName "first last" when the user exists, {@code Unknown User} when the entry
 *     names a user that no longer exists, null for entries without a user
 */
public record AuditLogView(
        AuditLogEntry entry, String username, String userEmail, String userDisplayName) {

    public AuditLogView {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
    }

    /** View of an entry with no joined user data. */
    public static AuditLogView of(AuditLogEntry entry) {
        return new AuditLogView(entry, null, entry.userEmail(), null);
    }
}
