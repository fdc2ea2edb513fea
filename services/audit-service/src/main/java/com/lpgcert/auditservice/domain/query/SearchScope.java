package com.lpgcert.auditservice.domain.query;

/** Columns a free-text search looks at. Matching is a case-insensitive substring test. */
public enum SearchScope {
    /** The message only. */
    MESSAGE,
    /** Message, action, username and user email. */
    ADMIN
}
