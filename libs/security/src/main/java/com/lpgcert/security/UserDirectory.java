package com.lpgcert.security;

import java.util.Optional;

/**
 * Lookup of application users by id.
 * <p>
 * Implementations may throw unchecked exceptions on infrastructure failure; callers on
 * best-effort paths (audit enrichment) catch and degrade.
 */
public interface UserDirectory {

    /**
     * @param userId the user id, may be null
     * @return the user, or empty when the id is null or unknown
     */
    Optional<UserIdentity> findById(String userId);
}
