package com.lpgcert.security;

import java.util.Optional;

/**
 * Projection of an application user as seen by the audit subsystem.
 *
 * @param userId    unique user identifier
 * @param email     email address, nullable
 * @param username  login name, nullable
 * @param firstName given name, nullable
 * @param lastName  family name, nullable
 * @param role      stored role string (e.g. "Admin"), nullable
 */
public record UserIdentity(
        String userId,
        String email,
        String username,
        String firstName,
        String lastName,
        String role
) {

    /** Placeholder shown for entries whose user no longer exists. */
    public static final String UNKNOWN_USER = "Unknown User";

    public UserIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    /**
     * First and last name joined by a space, or null when neither is known.
     */
    public String displayName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        String joined = (first + " " + last).trim();
        return joined.isEmpty() ? null : joined;
    }

    /** Parsed role, empty when the stored value is missing or unrecognised. */
    public Optional<Role> parsedRole() {
        return Role.fromString(role);
    }
}
