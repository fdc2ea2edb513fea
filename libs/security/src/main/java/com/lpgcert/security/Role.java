package com.lpgcert.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Application roles as stored in the {@code users.role} column.
 * <p>
 * The hierarchy is encoded once here: SUPER_ADMIN implies ADMIN and USER, ADMIN implies USER.
 */
public enum Role {

    USER("User"),
    ADMIN("Admin"),
    SUPER_ADMIN("Super Admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The stored string representation (e.g., "Super Admin"). */
    public String value() {
        return value;
    }

    /**
     * Returns the set of roles that this role implies (inherits).
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case SUPER_ADMIN -> EnumSet.of(ADMIN, USER);
            case ADMIN -> EnumSet.of(USER);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role
     * (either directly or through the hierarchy).
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by its stored value, ignoring case and surrounding whitespace.
     *
     * @param value the string to match (e.g., "admin")
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
