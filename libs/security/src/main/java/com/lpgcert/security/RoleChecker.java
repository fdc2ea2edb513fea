package com.lpgcert.security;

/**
 * Role checks with hierarchy support.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the user holds the required role directly or via the hierarchy.
     * Users with a missing or unrecognised role hold nothing.
     */
    public static boolean hasRole(UserIdentity user, Role required) {
        return user != null && user.parsedRole()
                .map(role -> role.implies(required))
                .orElse(false);
    }

    /**
     * Checks if the user holds ANY of the required roles.
     */
    public static boolean hasAnyRole(UserIdentity user, Role... required) {
        for (Role role : required) {
            if (hasRole(user, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Administrative access: Admin or Super Admin.
     */
    public static boolean isAdmin(UserIdentity user) {
        return hasRole(user, Role.ADMIN);
    }

    /**
     * Throws unless the user is an administrator.
     *
     * @throws AccessDeniedException if the user lacks the Admin role
     */
    public static void requireAdmin(UserIdentity user) {
        if (!isAdmin(user)) {
            throw new AccessDeniedException(
                    "Admin access required for user '%s'".formatted(user == null ? null : user.userId()));
        }
    }
}
