package com.lpgcert.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("stores the values used by the users table")
    void storedValues() {
        assertThat(Role.USER.value()).isEqualTo("User");
        assertThat(Role.ADMIN.value()).isEqualTo("Admin");
        assertThat(Role.SUPER_ADMIN.value()).isEqualTo("Super Admin");
    }

    @Test
    @DisplayName("SUPER_ADMIN implies ADMIN and USER")
    void superAdminHierarchy() {
        assertThat(Role.SUPER_ADMIN.implies(Role.ADMIN)).isTrue();
        assertThat(Role.SUPER_ADMIN.implies(Role.USER)).isTrue();
        assertThat(Role.ADMIN.implies(Role.SUPER_ADMIN)).isFalse();
        assertThat(Role.USER.impliedRoles()).isEmpty();
    }

    @Test
    @DisplayName("fromString ignores case and whitespace")
    void fromString() {
        assertThat(Role.fromString(" super admin ")).contains(Role.SUPER_ADMIN);
        assertThat(Role.fromString("Operator")).isEmpty();
        assertThat(Role.fromString(null)).isEmpty();
        assertThat(Role.isKnown("Admin")).isTrue();
    }
}
