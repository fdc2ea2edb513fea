package com.lpgcert.security.testing;

import com.lpgcert.security.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryUserDirectory")
class InMemoryUserDirectoryTest {

    @Test
    @DisplayName("finds added users and derives the username from the email")
    void findsUsers() {
        var directory = new InMemoryUserDirectory().add("u-1", "jane@lpg.test", "Jane", "Doe", Role.ADMIN);

        var user = directory.findById("u-1");

        assertThat(user).isPresent();
        assertThat(user.get().username()).isEqualTo("jane");
        assertThat(user.get().role()).isEqualTo("Admin");
        assertThat(directory.findById(null)).isEmpty();
        assertThat(directory.findById("u-2")).isEmpty();
    }

    @Test
    @DisplayName("throws the configured failure on every lookup")
    void failureInjection() {
        var directory = new InMemoryUserDirectory();
        directory.failWith(new IllegalStateException("db down"));

        assertThatThrownBy(() -> directory.findById("u-1")).hasMessage("db down");
    }
}
