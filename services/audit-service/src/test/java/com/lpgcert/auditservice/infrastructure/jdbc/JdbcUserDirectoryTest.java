package com.lpgcert.auditservice.infrastructure.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.lpgcert.security.UserIdentity;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@DisplayName("JdbcUserDirectory")
class JdbcUserDirectoryTest {

    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    private final JdbcUserDirectory directory = new JdbcUserDirectory(jdbc);

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("returns the matching user")
    void findsUser() {
        var user = new UserIdentity("u-1", "jane@lpgcert.test", "jane", "Jane", "Doe", "Admin");
        when(jdbc.query(eq(JdbcUserDirectory.FIND_BY_ID), anyMap(), any(RowMapper.class)))
                .thenReturn(List.of(user));

        assertThat(directory.findById("u-1")).contains(user);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("is empty when no row matches")
    void noMatch() {
        when(jdbc.query(eq(JdbcUserDirectory.FIND_BY_ID), anyMap(), any(RowMapper.class)))
                .thenReturn(List.of());

        assertThat(directory.findById("ghost")).isEmpty();
    }

    @Test
    @DisplayName("does not query for a blank id")
    void blankId() {
        assertThat(directory.findById(" ")).isEmpty();
        verifyNoInteractions(jdbc);
    }
}
