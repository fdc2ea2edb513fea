package com.lpgcert.auditservice.infrastructure.jdbc;

import com.lpgcert.security.UserDirectory;
import com.lpgcert.security.UserIdentity;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** {@link UserDirectory} over the {@code users} identity projection. */
public class JdbcUserDirectory implements UserDirectory {

    static final String FIND_BY_ID =
            "SELECT id, email, username, first_name, last_name, role FROM users WHERE id = :id";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcUserDirectory(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<UserIdentity> findById(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        List<UserIdentity> users =
                jdbc.query(
                        FIND_BY_ID,
                        Map.of("id", userId),
                        (rs, rowNum) ->
                                new UserIdentity(
                                        rs.getString("id"),
                                        rs.getString("email"),
                                        rs.getString("username"),
                                        rs.getString("first_name"),
                                        rs.getString("last_name"),
                                        rs.getString("role")));
        return users.stream().findFirst();
    }
}
