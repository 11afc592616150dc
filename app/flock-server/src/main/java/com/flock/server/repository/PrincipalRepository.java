/*
 * Where: Flock data access
 * What: Reads and registers rows of the principals table
 * Why: Every authenticated call and every registration goes through this lookup
 */
package com.flock.server.repository;

import static com.flock.common.JdbcTimestampUtils.toInstant;
import static com.flock.common.JdbcTimestampUtils.toTimestamp;

import com.flock.server.model.Principal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PrincipalRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Principal> findByUsername(String username) {
    final String sql =
        """
        SELECT username, name, token, created_at
        FROM principals
        WHERE username = :username
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("username", username);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Returns 0 when the username is already taken; the existing row is left untouched. */
  public int insertIfAbsent(Principal principal) {
    final String sql =
        """
        INSERT INTO principals (username, name, token, created_at)
        VALUES (:username, :name, :token, :createdAt)
        ON CONFLICT (username) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", principal.username())
            .addValue("name", principal.name())
            .addValue("token", principal.token())
            .addValue("createdAt", toTimestamp(principal.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  private Principal mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Principal(
        rs.getString("username"),
        rs.getString("name"),
        rs.getString("token"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
