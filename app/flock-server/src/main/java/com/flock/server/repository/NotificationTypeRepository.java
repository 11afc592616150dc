/*
 * Where: Flock data access
 * What: Reads and updates per-kind enablement in notification_types
 * Why: Admin toggles must survive restarts and be visible to every instance
 */
package com.flock.server.repository;

import static com.flock.common.JdbcTimestampUtils.toTimestamp;

import com.flock.server.model.NotificationCategory;
import com.flock.server.model.NotificationTypeConfig;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationTypeRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<NotificationTypeConfig> findAll() {
    final String sql =
        """
        SELECT kind, category, enabled
        FROM notification_types
        ORDER BY kind
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<NotificationTypeConfig> findByKind(String kind) {
    final String sql =
        """
        SELECT kind, category, enabled
        FROM notification_types
        WHERE kind = :kind
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("kind", kind);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Seeds a kind without overwriting an enablement an administrator already chose. */
  public int insertIfAbsent(NotificationTypeConfig config, Instant now) {
    final String sql =
        """
        INSERT INTO notification_types (kind, category, enabled, updated_at)
        VALUES (:kind, :category, :enabled, :updatedAt)
        ON CONFLICT (kind) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("kind", config.kind())
            .addValue("category", config.category().name())
            .addValue("enabled", config.enabled())
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<NotificationTypeConfig> updateEnabled(String kind, boolean enabled, Instant now) {
    final String sql =
        """
        UPDATE notification_types
        SET enabled = :enabled,
            updated_at = :updatedAt
        WHERE kind = :kind
        RETURNING kind, category, enabled
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("kind", kind)
            .addValue("enabled", enabled)
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private NotificationTypeConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationTypeConfig(
        rs.getString("kind"),
        NotificationCategory.valueOf(rs.getString("category")),
        rs.getBoolean("enabled"));
  }
}
