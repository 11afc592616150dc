/*
 * Where: Flock data access
 * What: Appends telemetry documents into day partitions of telemetry_records
 * Why: The document store is a write sink; no dedup or update path exists
 */
package com.flock.server.repository;

import static com.flock.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TelemetryRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void append(
      String partition, String category, String username, String documentJson, Instant ingestedAt) {
    final String sql =
        """
        INSERT INTO telemetry_records (
          partition_name,
          category,
          username,
          document,
          ingested_at
        ) VALUES (
          :partition,
          :category,
          :username,
          :document::jsonb,
          :ingestedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("partition", partition)
            .addValue("category", category)
            .addValue("username", username)
            .addValue("document", documentJson)
            .addValue("ingestedAt", toTimestamp(ingestedAt));
    jdbcTemplate.update(sql, params);
  }

  public int countByPartition(String partition) {
    final String sql = "SELECT COUNT(*) FROM telemetry_records WHERE partition_name = :partition";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("partition", partition);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** Documents of one partition in insertion order. */
  public List<String> findDocumentsByPartition(String partition) {
    final String sql =
        """
        SELECT document::text AS document_text
        FROM telemetry_records
        WHERE partition_name = :partition
        ORDER BY record_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("partition", partition);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("document_text"));
  }
}
