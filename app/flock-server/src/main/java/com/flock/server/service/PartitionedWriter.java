/*
 * Where: Flock service layer
 * What: Stamps validated telemetry records and appends them to the current day partition
 * Why: The store keeps the durable copy; notifications are only advisory
 */
package com.flock.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.server.config.FlockIngestProperties;
import com.flock.server.model.PartitionWriteResult;
import com.flock.server.model.ValidatedBatch;
import com.flock.server.repository.TelemetryRecordRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PartitionedWriter {

  private static final Logger logger = LoggerFactory.getLogger(PartitionedWriter.class);
  static final String TIMESTAMP_FIELD = "@timestamp";
  static final String UNIX_TIME_FIELD = "unixTime";
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'.000Z'").withZone(ZoneOffset.UTC);
  private static final Pattern INTEGER_TEXT = Pattern.compile("-?\\d+");
  // four-digit years only: 0001-01-01T00:00:00Z .. 9999-12-31T23:59:59Z
  private static final long MIN_EPOCH_SECOND = -62135596800L;
  private static final long MAX_EPOCH_SECOND = 253402300799L;

  private final TelemetryRecordRepository telemetryRecordRepository;
  private final FlockIngestProperties properties;
  private final FlockMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Appends every record of the batch; a failed record is logged and skipped.
   *
   * <p>There is no dedup: a retried submission is stored twice. The partition follows the
   * processing date, so late events land in the day they were received.
   */
  public PartitionWriteResult write(ValidatedBatch batch, String submitter, String displayName) {
    final Instant now = Instant.now(clock);
    final String partition = partitionFor(now);
    final List<ObjectNode> documents = new ArrayList<>(batch.size());
    int written = 0;
    int failed = 0;
    Exception lastFailure = null;
    for (ObjectNode record : batch.records()) {
      final ObjectNode document = stamp(record, submitter, displayName);
      try {
        telemetryRecordRepository.append(
            partition,
            properties.category(),
            submitter,
            objectMapper.writeValueAsString(document),
            now);
        written++;
        documents.add(document);
      } catch (DataAccessException | JsonProcessingException ex) {
        failed++;
        lastFailure = ex;
        logger.warn("telemetry record write failed partition={} username={}", partition, submitter, ex);
      }
    }
    metrics.recordWrites(written, failed);
    if (written == 0 && failed > 0) {
      throw new UpstreamUnavailableException("telemetry store rejected every record", lastFailure);
    }
    logger.info(
        "telemetry batch written partition={} written={} failed={}", partition, written, failed);
    return new PartitionWriteResult(partition, written, failed, documents);
  }

  @VisibleForTesting
  String partitionFor(Instant now) {
    final LocalDate day = LocalDate.ofInstant(now, clock.getZone());
    return properties.partitionPrefix() + day.format(DateTimeFormatter.ISO_LOCAL_DATE);
  }

  @VisibleForTesting
  ObjectNode stamp(ObjectNode record, String submitter, String displayName) {
    final ObjectNode document = record.deepCopy();
    parseUnixTime(document.get(UNIX_TIME_FIELD))
        .ifPresent(
            seconds ->
                document.put(
                    TIMESTAMP_FIELD, TIMESTAMP_FORMAT.format(Instant.ofEpochSecond(seconds))));
    document.put("username", submitter);
    document.put("user_name", displayName);
    return document;
  }

  // absent, non-numeric or out-of-range unixTime is passed through untouched
  private Optional<Long> parseUnixTime(JsonNode value) {
    if (value == null) {
      return Optional.empty();
    }
    if (value.isIntegralNumber()) {
      return value.canConvertToLong() ? inTimestampRange(value.asLong()) : Optional.empty();
    }
    if (value.isNumber()) {
      final double seconds = value.asDouble();
      if (!Double.isFinite(seconds)
          || seconds < MIN_EPOCH_SECOND
          || seconds >= MAX_EPOCH_SECOND + 1) {
        return Optional.empty();
      }
      return Optional.of((long) seconds);
    }
    if (value.isTextual() && INTEGER_TEXT.matcher(value.asText().trim()).matches()) {
      try {
        return inTimestampRange(Long.parseLong(value.asText().trim()));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static Optional<Long> inTimestampRange(long seconds) {
    if (seconds < MIN_EPOCH_SECOND || seconds > MAX_EPOCH_SECOND) {
      return Optional.empty();
    }
    return Optional.of(seconds);
  }
}
