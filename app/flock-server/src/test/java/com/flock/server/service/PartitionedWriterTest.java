package com.flock.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.server.config.FlockIngestProperties;
import com.flock.server.model.PartitionWriteResult;
import com.flock.server.model.ValidatedBatch;
import com.flock.server.repository.TelemetryRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PartitionedWriterTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-14T23:59:30Z");

  @Mock private TelemetryRecordRepository telemetryRecordRepository;
  @Mock private FlockMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private PartitionedWriter writer;

  @BeforeEach
  void setUp() {
    writer =
        new PartitionedWriter(
            telemetryRecordRepository,
            new FlockIngestProperties(null, null),
            metrics,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void writesEveryRecordIntoTheProcessingDayPartition() throws Exception {
    // unixTime points at a different day; the partition still follows the clock
    final ValidatedBatch batch =
        batch(
            """
            [{"hostIdentifier":"alice","unixTime":1262304000},
             {"hostIdentifier":"alice","name":"launchd"}]
            """);

    final PartitionWriteResult result = writer.write(batch, "alice", "Alice");

    assertThat(result.partition()).isEqualTo("flock-2026-03-14");
    assertThat(result.written()).isEqualTo(2);
    assertThat(result.failed()).isZero();
    final ArgumentCaptor<String> documents = ArgumentCaptor.forClass(String.class);
    verify(telemetryRecordRepository, times(2))
        .append(eq("flock-2026-03-14"), eq("osquery"), eq("alice"), documents.capture(), eq(FIXED_NOW));
    final ObjectNode first = (ObjectNode) objectMapper.readTree(documents.getAllValues().get(0));
    assertThat(first.get("@timestamp").asText()).isEqualTo("2010-01-01T00:00:00.000Z");
    assertThat(first.get("username").asText()).isEqualTo("alice");
    assertThat(first.get("user_name").asText()).isEqualTo("Alice");
    verify(metrics).recordWrites(2, 0);
  }

  @Test
  void stampDoesNotMutateTheInput() throws Exception {
    final ObjectNode record = (ObjectNode) objectMapper.readTree("{\"unixTime\":\"60\"}");

    final ObjectNode stamped = writer.stamp(record, "alice", "Alice");

    assertThat(stamped.get("@timestamp").asText()).isEqualTo("1970-01-01T00:01:00.000Z");
    assertThat(record.has("@timestamp")).isFalse();
    assertThat(record.has("username")).isFalse();
  }

  @Test
  void nonNumericUnixTimeIsPassedThrough() throws Exception {
    final ObjectNode record =
        (ObjectNode) objectMapper.readTree("{\"unixTime\":\"yesterday\",\"@timestamp\":\"keep\"}");

    final ObjectNode stamped = writer.stamp(record, "alice", "");

    assertThat(stamped.get("@timestamp").asText()).isEqualTo("keep");
    assertThat(stamped.get("unixTime").asText()).isEqualTo("yesterday");
  }

  @Test
  void unixTimeOutsideFourDigitYearsIsPassedThroughWithoutAbortingTheBatch() throws Exception {
    final ValidatedBatch batch =
        batch(
            """
            [{"hostIdentifier":"a"},
             {"hostIdentifier":"a","unixTime":1000000000000000000},
             {"hostIdentifier":"a","unixTime":1e300},
             {"hostIdentifier":"a","unixTime":123456789012345678901234567890},
             {"hostIdentifier":"a","unixTime":"253402300800"},
             {"hostIdentifier":"a"}]
            """);

    final PartitionWriteResult result = writer.write(batch, "a", "");

    assertThat(result.written()).isEqualTo(6);
    assertThat(result.failed()).isZero();
    assertThat(result.records()).noneMatch(document -> document.has("@timestamp"));
    assertThat(result.records().get(1).get("unixTime").asLong())
        .isEqualTo(1000000000000000000L);
    verify(telemetryRecordRepository, times(6))
        .append(anyString(), anyString(), anyString(), anyString(), any(Instant.class));
  }

  @Test
  void lastSecondOfYear9999IsStillStamped() throws Exception {
    final ObjectNode record =
        (ObjectNode) objectMapper.readTree("{\"unixTime\":253402300799}");

    final ObjectNode stamped = writer.stamp(record, "a", "");

    assertThat(stamped.get("@timestamp").asText()).isEqualTo("9999-12-31T23:59:59.000Z");
  }

  @Test
  void partitionUsesUtcDateOfTheInstant() {
    assertThat(writer.partitionFor(Instant.parse("2026-12-31T23:59:59Z")))
        .isEqualTo("flock-2026-12-31");
    assertThat(writer.partitionFor(Instant.parse("2027-01-01T00:00:00Z")))
        .isEqualTo("flock-2027-01-01");
  }

  @Test
  void failedRecordDoesNotAbortTheRest() throws Exception {
    doThrow(new DataAccessResourceFailureException("down"))
        .doNothing()
        .when(telemetryRecordRepository)
        .append(anyString(), anyString(), anyString(), anyString(), any(Instant.class));

    final PartitionWriteResult result =
        writer.write(
            batch("[{\"hostIdentifier\":\"a\",\"n\":1},{\"hostIdentifier\":\"a\",\"n\":2}]"),
            "a",
            "");

    assertThat(result.written()).isEqualTo(1);
    assertThat(result.failed()).isEqualTo(1);
    // only the stored record reaches the classifier
    assertThat(result.records()).hasSize(1);
    assertThat(result.records().get(0).get("n").asInt()).isEqualTo(2);
    verify(metrics).recordWrites(1, 1);
  }

  @Test
  void everyRecordFailingIsReportedAsUpstreamUnavailable() throws Exception {
    doThrow(new DataAccessResourceFailureException("down"))
        .when(telemetryRecordRepository)
        .append(anyString(), anyString(), anyString(), anyString(), any(Instant.class));

    assertThatThrownBy(() -> writer.write(batch("[{\"hostIdentifier\":\"a\"}]"), "a", ""))
        .isInstanceOf(UpstreamUnavailableException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    verify(metrics).recordWrites(0, 1);
  }

  private ValidatedBatch batch(String json) throws Exception {
    final List<ObjectNode> records =
        objectMapper.readerForListOf(ObjectNode.class).readValue(json);
    return new ValidatedBatch(records);
  }
}
