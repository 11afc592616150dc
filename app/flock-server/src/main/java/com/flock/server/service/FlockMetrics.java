/*
 * Where: Flock service layer
 * What: Records write, rejection and dispatch outcomes as Micrometer counters
 * Why: Suppressed and failed notifications are invisible to clients and need another outlet
 */
package com.flock.server.service;

import com.flock.server.model.DispatchOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class FlockMetrics {

  private static final String METRIC_RECORDS_WRITTEN = "flock.records.written";
  private static final String METRIC_BATCHES_REJECTED = "flock.batches.rejected";
  private static final String METRIC_NOTIFICATIONS_DISPATCH = "flock.notifications.dispatch";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public FlockMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordWrites(int written, int failed) {
    if (written > 0) {
      counter(METRIC_RECORDS_WRITTEN, "result", "written", "Telemetry records written")
          .increment(written);
    }
    if (failed > 0) {
      counter(METRIC_RECORDS_WRITTEN, "result", "failed", "Telemetry records written")
          .increment(failed);
    }
  }

  public void recordBatchRejected(String path) {
    counter(METRIC_BATCHES_REJECTED, "path", path, "Submission batches rejected by validation")
        .increment();
  }

  public void recordDispatch(String kind, DispatchOutcome outcome) {
    counters
        .computeIfAbsent(
            METRIC_NOTIFICATIONS_DISPATCH + "|" + kind + "|" + outcome.tag(),
            ignored ->
                Counter.builder(METRIC_NOTIFICATIONS_DISPATCH)
                    .description("Notification dispatch outcomes")
                    .tags(Tags.of("kind", kind, "outcome", outcome.tag()))
                    .register(meterRegistry))
        .increment();
  }

  private Counter counter(String name, String tagKey, String tagValue, String description) {
    return counters.computeIfAbsent(
        name + "|" + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
