/*
 * Where: Flock service layer
 * What: Runs one submission through validate, write, classify and dispatch
 * Why: The HTTP layer only maps outcomes; the pipeline order lives here
 */
package com.flock.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationEvent;
import com.flock.server.model.PartitionWriteResult;
import com.flock.server.model.Principal;
import com.flock.server.model.ValidatedBatch;
import com.flock.server.repository.PrincipalRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubmissionService {

  private static final Logger logger = LoggerFactory.getLogger(SubmissionService.class);

  static final String PATH_SUBMIT = "submit";
  static final String PATH_SUBMIT_FLOCK_LOGS = "submit_flock_logs";

  private final BatchValidator batchValidator;
  private final PartitionedWriter partitionedWriter;
  private final NotificationClassifier classifier;
  private final NotificationDispatcher dispatcher;
  private final NotificationTypeConfigStore configStore;
  private final PrincipalRepository principalRepository;
  private final FlockMetrics metrics;

  /** Returns the number of records accepted. Notification problems never fail the call. */
  public int submitTelemetry(JsonNode body, String username) {
    final ValidatedBatch batch;
    try {
      batch = batchValidator.validateTelemetry(body, username);
    } catch (BatchValidationException ex) {
      metrics.recordBatchRejected(PATH_SUBMIT);
      throw ex;
    }
    final NotificationCatalog catalog = snapshot();
    final String displayName = displayNameOf(username);
    final PartitionWriteResult result = partitionedWriter.write(batch, username, displayName);
    final List<NotificationEvent> events =
        classifier.classifyTelemetry(result.records(), catalog, username, displayName);
    dispatcher.dispatchAll(events, catalog);
    return batch.size();
  }

  /** Flock logs only drive notifications; they are not persisted. */
  public int submitFlockLogs(JsonNode body, String username) {
    final ValidatedBatch batch;
    try {
      batch = batchValidator.validateFlockLogs(body);
    } catch (BatchValidationException ex) {
      metrics.recordBatchRejected(PATH_SUBMIT_FLOCK_LOGS);
      throw ex;
    }
    final NotificationCatalog catalog = snapshot();
    final String displayName = displayNameOf(username);
    final List<NotificationEvent> events =
        classifier.classifyFlockLogs(batch.records(), username, displayName);
    dispatcher.dispatchAll(events, catalog);
    return batch.size();
  }

  // an unreadable config store suppresses every notification of this batch
  private NotificationCatalog snapshot() {
    try {
      return configStore.snapshot();
    } catch (DataAccessException ex) {
      logger.warn("notification config unavailable; suppressing notifications", ex);
      return NotificationCatalog.empty();
    }
  }

  private String displayNameOf(String username) {
    try {
      return principalRepository.findByUsername(username).map(Principal::name).orElse("");
    } catch (DataAccessException ex) {
      logger.warn("display name lookup failed username={}", username, ex);
      return "";
    }
  }
}
