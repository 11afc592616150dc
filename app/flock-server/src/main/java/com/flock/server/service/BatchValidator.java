/*
 * Where: Flock service layer
 * What: Checks submitted batches before anything is persisted or classified
 * Why: Partial acceptance would desynchronize summary counts from what was stored
 */
package com.flock.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.server.model.FlockLogType;
import com.flock.server.model.ValidatedBatch;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class BatchValidator {

  static final String INVALID_JSON = "Invalid JSON object";
  static final String NOT_AN_ARRAY = "Data is not an array";

  public ValidatedBatch validateTelemetry(JsonNode batch, String submitter) {
    // an empty or falsy telemetry body is treated like a missing one
    if (batch == null || batch.isNull() || batch.isMissingNode() || isEmptyOrFalsy(batch)) {
      throw new BatchValidationException(INVALID_JSON);
    }
    requireArray(batch);
    final List<ObjectNode> records = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      final ObjectNode record = requireObject(batch.get(i), i);
      final JsonNode hostIdentifier = record.get("hostIdentifier");
      if (hostIdentifier == null
          || !hostIdentifier.isTextual()
          || !hostIdentifier.asText().equals(submitter)) {
        throw new BatchValidationException(
            "Item " + i + " does not contain the correct hostIdentifier", i, "hostIdentifier");
      }
      records.add(record);
    }
    return new ValidatedBatch(records);
  }

  public ValidatedBatch validateFlockLogs(JsonNode batch) {
    if (batch == null || batch.isNull() || batch.isMissingNode()) {
      throw new BatchValidationException(INVALID_JSON);
    }
    requireArray(batch);
    final List<ObjectNode> records = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      final ObjectNode record = requireObject(batch.get(i), i);
      if (!record.has("type")) {
        throw new BatchValidationException(
            "Item " + i + " does not contain a type field", i, "type");
      }
      if (!record.has("timestamp")) {
        throw new BatchValidationException(
            "Item " + i + " does not contain a timestamp field", i, "timestamp");
      }
      final boolean aboutOneTwig =
          FlockLogType.fromValue(record.get("type").asText(null))
              .map(FlockLogType::requiresTwigId)
              .orElse(false);
      if (aboutOneTwig && !record.has("twig_id")) {
        throw new BatchValidationException(
            "Item " + i + " is about a twig, but does not contain a twig_id field", i, "twig_id");
      }
      records.add(record);
    }
    return new ValidatedBatch(records);
  }

  private void requireArray(JsonNode batch) {
    if (!batch.isArray()) {
      throw new BatchValidationException(NOT_AN_ARRAY);
    }
  }

  private ObjectNode requireObject(JsonNode element, int index) {
    if (!(element instanceof ObjectNode record)) {
      throw new BatchValidationException("Item " + index + " is not an object", index, null);
    }
    return record;
  }

  private boolean isEmptyOrFalsy(JsonNode batch) {
    if (batch.isContainerNode()) {
      return batch.isEmpty();
    }
    if (batch.isBoolean()) {
      return !batch.booleanValue();
    }
    if (batch.isNumber()) {
      return batch.decimalValue().signum() == 0;
    }
    return batch.isTextual() && batch.textValue().isEmpty();
  }
}
