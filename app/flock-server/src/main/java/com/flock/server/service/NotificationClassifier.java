/*
 * Where: Flock service layer
 * What: Turns one validated batch into notification events
 * Why: Bursts of the same kind collapse into one summary so the chat channel is not flooded
 */
package com.flock.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.common.event.SummaryEventPayload;
import com.flock.server.model.FlockLogType;
import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationCategory;
import com.flock.server.model.NotificationEvent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure functions over a single batch. No state is kept between batches, so a burst is "more than
 * one record of a kind in the same submission", never a time window.
 */
@Component
@RequiredArgsConstructor
public class NotificationClassifier {

  private static final String ACTION_ADDED = "added";
  private static final String ACTION_REMOVED = "removed";

  private final ObjectMapper objectMapper;

  public List<NotificationEvent> classifyTelemetry(
      List<ObjectNode> records, NotificationCatalog catalog, String submitter, String displayName) {
    final Set<String> osqueryKinds = new HashSet<>(catalog.kindsIn(NotificationCategory.OSQUERY));
    final Map<String, List<ObjectNode>> byKind = new LinkedHashMap<>();
    for (ObjectNode record : records) {
      final JsonNode name = record.get("name");
      if (name != null && name.isTextual() && osqueryKinds.contains(name.asText())) {
        byKind.computeIfAbsent(name.asText(), ignored -> new ArrayList<>()).add(record);
      }
    }

    final List<NotificationEvent> events = new ArrayList<>(byKind.size());
    byKind.forEach(
        (kind, matches) -> {
          if (matches.size() == 1) {
            events.add(new NotificationEvent(kind, matches.get(0)));
          } else {
            events.add(new NotificationEvent(kind, summarize(matches, submitter, displayName)));
          }
        });
    return events;
  }

  public List<NotificationEvent> classifyFlockLogs(
      List<ObjectNode> records, String submitter, String displayName) {
    final List<NotificationEvent> events = new ArrayList<>();
    for (ObjectNode record : records) {
      final Optional<FlockLogType> type =
          FlockLogType.fromValue(record.path("type").asText(null))
              .filter(FlockLogType::isStateChange);
      if (type.isEmpty()) {
        continue;
      }
      final ObjectNode details = objectMapper.createObjectNode();
      details.put("username", submitter);
      details.put("name", displayName);
      if (type.get().carriesTwigIds()) {
        details.set("twig_ids", twigIds(record));
      }
      events.add(new NotificationEvent(type.get().value(), details));
    }
    return events;
  }

  private ObjectNode summarize(List<ObjectNode> matches, String submitter, String displayName) {
    int added = 0;
    int removed = 0;
    int other = 0;
    for (ObjectNode record : matches) {
      final String action = record.path("action").asText(null);
      if (ACTION_ADDED.equals(action)) {
        added++;
      } else if (ACTION_REMOVED.equals(action)) {
        removed++;
      } else {
        other++;
      }
    }
    return objectMapper.valueToTree(
        SummaryEventPayload.of(submitter, displayName, added, removed, other));
  }

  private ArrayNode twigIds(ObjectNode record) {
    final JsonNode ids = record.get("twig_ids");
    if (ids instanceof ArrayNode array) {
      return array.deepCopy();
    }
    final ArrayNode array = objectMapper.createArrayNode();
    if (ids != null && !ids.isNull()) {
      array.add(ids);
    }
    return array;
  }
}
