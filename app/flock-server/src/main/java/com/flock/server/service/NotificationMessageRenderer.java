/*
 * Where: Flock service layer
 * What: Renders a notification event into chat text using the configured per-kind template
 * Why: Message wording lives in configuration, next to the catalog that defines the kinds
 */
package com.flock.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.server.config.FlockNotificationProperties;
import com.flock.server.config.FlockNotificationProperties.CatalogEntry;
import com.flock.server.model.NotificationEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationMessageRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_@.]+)}");

  private final FlockNotificationProperties properties;

  public String render(NotificationEvent event) {
    final ObjectNode payload = event.payload();
    final String template = templateFor(event);
    if (template == null) {
      return event.kind() + ": " + (payload == null ? "{}" : payload.toString());
    }
    final Matcher matcher = PLACEHOLDER.matcher(template);
    return matcher.replaceAll(
        match -> Matcher.quoteReplacement(resolve(event.kind(), payload, match.group(1))));
  }

  private String templateFor(NotificationEvent event) {
    final CatalogEntry entry = properties.find(event.kind()).orElse(null);
    if (event.isSummary()) {
      if (entry != null && !isBlank(entry.summaryTemplate())) {
        return entry.summaryTemplate();
      }
      return properties.defaultSummaryTemplate();
    }
    return entry == null || isBlank(entry.template()) ? null : entry.template();
  }

  // {a.b} walks nested objects, e.g. {columns.path} of an osquery result
  private String resolve(String kind, ObjectNode payload, String key) {
    JsonNode node = payload;
    for (String segment : key.split("\\.")) {
      node = node == null ? null : node.get(segment);
    }
    if (node == null || node.isNull()) {
      return "kind".equals(key) ? kind : "";
    }
    if (node.isArray()) {
      final List<String> parts = new ArrayList<>(node.size());
      node.forEach(element -> parts.add(element.isValueNode() ? element.asText() : element.toString()));
      return String.join(", ", parts);
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
