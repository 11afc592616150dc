/*
 * Where: Flock domain model
 * What: Immutable snapshot of every notification type configuration
 * Why: One submission is classified and dispatched against a single consistent view
 */
package com.flock.server.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class NotificationCatalog {

  private final Map<String, NotificationTypeConfig> byKind;

  private NotificationCatalog(Map<String, NotificationTypeConfig> byKind) {
    this.byKind = byKind;
  }

  public static NotificationCatalog of(Collection<NotificationTypeConfig> configs) {
    final Map<String, NotificationTypeConfig> byKind = new LinkedHashMap<>();
    for (NotificationTypeConfig config : configs) {
      byKind.put(config.kind(), config);
    }
    return new NotificationCatalog(Collections.unmodifiableMap(byKind));
  }

  public static NotificationCatalog empty() {
    return new NotificationCatalog(Map.of());
  }

  public Optional<NotificationTypeConfig> find(String kind) {
    if (kind == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byKind.get(kind));
  }

  /** Kinds of the given category, in catalog order. */
  public List<String> kindsIn(NotificationCategory category) {
    return byKind.values().stream()
        .filter(config -> config.category() == category)
        .map(NotificationTypeConfig::kind)
        .toList();
  }

  public List<NotificationTypeConfig> all() {
    return List.copyOf(byKind.values());
  }

  public boolean isEnabled(String kind) {
    return find(kind).map(NotificationTypeConfig::enabled).orElse(false);
  }
}
