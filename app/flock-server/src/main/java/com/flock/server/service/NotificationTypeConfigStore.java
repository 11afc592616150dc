/*
 * Where: Flock service layer
 * What: Read-mostly access to per-kind notification enablement
 * Why: The pipeline reads a snapshot; writes come only from the admin API
 */
package com.flock.server.service;

import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationTypeConfig;
import java.util.List;
import java.util.Optional;

public interface NotificationTypeConfigStore {

  Optional<NotificationTypeConfig> get(String kind);

  List<NotificationTypeConfig> all();

  /** Immutable view taken once per pipeline invocation. */
  default NotificationCatalog snapshot() {
    return NotificationCatalog.of(all());
  }

  NotificationTypeConfig setEnabled(String kind, boolean enabled);
}
