/*
 * Where: Flock domain model
 * What: Category a notification kind belongs to
 * Why: Only osquery kinds can be triggered by telemetry batches
 */
package com.flock.server.model;

import java.util.Locale;

public enum NotificationCategory {
  OSQUERY,
  SYSTEM;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationCategory fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("notification category is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
