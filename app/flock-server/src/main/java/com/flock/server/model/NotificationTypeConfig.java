/*
 * Where: Flock domain model
 * What: Enablement of one notification kind
 * Why: The dispatcher consults it for every event
 */
package com.flock.server.model;

public record NotificationTypeConfig(String kind, NotificationCategory category, boolean enabled) {

  public NotificationTypeConfig withEnabled(boolean value) {
    return new NotificationTypeConfig(kind, category, value);
  }
}
