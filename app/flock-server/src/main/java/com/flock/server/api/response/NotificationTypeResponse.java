/*
 * Where: Flock admin API
 * What: One notification kind as shown to operators
 * Why: Category is rendered in its lower-case wire form
 */
package com.flock.server.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flock.server.model.NotificationTypeConfig;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationTypeResponse(String kind, String category, boolean enabled) {

  public static NotificationTypeResponse from(NotificationTypeConfig config) {
    return new NotificationTypeResponse(
        config.kind(), config.category().value(), config.enabled());
  }
}
