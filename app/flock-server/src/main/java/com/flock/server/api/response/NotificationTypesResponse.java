package com.flock.server.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationTypesResponse(List<NotificationTypeResponse> notificationTypes) {

  public NotificationTypesResponse {
    notificationTypes = notificationTypes == null ? List.of() : List.copyOf(notificationTypes);
  }
}
