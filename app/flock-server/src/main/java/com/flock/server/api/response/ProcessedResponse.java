package com.flock.server.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessedResponse(int processedCount, boolean error) {

  public static ProcessedResponse of(int processedCount) {
    return new ProcessedResponse(processedCount, false);
  }
}
