/*
 * Where: Flock API
 * What: Failure envelope shared by every endpoint
 * Why: Agents branch on error/error_msg only
 */
package com.flock.server.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(boolean error, String errorMsg) {

  static final String INVALID_JSON = "Invalid JSON object";

  public static ApiErrorResponse of(String errorMsg) {
    return new ApiErrorResponse(true, errorMsg);
  }
}
