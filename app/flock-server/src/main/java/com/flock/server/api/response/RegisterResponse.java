package com.flock.server.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterResponse(String authToken, boolean error) {

  public static RegisterResponse of(String authToken) {
    return new RegisterResponse(authToken, false);
  }
}
