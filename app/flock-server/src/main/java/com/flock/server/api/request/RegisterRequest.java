package com.flock.server.api.request;

import com.fasterxml.jackson.databind.JsonNode;

public record RegisterRequest(String username, String name) {

  /** Scalar fields are read as text; anything else counts as absent. */
  public static RegisterRequest from(JsonNode body) {
    return new RegisterRequest(text(body.get("username")), text(body.get("name")));
  }

  private static String text(JsonNode value) {
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.asText();
  }
}
