package com.flock.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String requestId) {
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return newRequestId();
  }
}
