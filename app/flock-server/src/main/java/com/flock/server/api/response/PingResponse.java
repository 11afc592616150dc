package com.flock.server.api.response;

public record PingResponse(boolean error) {

  public static PingResponse ok() {
    return new PingResponse(false);
  }
}
