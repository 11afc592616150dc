package com.flock.server.service;

public class ChatChannelException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    REJECTED,
    TIMEOUT,
    UNAVAILABLE
  }

  private final Reason reason;

  public ChatChannelException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
