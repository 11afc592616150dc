package com.flock.server.service;

public class UnknownNotificationTypeException extends RuntimeException {

  public UnknownNotificationTypeException(String kind) {
    super("Unknown notification type: " + kind);
  }
}
