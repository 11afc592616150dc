package com.flock.server.service;

public class InvalidRegistrationException extends RuntimeException {

  public InvalidRegistrationException(String message) {
    super(message);
  }
}
