/*
 * Where: Flock service layer
 * What: Registration attempted with a username that is already taken
 * Why: The stored token of the first registration must never change
 */
package com.flock.server.service;

public class DuplicateRegistrationException extends RuntimeException {

  private final String username;

  public DuplicateRegistrationException(String username) {
    super("Your computer (" + username + ") is already registered with this server");
    this.username = username;
  }

  public String username() {
    return username;
  }
}
