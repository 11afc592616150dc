/*
 * Where: Flock domain model
 * What: Log event types emitted by the flock agent itself
 * Why: Twig toggles need a twig_id and state changes trigger notifications
 */
package com.flock.server.model;

import java.util.Arrays;
import java.util.Optional;

public enum FlockLogType {
  SERVER_ENABLED("server_enabled", true, false),
  SERVER_DISABLED("server_disabled", true, false),
  TWIGS_ENABLED("twigs_enabled", true, true),
  TWIGS_DISABLED("twigs_disabled", true, true),
  ENABLE_TWIG("enable_twig", false, false),
  DISABLE_TWIG("disable_twig", false, false);

  private final String value;
  private final boolean stateChange;
  private final boolean carriesTwigIds;

  FlockLogType(String value, boolean stateChange, boolean carriesTwigIds) {
    this.value = value;
    this.stateChange = stateChange;
    this.carriesTwigIds = carriesTwigIds;
  }

  public String value() {
    return value;
  }

  public boolean isStateChange() {
    return stateChange;
  }

  public boolean carriesTwigIds() {
    return carriesTwigIds;
  }

  public boolean requiresTwigId() {
    return this == ENABLE_TWIG || this == DISABLE_TWIG;
  }

  public static Optional<FlockLogType> fromValue(String value) {
    return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
  }
}
