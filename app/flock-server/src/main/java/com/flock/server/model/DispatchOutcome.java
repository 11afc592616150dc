/*
 * Where: Flock domain model
 * What: Result of one dispatch attempt
 * Why: Suppression and failure are counted separately and never reach the client
 */
package com.flock.server.model;

import java.util.Locale;

public enum DispatchOutcome {
  SENT,
  SUPPRESSED,
  FAILED;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
