/*
 * Where: Common notification payload definitions
 * What: Payload emitted when one batch carries several records of the same notification kind
 * Why: The burst summary has a fixed shape that message templates rely on
 */
package com.flock.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SummaryEventPayload(
    String type,
    String username,
    String name,
    int addedCount,
    int removedCount,
    int otherCount) {

  public static final String SUMMARY_TYPE = "summary";

  public static SummaryEventPayload of(
      String username, String name, int addedCount, int removedCount, int otherCount) {
    return new SummaryEventPayload(
        SUMMARY_TYPE, username, name, addedCount, removedCount, otherCount);
  }
}
