/*
 * Where: Flock domain model
 * What: A notification derived from one submission, before rendering
 * Why: Classification and dispatch are separate steps joined by this value
 */
package com.flock.server.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.common.event.SummaryEventPayload;

public record NotificationEvent(String kind, ObjectNode payload) {

  public NotificationEvent {
    if (kind == null || kind.isBlank()) {
      throw new IllegalArgumentException("notification kind is required");
    }
    // SpotBugs EI_EXPOSE_REP: keep a private copy of the mutable JSON tree
    payload = payload == null ? null : payload.deepCopy();
  }

  @Override
  public ObjectNode payload() {
    return payload == null ? null : payload.deepCopy();
  }

  public boolean isSummary() {
    return payload != null
        && SummaryEventPayload.SUMMARY_TYPE.equals(payload.path("type").asText(null));
  }
}
