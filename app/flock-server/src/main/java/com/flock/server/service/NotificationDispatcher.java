/*
 * Where: Flock service layer
 * What: Gates notification events by enablement, renders them and sends them to the chat channel
 * Why: Delivery is best effort; a failed send is dropped and never fails the submission
 */
package com.flock.server.service;

import com.flock.server.config.ChatChannelProperties;
import com.flock.server.model.DispatchOutcome;
import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationEvent;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationMessageRenderer renderer;
  private final ChatChannelSender sender;
  private final ChatChannelProperties chatProperties;
  private final FlockMetrics metrics;

  /** At most one send attempt; no retry queue. */
  public DispatchOutcome dispatch(NotificationEvent event, NotificationCatalog catalog) {
    if (!catalog.isEnabled(event.kind())) {
      logger.debug("notification suppressed kind={}", event.kind());
      return record(event, DispatchOutcome.SUPPRESSED);
    }
    try {
      sender.send(chatProperties.channel(), renderer.render(event));
      return record(event, DispatchOutcome.SENT);
    } catch (ChatChannelException ex) {
      logger.warn(
          "notification dropped kind={} reason={}", event.kind(), ex.reason(), ex);
      return record(event, DispatchOutcome.FAILED);
    } catch (RuntimeException ex) {
      logger.warn("notification dropped kind={}", event.kind(), ex);
      return record(event, DispatchOutcome.FAILED);
    }
  }

  /** Dispatches in the given order; one failure does not affect the others. */
  public List<DispatchOutcome> dispatchAll(
      List<NotificationEvent> events, NotificationCatalog catalog) {
    final List<DispatchOutcome> outcomes = new ArrayList<>(events.size());
    for (NotificationEvent event : events) {
      outcomes.add(dispatch(event, catalog));
    }
    return outcomes;
  }

  private DispatchOutcome record(NotificationEvent event, DispatchOutcome outcome) {
    metrics.recordDispatch(event.kind(), outcome);
    return outcome;
  }
}
