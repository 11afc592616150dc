package com.flock.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flock.server.config.ChatChannelProperties;
import com.flock.server.model.DispatchOutcome;
import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationCategory;
import com.flock.server.model.NotificationEvent;
import com.flock.server.model.NotificationTypeConfig;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

  private static final NotificationCatalog CATALOG =
      NotificationCatalog.of(
          List.of(
              new NotificationTypeConfig("launchd", NotificationCategory.OSQUERY, true),
              new NotificationTypeConfig("crontab", NotificationCategory.OSQUERY, false),
              new NotificationTypeConfig("user_registered", NotificationCategory.SYSTEM, true)));

  @Mock private NotificationMessageRenderer renderer;
  @Mock private ChatChannelSender sender;
  @Mock private FlockMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private NotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    final ChatChannelProperties properties =
        new ChatChannelProperties(true, null, null, "team", "alerts", null, null, null, null);
    dispatcher = new NotificationDispatcher(renderer, sender, properties, metrics);
  }

  @Test
  void enabledKindIsRenderedAndSent() {
    final NotificationEvent event = event("launchd");
    when(renderer.render(event)).thenReturn("launchd changed");

    assertThat(dispatcher.dispatch(event, CATALOG)).isEqualTo(DispatchOutcome.SENT);

    verify(sender).send("alerts", "launchd changed");
    verify(metrics).recordDispatch("launchd", DispatchOutcome.SENT);
  }

  @Test
  void disabledKindIsSuppressed() {
    assertThat(dispatcher.dispatch(event("crontab"), CATALOG))
        .isEqualTo(DispatchOutcome.SUPPRESSED);

    verifyNoInteractions(sender, renderer);
    verify(metrics).recordDispatch("crontab", DispatchOutcome.SUPPRESSED);
  }

  @Test
  void unknownKindIsSuppressed() {
    assertThat(dispatcher.dispatch(event("mystery"), CATALOG))
        .isEqualTo(DispatchOutcome.SUPPRESSED);

    verifyNoInteractions(sender);
  }

  @Test
  void sendFailureIsDroppedAsFailed() {
    when(renderer.render(any())).thenReturn("text");
    doThrow(
            new ChatChannelException(
                ChatChannelException.Reason.TIMEOUT, "chat gateway request timeout", null))
        .when(sender)
        .send(anyString(), anyString());

    assertThat(dispatcher.dispatch(event("launchd"), CATALOG)).isEqualTo(DispatchOutcome.FAILED);
    verify(metrics).recordDispatch("launchd", DispatchOutcome.FAILED);
  }

  @Test
  void dispatchAllKeepsOrderAndIsolatesFailures() {
    when(renderer.render(any())).thenReturn("first", "second");
    doThrow(new IllegalStateException("boom"))
        .doNothing()
        .when(sender)
        .send(anyString(), anyString());

    final List<DispatchOutcome> outcomes =
        dispatcher.dispatchAll(
            List.of(event("launchd"), event("crontab"), event("user_registered")), CATALOG);

    assertThat(outcomes)
        .containsExactly(DispatchOutcome.FAILED, DispatchOutcome.SUPPRESSED, DispatchOutcome.SENT);
    final InOrder order = inOrder(sender);
    order.verify(sender).send("alerts", "first");
    order.verify(sender).send("alerts", "second");
  }

  @Test
  void toggleInANewSnapshotIsObservedByTheNextDispatch() {
    final NotificationCatalog disabled =
        NotificationCatalog.of(
            List.of(
                new NotificationTypeConfig("launchd", NotificationCategory.OSQUERY, true)
                    .withEnabled(false)));

    assertThat(dispatcher.dispatch(event("launchd"), disabled))
        .isEqualTo(DispatchOutcome.SUPPRESSED);
  }

  private NotificationEvent event(String kind) {
    return new NotificationEvent(kind, objectMapper.createObjectNode().put("name", kind));
  }
}
