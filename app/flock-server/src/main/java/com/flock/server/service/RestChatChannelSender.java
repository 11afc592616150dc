package com.flock.server.service;

import com.flock.server.config.ChatChannelProperties;
import java.net.SocketTimeoutException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Posts chat messages to the bot gateway; failures surface as {@link ChatChannelException}. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flock.chat.enabled", havingValue = "true")
public class RestChatChannelSender implements ChatChannelSender {

  private final RestClient chatRestClient;
  private final ChatChannelProperties properties;

  @Override
  public void send(String channel, String text) {
    final Map<String, String> body =
        Map.of("team", properties.team(), "channel", channel, "message", text);
    try {
      final RestClient.RequestBodySpec spec =
          chatRestClient.post().uri(properties.sendPath()).contentType(MediaType.APPLICATION_JSON);
      if (!properties.token().isBlank()) {
        spec.header(properties.tokenHeaderName(), properties.token());
      }
      spec.body(body).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new ChatChannelException(
            ChatChannelException.Reason.TIMEOUT, "chat gateway request timeout", ex);
      }
      throw new ChatChannelException(
          ChatChannelException.Reason.UNAVAILABLE, "chat gateway connection failed", ex);
    } catch (RestClientException ex) {
      throw new ChatChannelException(
          ChatChannelException.Reason.UNAVAILABLE, "chat gateway request failed", ex);
    }
  }

  private ChatChannelException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new ChatChannelException(
          ChatChannelException.Reason.UNAUTHORIZED, "chat gateway rejected bot token", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new ChatChannelException(
          ChatChannelException.Reason.UNAVAILABLE, "chat gateway server error", ex);
    }
    return new ChatChannelException(
        ChatChannelException.Reason.REJECTED, "chat gateway rejected message", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
