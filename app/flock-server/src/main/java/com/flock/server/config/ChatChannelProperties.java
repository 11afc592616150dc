/*
 * Where: Flock configuration binding
 * What: Connection settings for the chat bot gateway and target channel
 * Why: The advisory channel differs per deployment and must time out quickly
 */
package com.flock.server.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flock.chat")
public record ChatChannelProperties(
    boolean enabled,
    String baseUrl,
    String sendPath,
    String team,
    String channel,
    String token,
    String tokenHeaderName,
    Duration connectTimeout,
    Duration readTimeout) {

  public ChatChannelProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://chat-bot:8080" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/channels/messages" : sendPath;
    team = team == null ? "" : team;
    channel = channel == null || channel.isBlank() ? "general" : channel;
    token = token == null ? "" : token;
    tokenHeaderName =
        tokenHeaderName == null || tokenHeaderName.isBlank() ? "X-Bot-Token" : tokenHeaderName;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
