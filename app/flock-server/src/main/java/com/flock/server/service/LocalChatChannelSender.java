/*
 * Where: Flock service layer
 * What: Chat sender that only logs the message
 * Why: Local runs and tests work without a bot gateway
 */
package com.flock.server.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "flock.chat.enabled", havingValue = "false", matchIfMissing = true)
public class LocalChatChannelSender implements ChatChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalChatChannelSender.class);

  @Override
  public void send(String channel, String text) {
    logger.info("chat message simulated send channel={} length={}", channel, text.length());
  }
}
