/*
 * Where: Flock service layer
 * What: "Send text to channel" primitive of the external chat bot
 * Why: Lets the real bot gateway and a logging stand-in be swapped by configuration
 */
package com.flock.server.service;

public interface ChatChannelSender {
  void send(String channel, String text);
}
