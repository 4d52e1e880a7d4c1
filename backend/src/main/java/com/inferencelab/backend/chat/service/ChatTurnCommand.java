package com.inferencelab.backend.chat.service;

import com.inferencelab.backend.chat.domain.ChatMessage;
import java.util.List;

/**
 * Input of a single chat turn.
 *
 * @param message new user text
 * @param conversationId identifier from a previous turn, or {@code null} to start a conversation
 * @param history caller-owned transcript of the previous turns, oldest first
 */
public record ChatTurnCommand(String message, String conversationId, List<ChatMessage> history) {

  public ChatTurnCommand {
    history = history != null ? List.copyOf(history) : List.of();
  }
}
