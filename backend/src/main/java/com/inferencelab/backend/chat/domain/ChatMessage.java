package com.inferencelab.backend.chat.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Single role-tagged entry of a conversation transcript.
 *
 * @param role author of the message
 * @param content message text, never {@code null}
 * @param timestamp client or server supplied creation time, may be {@code null}
 */
public record ChatMessage(ChatRole role, String content, Instant timestamp) {

  public ChatMessage {
    Objects.requireNonNull(role, "role must not be null");
    content = content != null ? content : "";
  }

  public static ChatMessage system(String content) {
    return new ChatMessage(ChatRole.SYSTEM, content, null);
  }

  public static ChatMessage user(String content) {
    return new ChatMessage(ChatRole.USER, content, null);
  }

  public static ChatMessage assistant(String content) {
    return new ChatMessage(ChatRole.ASSISTANT, content, null);
  }

  public boolean isSystem() {
    return role == ChatRole.SYSTEM;
  }
}
