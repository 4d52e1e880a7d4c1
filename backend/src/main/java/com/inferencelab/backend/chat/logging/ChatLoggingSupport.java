package com.inferencelab.backend.chat.logging;

import com.inferencelab.backend.chat.config.ChatLoggingProperties;
import java.util.Objects;
import org.springframework.ai.chat.model.ChatModel;

/**
 * Applies optional prompt/completion logging to chat models.
 */
public class ChatLoggingSupport {

  private final ChatLoggingProperties properties;

  public ChatLoggingSupport(ChatLoggingProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  public ChatModel decorateModel(ChatModel delegate) {
    if (delegate == null
        || delegate instanceof LoggingChatModel
        || !properties.getModel().isEnabled()) {
      return delegate;
    }
    return new LoggingChatModel(delegate, properties.getModel().isLogCompletion());
  }
}
