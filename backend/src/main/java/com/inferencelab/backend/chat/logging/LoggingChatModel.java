package com.inferencelab.backend.chat.logging;

import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Decorator for {@link ChatModel} that logs the final prompt reaching the underlying LLM
 * implementation and, optionally, the resulting completion.
 */
public class LoggingChatModel implements ChatModel {

  private static final Logger log = LoggerFactory.getLogger(LoggingChatModel.class);

  private final ChatModel delegate;
  private final boolean logCompletion;

  public LoggingChatModel(ChatModel delegate, boolean logCompletion) {
    this.delegate = delegate;
    this.logCompletion = logCompletion;
  }

  @Override
  public ChatResponse call(Prompt prompt) {
    logPrompt(prompt);
    ChatResponse response = delegate.call(prompt);
    if (logCompletion && log.isDebugEnabled()) {
      String text = text(response);
      if (text != null) {
        log.debug("\n===== COMPLETION <<< =====\n{}\n==========================", text);
      }
    }
    return response;
  }

  @Override
  public Flux<ChatResponse> stream(Prompt prompt) {
    logPrompt(prompt);
    Flux<ChatResponse> responses = delegate.stream(prompt);
    if (!logCompletion || !log.isDebugEnabled()) {
      return responses;
    }
    StringBuilder completion = new StringBuilder();
    return responses
        .doOnNext(
            response -> {
              String text = text(response);
              if (text != null) {
                completion.append(text);
              }
            })
        .doOnComplete(
            () ->
                log.debug(
                    "\n===== COMPLETION <<< =====\n{}\n==========================", completion));
  }

  @Override
  public ChatOptions getDefaultOptions() {
    return delegate.getDefaultOptions();
  }

  private void logPrompt(Prompt prompt) {
    if (log.isDebugEnabled()) {
      String messages =
          prompt.getInstructions().stream()
              .map(message -> message.getMessageType().getValue() + ": " + message.getText())
              .collect(Collectors.joining("\n"));
      log.debug("\n===== FINAL PROMPT >>> =====\n{}\n============================", messages);
    }
  }

  private static String text(ChatResponse response) {
    Generation generation = response != null ? response.getResult() : null;
    if (generation == null || generation.getOutput() == null) {
      return null;
    }
    return Objects.toString(generation.getOutput().getText(), null);
  }
}
