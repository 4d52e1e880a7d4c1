package com.inferencelab.backend.chat.provider;

import com.inferencelab.backend.chat.domain.ChatMessage;
import com.inferencelab.backend.chat.domain.Transcript;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * {@link AssistantCapability} backed by a Spring AI {@link ChatModel}. Replies are obtained
 * through the streaming API and aggregated, so waiting for the model never pins a thread.
 */
public class SpringAiAssistantCapability implements AssistantCapability {

  private final String modelId;
  private final ChatClient chatClient;
  private final ChatOptions options;
  private final Duration timeout;

  public SpringAiAssistantCapability(
      String modelId, ChatModel chatModel, ChatOptions options, Duration timeout) {
    Assert.hasText(modelId, "modelId must not be empty");
    Assert.notNull(chatModel, "chatModel must not be null");
    Assert.notNull(timeout, "timeout must not be null");
    Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
    this.modelId = modelId;
    this.chatClient = ChatClient.builder(chatModel).build();
    this.options = options;
    this.timeout = timeout;
  }

  @Override
  public String modelId() {
    return modelId;
  }

  @Override
  public Mono<String> reply(Transcript transcript) {
    return Mono.defer(
        () -> {
          var promptSpec = chatClient.prompt().messages(toPromptMessages(transcript));
          if (options != null) {
            promptSpec = promptSpec.options(options);
          }
          return promptSpec
              .stream()
              .content()
              .filter(Objects::nonNull)
              .collect(Collectors.joining())
              .timeout(timeout)
              .flatMap(
                  content ->
                      StringUtils.hasText(content)
                          ? Mono.just(content)
                          : Mono.error(
                              new IllegalStateException(
                                  "Model '" + modelId + "' returned an empty response")));
        });
  }

  static List<Message> toPromptMessages(Transcript transcript) {
    return transcript.messages().stream()
        .map(SpringAiAssistantCapability::toPromptMessage)
        .toList();
  }

  private static Message toPromptMessage(ChatMessage message) {
    return switch (message.role()) {
      case SYSTEM -> new SystemMessage(message.content());
      case USER -> new UserMessage(message.content());
      case ASSISTANT -> new AssistantMessage(message.content());
    };
  }
}
