package com.inferencelab.backend.chat.graph;

import com.inferencelab.backend.chat.domain.ChatMessage;
import com.inferencelab.backend.chat.domain.Transcript;
import com.inferencelab.backend.chat.provider.AssistantCapability;
import java.util.Objects;
import reactor.core.publisher.Mono;

/** Invokes the assistant once and appends its reply to the transcript. */
public class AssistantReplyNode implements TurnNode {

  public static final String NAME = "chat";

  private final AssistantCapability assistant;

  public AssistantReplyNode(AssistantCapability assistant) {
    this.assistant = Objects.requireNonNull(assistant, "assistant must not be null");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Mono<Transcript> apply(Transcript transcript) {
    return assistant
        .reply(transcript)
        .switchIfEmpty(
            Mono.error(() -> new IllegalStateException("Assistant returned no reply")))
        .map(reply -> transcript.append(ChatMessage.assistant(reply)));
  }
}
