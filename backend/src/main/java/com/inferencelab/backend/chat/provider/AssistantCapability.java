package com.inferencelab.backend.chat.provider;

import com.inferencelab.backend.chat.domain.Transcript;
import reactor.core.publisher.Mono;

/**
 * Text-generation backend invoked once per chat turn.
 *
 * <p>Implementations are immutable after construction and shared by all concurrent turns. The
 * returned publisher must not block the subscribing thread while the reply is pending, and
 * signals an error when the configured timeout elapses.
 */
public interface AssistantCapability {

  String modelId();

  Mono<String> reply(Transcript transcript);
}
