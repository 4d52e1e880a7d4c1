package com.inferencelab.backend.chat.graph;

import com.inferencelab.backend.chat.domain.Transcript;
import reactor.core.publisher.Mono;

/**
 * Processing stage of a {@link TurnGraph}. A node receives the transcript produced by the
 * previous stage and emits the transcript handed to the next one.
 */
public interface TurnNode {

  String name();

  Mono<Transcript> apply(Transcript transcript);
}
