package com.inferencelab.backend.chat.graph;

import com.inferencelab.backend.chat.domain.Transcript;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * One run of a {@link TurnGraph} over a single input transcript.
 *
 * <p>The execution starts in {@link TurnState#READY}, moves to {@link TurnState#INVOKING} once
 * {@link #result()} is subscribed and ends in {@link TurnState#COMPLETED} or {@link
 * TurnState#FAILED}. The result publisher is meant to be subscribed once.
 */
public class TurnExecution {

  private static final Logger log = LoggerFactory.getLogger(TurnExecution.class);

  private final UUID id = UUID.randomUUID();
  private final Transcript input;
  private final List<TurnNode> nodes;
  private final AtomicReference<TurnState> state = new AtomicReference<>(TurnState.READY);
  private final List<TurnState> transitions = new CopyOnWriteArrayList<>(List.of(TurnState.READY));

  TurnExecution(Transcript input, List<TurnNode> nodes) {
    this.input = input;
    this.nodes = nodes;
  }

  public UUID id() {
    return id;
  }

  public TurnState state() {
    return state.get();
  }

  public List<TurnState> transitions() {
    return List.copyOf(transitions);
  }

  public Mono<Transcript> result() {
    return Mono.defer(this::start);
  }

  private Mono<Transcript> start() {
    if (input == null || input.isEmpty()) {
      transition(TurnState.FAILED);
      return Mono.error(
          new IllegalStateException("Transcript must contain at least one message"));
    }
    if (!transition(TurnState.INVOKING)) {
      return Mono.error(
          new IllegalStateException("Turn execution " + id + " already " + state.get()));
    }

    Mono<Transcript> pipeline = Mono.just(input);
    for (TurnNode node : nodes) {
      pipeline = pipeline.flatMap(current -> invoke(node, current));
    }
    return pipeline
        .doOnSuccess(ignored -> transition(TurnState.COMPLETED))
        .doOnError(ignored -> transition(TurnState.FAILED))
        .doOnCancel(() -> transition(TurnState.FAILED));
  }

  private Mono<Transcript> invoke(TurnNode node, Transcript current) {
    if (log.isDebugEnabled()) {
      log.debug("Turn {} entering node '{}' with {} message(s)", id, node.name(), current.size());
    }
    return node.apply(current);
  }

  private boolean transition(TurnState next) {
    TurnState current = state.get();
    while (current.canTransitionTo(next)) {
      if (state.compareAndSet(current, next)) {
        transitions.add(next);
        return true;
      }
      current = state.get();
    }
    return false;
  }
}
