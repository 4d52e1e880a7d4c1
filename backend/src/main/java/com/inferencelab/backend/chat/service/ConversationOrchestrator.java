package com.inferencelab.backend.chat.service;

import com.inferencelab.backend.chat.config.ChatAssistantProperties;
import com.inferencelab.backend.chat.domain.ChatMessage;
import com.inferencelab.backend.chat.domain.ChatRole;
import com.inferencelab.backend.chat.domain.Transcript;
import com.inferencelab.backend.chat.domain.TranscriptBuilder;
import com.inferencelab.backend.chat.graph.TurnGraph;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Runs one chat turn: builds the transcript from the caller-supplied history, drives the turn
 * graph and records metrics for successful turns.
 *
 * <p>The orchestrator keeps no conversation state. Clients resend the full history on every turn
 * and are responsible for serializing turns of one conversation; two concurrent requests with the
 * same conversation id are processed independently.
 */
@Service
public class ConversationOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

  static final String UNAVAILABLE_REASON =
      "Conversational AI model not loaded. Please check if GEMINI_API_KEY is set.";

  private final AssistantRuntime runtime;
  private final TranscriptBuilder transcriptBuilder;
  private final ChatMetricsAggregator metricsAggregator;
  private final ConversationIdGenerator idGenerator;
  private final Clock clock;
  private final String systemDirective;

  public ConversationOrchestrator(
      AssistantRuntime runtime,
      TranscriptBuilder transcriptBuilder,
      ChatMetricsAggregator metricsAggregator,
      ConversationIdGenerator idGenerator,
      ChatAssistantProperties properties,
      Clock clock) {
    this.runtime = runtime;
    this.transcriptBuilder = transcriptBuilder;
    this.metricsAggregator = metricsAggregator;
    this.idGenerator = idGenerator;
    this.clock = clock;
    this.systemDirective = properties.getSystemPrompt();
  }

  public boolean isAvailable() {
    return runtime.isAvailable();
  }

  public Mono<ChatResult> handleChat(ChatTurnCommand command) {
    return Mono.defer(
        () -> {
          if (!runtime.isAvailable()) {
            return Mono.error(new ChatUnavailableException(UNAVAILABLE_REASON));
          }
          Instant startedAt = clock.instant();
          String message = sanitizeMessage(command.message());
          boolean newConversation = !StringUtils.hasText(command.conversationId());
          String conversationId = newConversation ? idGenerator.mint() : command.conversationId();
          Transcript transcript =
              transcriptBuilder.buildTranscript(command.history(), message, systemDirective);
          TurnGraph graph = runtime.graph().orElseThrow();

          return graph
              .run(transcript)
              .switchIfEmpty(
                  Mono.error(
                      () -> new IllegalStateException("Turn graph completed without a transcript")))
              .map(result -> complete(result, conversationId, newConversation, startedAt))
              .onErrorMap(
                  ex -> !(ex instanceof ResponseStatusException),
                  ex -> failure(ex, conversationId, message.length(), startedAt));
        });
  }

  private ChatResult complete(
      Transcript result, String conversationId, boolean newConversation, Instant startedAt) {
    ChatMessage reply = result.lastMessage();
    if (reply.role() != ChatRole.ASSISTANT) {
      throw new IllegalStateException("Turn graph did not produce an assistant reply");
    }

    Instant completedAt = clock.instant();
    double elapsedSeconds = seconds(startedAt, completedAt);
    metricsAggregator.recordTurn(elapsedSeconds, newConversation);

    if (log.isDebugEnabled()) {
      log.debug(
          "Chat turn completed for conversation {} in {} s ({} message(s) in transcript)",
          conversationId,
          elapsedSeconds,
          result.size());
    }
    return new ChatResult(
        reply.content(), conversationId, newConversation, completedAt, elapsedSeconds);
  }

  private ChatProcessingException failure(
      Throwable ex, String conversationId, int inputLength, Instant startedAt) {
    double elapsedSeconds = seconds(startedAt, clock.instant());
    log.error(
        "Chat turn failed for conversation {} (input length {}, elapsed {} s): {}",
        conversationId,
        inputLength,
        elapsedSeconds,
        ex.toString(),
        ex);
    return new ChatProcessingException(describe(ex), ex);
  }

  private String sanitizeMessage(String message) {
    String trimmed = message != null ? message.trim() : "";
    if (!StringUtils.hasText(trimmed)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message must not be empty");
    }
    return message;
  }

  private static String describe(Throwable ex) {
    if (ex instanceof TimeoutException) {
      return "assistant did not respond in time";
    }
    return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
  }

  private static double seconds(Instant from, Instant to) {
    return Math.max(0, Duration.between(from, to).toNanos()) / 1_000_000_000d;
  }
}
