package com.inferencelab.backend.chat.controller;

import com.inferencelab.backend.chat.api.ChatHistoryMessage;
import com.inferencelab.backend.chat.api.ChatRequest;
import com.inferencelab.backend.chat.api.ChatResponse;
import com.inferencelab.backend.chat.domain.ChatMessage;
import com.inferencelab.backend.chat.domain.ChatRole;
import com.inferencelab.backend.chat.service.ChatResult;
import com.inferencelab.backend.chat.service.ChatTurnCommand;
import com.inferencelab.backend.chat.service.ConversationOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
@Validated
@Slf4j
@Tag(name = "Chat", description = "Conversational assistant endpoint.")
public class ChatController {

  private final ConversationOrchestrator orchestrator;

  public ChatController(ConversationOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping(
      value = "/chat",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Send a message to the assistant.",
      description =
          "Builds the transcript from the supplied history and the new message, runs one assistant"
              + " turn and returns the reply. A conversation id is minted when none is supplied.")
  @ApiResponse(
      responseCode = "200",
      description = "Assistant reply.",
      content =
          @Content(
              mediaType = MediaType.APPLICATION_JSON_VALUE,
              schema = @Schema(implementation = ChatResponse.class)))
  @ApiResponse(responseCode = "400", description = "Malformed request.")
  @ApiResponse(responseCode = "500", description = "The assistant call failed or timed out.")
  @ApiResponse(responseCode = "503", description = "The assistant is not configured.")
  public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
    ChatTurnCommand command =
        new ChatTurnCommand(
            request.message(), request.conversationId(), toHistory(request.chatHistory()));
    return orchestrator.handleChat(command).map(ChatController::toResponse);
  }

  private static List<ChatMessage> toHistory(List<ChatHistoryMessage> history) {
    if (CollectionUtils.isEmpty(history)) {
      return List.of();
    }
    return history.stream().map(ChatController::toMessage).toList();
  }

  private static ChatMessage toMessage(ChatHistoryMessage entry) {
    if (entry == null) {
      throw new ResponseStatusException(
          HttpStatus.BAD_REQUEST, "Chat history entries must not be null");
    }
    ChatRole role;
    try {
      role = ChatRole.from(entry.role());
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
    }
    return new ChatMessage(role, entry.content(), parseTimestamp(entry.timestamp()));
  }

  private static Instant parseTimestamp(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value, OffsetDateTime::from, LocalDateTime::from);
      return parsed instanceof OffsetDateTime offset
          ? offset.toInstant()
          : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      log.debug("Ignoring unparseable history timestamp '{}'", value);
      return null;
    }
  }

  private static ChatResponse toResponse(ChatResult result) {
    double processingTime =
        BigDecimal.valueOf(result.elapsedSeconds()).setScale(3, RoundingMode.HALF_UP).doubleValue();
    return new ChatResponse(
        result.replyText(),
        result.conversationId(),
        result.completedAt().toString(),
        processingTime);
  }
}
