package com.inferencelab.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Entry of the client-held conversation history.")
public record ChatHistoryMessage(
    @Schema(description = "Author of the message.", example = "user", allowableValues = {"system", "user", "assistant"})
        @NotBlank
        String role,
    @Schema(description = "Message text.", example = "What is the capital of France?") @NotNull
        String content,
    @Schema(description = "Optional ISO-8601 creation time supplied by the client.") String timestamp) {}
