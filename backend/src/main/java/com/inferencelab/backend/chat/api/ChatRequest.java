package com.inferencelab.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

@Schema(
    description =
        "Chat turn request. The client owns the conversation history and resends it on every turn.",
    example =
        """
        {
          "message": "And what about Germany?",
          "conversation_id": "conv_1718000000_3f2a9c1b7d4e",
          "chat_history": [
            {"role": "user", "content": "What is the capital of France?"},
            {"role": "assistant", "content": "Paris."}
          ]
        }
        """)
public record ChatRequest(
    @Schema(
            description = "New user message.",
            example = "What is the capital of France?",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String message,
    @Schema(description = "Identifier returned by a previous turn; omit to start a conversation.")
        @JsonProperty("conversation_id")
        String conversationId,
    @Schema(description = "Previous turns of the conversation, oldest first.")
        @JsonProperty("chat_history")
        List<@Valid @NotNull ChatHistoryMessage> chatHistory) {}
