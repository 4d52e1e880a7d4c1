package com.inferencelab.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Assistant reply for a single chat turn.")
public record ChatResponse(
    @Schema(description = "Reply text.", example = "The capital of France is Paris.") String message,
    @Schema(description = "Identifier to send with the next turn.", example = "conv_1718000000_3f2a9c1b7d4e")
        @JsonProperty("conversation_id")
        String conversationId,
    @Schema(description = "ISO-8601 completion time.") String timestamp,
    @Schema(description = "Processing time in seconds, rounded to milliseconds.", example = "0.842")
        @JsonProperty("processing_time")
        double processingTime) {}
