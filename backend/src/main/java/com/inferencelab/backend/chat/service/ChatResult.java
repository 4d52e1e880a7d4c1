package com.inferencelab.backend.chat.service;

import java.time.Instant;

public record ChatResult(
    String replyText,
    String conversationId,
    boolean newConversation,
    Instant completedAt,
    double elapsedSeconds) {}
