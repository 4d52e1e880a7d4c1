package com.inferencelab.backend.chat.service;

import java.time.Instant;

/**
 * Consistent view of the chat counters at {@code capturedAt}. {@code averageResponseTime} always
 * equals {@code totalProcessingTime / totalMessages}, or zero before the first turn.
 */
public record ChatMetricsSnapshot(
    long totalMessages,
    long totalConversations,
    double totalProcessingTime,
    double averageResponseTime,
    Instant startedAt,
    Instant capturedAt,
    double uptimeSeconds) {

  public double messagesPerSecond() {
    return totalMessages / Math.max(uptimeSeconds, 1.0);
  }
}
