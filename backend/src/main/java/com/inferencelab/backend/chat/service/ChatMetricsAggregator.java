package com.inferencelab.backend.chat.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Process-wide chat counters. The four counters are only written together inside one critical
 * section, so a {@link #snapshot()} never observes a half-applied turn. Counters are never reset.
 */
@Component
public class ChatMetricsAggregator {

  private final Clock clock;
  private final Instant startedAt;
  private final ReentrantLock lock = new ReentrantLock();

  private long totalMessages;
  private long totalConversations;
  private double totalProcessingTime;
  private double averageResponseTime;

  private final Counter turnCounter;
  private final Counter conversationCounter;
  private final Timer latencyTimer;

  public ChatMetricsAggregator(Clock clock, MeterRegistry meterRegistry) {
    this.clock = clock;
    this.startedAt = clock.instant();
    this.turnCounter =
        Counter.builder("chat.turns")
            .description("Number of successfully completed chat turns")
            .register(meterRegistry);
    this.conversationCounter =
        Counter.builder("chat.conversations")
            .description("Number of conversations started")
            .register(meterRegistry);
    this.latencyTimer =
        Timer.builder("chat.turn.latency")
            .description("End-to-end latency of completed chat turns")
            .register(meterRegistry);
  }

  public void recordTurn(double processingSeconds, boolean newConversation) {
    if (Double.isNaN(processingSeconds) || processingSeconds < 0) {
      throw new IllegalArgumentException(
          "processingSeconds must be a non-negative number: " + processingSeconds);
    }

    lock.lock();
    try {
      totalMessages++;
      if (newConversation) {
        totalConversations++;
      }
      totalProcessingTime += processingSeconds;
      averageResponseTime = totalProcessingTime / totalMessages;
    } finally {
      lock.unlock();
    }

    turnCounter.increment();
    if (newConversation) {
      conversationCounter.increment();
    }
    latencyTimer.record(Math.round(processingSeconds * 1_000_000_000d), TimeUnit.NANOSECONDS);
  }

  public ChatMetricsSnapshot snapshot() {
    long messages;
    long conversations;
    double processingTime;
    double average;
    lock.lock();
    try {
      messages = totalMessages;
      conversations = totalConversations;
      processingTime = totalProcessingTime;
      average = averageResponseTime;
    } finally {
      lock.unlock();
    }

    Instant now = clock.instant();
    double uptimeSeconds = Duration.between(startedAt, now).toNanos() / 1_000_000_000d;
    return new ChatMetricsSnapshot(
        messages, conversations, processingTime, average, startedAt, now, uptimeSeconds);
  }
}
