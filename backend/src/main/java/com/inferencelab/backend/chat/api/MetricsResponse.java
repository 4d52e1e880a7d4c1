package com.inferencelab.backend.chat.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Service, host and model statistics.")
public record MetricsResponse(
    String timestamp, double uptimeSeconds, SystemStats system, Performance performance, Model model) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SystemStats(
      double cpuPercent, double memoryTotalGb, double memoryUsedGb, double memoryPercent) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Performance(
      long totalMessages,
      long totalConversations,
      double totalProcessingTime,
      double averageResponseTime,
      double messagesPerSecond) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Model(
      String name, String provider, String framework, boolean loaded, boolean graphReady) {}
}
