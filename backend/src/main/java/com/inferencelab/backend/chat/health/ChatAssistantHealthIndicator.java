package com.inferencelab.backend.chat.health;

import com.inferencelab.backend.chat.config.ChatAssistantProperties;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import com.inferencelab.backend.chat.service.ChatMetricsAggregator;
import com.inferencelab.backend.chat.service.ChatMetricsSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ChatAssistantHealthIndicator implements HealthIndicator {

  private final AssistantRuntime runtime;
  private final ChatAssistantProperties properties;
  private final ChatMetricsAggregator metricsAggregator;

  public ChatAssistantHealthIndicator(
      AssistantRuntime runtime,
      ChatAssistantProperties properties,
      ChatMetricsAggregator metricsAggregator) {
    this.runtime = runtime;
    this.properties = properties;
    this.metricsAggregator = metricsAggregator;
  }

  @Override
  public Health health() {
    Health.Builder builder;
    if (runtime.isAvailable()) {
      builder = Health.up();
    } else if (!runtime.isCredentialConfigured()) {
      builder = Health.outOfService().withDetail("status", "not-configured");
    } else {
      builder = Health.down().withDetail("status", "initialization-failed");
    }

    ChatMetricsSnapshot snapshot = metricsAggregator.snapshot();
    return builder
        .withDetail("provider", properties.getProvider())
        .withDetail("model", properties.getModel())
        .withDetail("modelLoaded", runtime.isModelLoaded())
        .withDetail("graphReady", runtime.isGraphReady())
        .withDetail("totalMessages", snapshot.totalMessages())
        .build();
  }
}
