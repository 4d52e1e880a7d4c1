package com.inferencelab.backend.chat.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.inferencelab.backend.chat.config.ChatAssistantProperties;
import com.inferencelab.backend.chat.graph.AssistantReplyNode;
import com.inferencelab.backend.chat.graph.TurnGraph;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import com.inferencelab.backend.chat.service.ChatMetricsAggregator;
import com.inferencelab.backend.chat.support.ScriptedAssistant;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class ChatAssistantHealthIndicatorTest {

  private final ChatAssistantProperties properties = new ChatAssistantProperties();
  private final ChatMetricsAggregator metrics =
      new ChatMetricsAggregator(Clock.systemUTC(), new SimpleMeterRegistry());

  @Test
  void healthUpWhenAssistantReady() {
    ScriptedAssistant assistant = ScriptedAssistant.replying("hi");
    AssistantRuntime runtime =
        AssistantRuntime.ready(
            assistant, TurnGraph.builder().addNode(new AssistantReplyNode(assistant)).compile());
    metrics.recordTurn(0.1, true);

    Health health = new ChatAssistantHealthIndicator(runtime, properties, metrics).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("provider", "gemini")
        .containsEntry("model", "gemini-1.5-flash")
        .containsEntry("modelLoaded", true)
        .containsEntry("graphReady", true)
        .containsEntry("totalMessages", 1L);
  }

  @Test
  void outOfServiceWhenKeyMissing() {
    Health health =
        new ChatAssistantHealthIndicator(AssistantRuntime.unavailable(false), properties, metrics)
            .health();

    assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    assertThat(health.getDetails())
        .containsEntry("status", "not-configured")
        .containsEntry("modelLoaded", false);
  }

  @Test
  void downWhenInitializationFailed() {
    Health health =
        new ChatAssistantHealthIndicator(AssistantRuntime.unavailable(true), properties, metrics)
            .health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("status", "initialization-failed");
  }
}
