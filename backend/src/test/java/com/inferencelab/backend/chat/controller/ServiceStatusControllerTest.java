package com.inferencelab.backend.chat.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.inferencelab.backend.chat.config.ChatAssistantProperties;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import com.inferencelab.backend.chat.service.ChatMetricsAggregator;
import com.inferencelab.backend.chat.service.HostResourceProbe;
import com.inferencelab.backend.chat.service.HostResourceProbe.HostResources;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ServiceStatusController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ServiceStatusControllerTest.StatusTestConfiguration.class)
class ServiceStatusControllerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @Autowired private ChatMetricsAggregator metricsAggregator;

  @MockBean private HostResourceProbe hostResourceProbe;

  @BeforeEach
  void stubHost() {
    when(hostResourceProbe.sample()).thenReturn(new HostResources(12.345, 15.6789, 7.4321, 47.456));
  }

  @Test
  void metricsReportCountersHostAndModel() throws Exception {
    metricsAggregator.recordTurn(0.1234, true);
    metricsAggregator.recordTurn(0.2, false);

    mockMvc
        .perform(get("/metrics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00Z"))
        .andExpect(jsonPath("$.uptime_seconds").value(0.0))
        .andExpect(jsonPath("$.system.cpu_percent").value(12.3))
        .andExpect(jsonPath("$.system.memory_total_gb").value(15.68))
        .andExpect(jsonPath("$.system.memory_used_gb").value(7.43))
        .andExpect(jsonPath("$.system.memory_percent").value(47.5))
        .andExpect(jsonPath("$.performance.total_messages").value(2))
        .andExpect(jsonPath("$.performance.total_conversations").value(1))
        .andExpect(jsonPath("$.performance.total_processing_time").value(0.323))
        .andExpect(jsonPath("$.performance.average_response_time").value(0.162))
        .andExpect(jsonPath("$.performance.messages_per_second").value(2.0))
        .andExpect(jsonPath("$.model.name").value("gemini-1.5-flash"))
        .andExpect(jsonPath("$.model.provider").value("Google Generative AI"))
        .andExpect(jsonPath("$.model.framework").value("Spring AI"))
        .andExpect(jsonPath("$.model.loaded").value(false))
        .andExpect(jsonPath("$.model.graph_ready").value(false));
  }

  @Test
  void healthReportsReadinessFlags() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.service").value("Conversational AI Microservice"))
        .andExpect(jsonPath("$.model_loaded").value(false))
        .andExpect(jsonPath("$.graph_ready").value(false))
        .andExpect(jsonPath("$.gemini_configured").value(false))
        .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00Z"));
  }

  @Test
  void rootDescribesService() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("Conversational AI Microservice"))
        .andExpect(jsonPath("$.version").value("1.0.0"))
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.model").value("gemini-1.5-flash"))
        .andExpect(jsonPath("$.model_loaded").value(false))
        .andExpect(jsonPath("$.endpoints.chat").exists())
        .andExpect(jsonPath("$.endpoints.metrics").exists());
  }

  @TestConfiguration
  static class StatusTestConfiguration {

    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    AssistantRuntime assistantRuntime() {
      return AssistantRuntime.unavailable(false);
    }

    @Bean
    ChatAssistantProperties chatAssistantProperties() {
      return new ChatAssistantProperties();
    }

    @Bean
    ChatMetricsAggregator chatMetricsAggregator(Clock clock) {
      return new ChatMetricsAggregator(clock, new SimpleMeterRegistry());
    }
  }
}
