package com.inferencelab.backend.chat.controller;

import com.inferencelab.backend.chat.api.MetricsResponse;
import com.inferencelab.backend.chat.api.ServiceInfoResponse;
import com.inferencelab.backend.chat.config.ChatAssistantProperties;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import com.inferencelab.backend.chat.service.ChatMetricsAggregator;
import com.inferencelab.backend.chat.service.ChatMetricsSnapshot;
import com.inferencelab.backend.chat.service.HostResourceProbe;
import com.inferencelab.backend.chat.service.HostResourceProbe.HostResources;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Service", description = "Service descriptor, readiness and statistics.")
public class ServiceStatusController {

  static final String SERVICE_NAME = "Conversational AI Microservice";
  static final String SERVICE_VERSION = "1.0.0";

  private final AssistantRuntime runtime;
  private final ChatAssistantProperties properties;
  private final ChatMetricsAggregator metricsAggregator;
  private final HostResourceProbe hostResourceProbe;
  private final Clock clock;

  public ServiceStatusController(
      AssistantRuntime runtime,
      ChatAssistantProperties properties,
      ChatMetricsAggregator metricsAggregator,
      HostResourceProbe hostResourceProbe,
      Clock clock) {
    this.runtime = runtime;
    this.properties = properties;
    this.metricsAggregator = metricsAggregator;
    this.hostResourceProbe = hostResourceProbe;
    this.clock = clock;
  }

  @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Describe the service and its endpoints.")
  public ServiceInfoResponse root() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("chat", "/chat - POST: Send message to chatbot");
    endpoints.put("health", "/health - GET: Check API health");
    endpoints.put("metrics", "/metrics - GET: Performance metrics");
    endpoints.put("docs", "/swagger-ui.html - GET: API documentation");
    return new ServiceInfoResponse(
        SERVICE_NAME,
        SERVICE_VERSION,
        "active",
        properties.getModel(),
        properties.getFramework(),
        runtime.isModelLoaded(),
        endpoints);
  }

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Report configuration and readiness flags.")
  public Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("service", SERVICE_NAME);
    body.put("model_loaded", runtime.isModelLoaded());
    body.put("graph_ready", runtime.isGraphReady());
    body.put(
        properties.getProvider().toLowerCase(Locale.ROOT) + "_configured",
        runtime.isCredentialConfigured());
    body.put("timestamp", clock.instant().toString());
    return body;
  }

  @GetMapping(value = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Report chat counters, host resource usage and uptime.")
  public MetricsResponse metrics() {
    ChatMetricsSnapshot snapshot = metricsAggregator.snapshot();
    HostResources host = hostResourceProbe.sample();

    return new MetricsResponse(
        snapshot.capturedAt().toString(),
        round(snapshot.uptimeSeconds(), 2),
        new MetricsResponse.SystemStats(
            round(host.cpuPercent(), 1),
            round(host.memoryTotalGb(), 2),
            round(host.memoryUsedGb(), 2),
            round(host.memoryPercent(), 1)),
        new MetricsResponse.Performance(
            snapshot.totalMessages(),
            snapshot.totalConversations(),
            round(snapshot.totalProcessingTime(), 3),
            round(snapshot.averageResponseTime(), 3),
            round(snapshot.messagesPerSecond(), 2)),
        new MetricsResponse.Model(
            properties.getModel(),
            properties.getDisplayName(),
            properties.getFramework(),
            runtime.isModelLoaded(),
            runtime.isGraphReady()));
  }

  private static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }
}
