package com.inferencelab.backend.chat.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServiceInfoResponse(
    String service,
    String version,
    String status,
    String model,
    String framework,
    boolean modelLoaded,
    Map<String, String> endpoints) {}
