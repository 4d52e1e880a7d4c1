package com.inferencelab.backend.chat.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat.assistant")
@Validated
public class ChatAssistantProperties {

  static final String DEFAULT_SYSTEM_PROMPT =
      """
      You are a helpful, friendly, and knowledgeable AI assistant.
      You provide accurate, helpful responses while maintaining a conversational tone.
      You can discuss a wide range of topics and help users with various tasks.

      Key guidelines:
      - Be helpful and informative
      - Maintain context from previous messages in the conversation
      - Ask clarifying questions when needed
      - Provide step-by-step explanations for complex topics
      - Be concise but thorough in your responses
      """;

  /**
   * Short provider identifier, also used to name the {@code <provider>_configured} health flag.
   */
  @NotBlank private String provider = "gemini";

  private String displayName = "Google Generative AI";
  private String framework = "Spring AI";

  /**
   * Base URL of the OpenAI-compatible endpoint.
   */
  private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";

  private String completionsPath = "/chat/completions";

  /**
   * Credential of the assistant. Absent means the chat feature runs in the unavailable state.
   */
  private String apiKey;

  @NotBlank private String model = "gemini-1.5-flash";
  private Double temperature = 0.7;
  private Integer maxTokens = 1000;

  /**
   * Upper bound for a single assistant invocation. Not overridable per request.
   */
  private Duration timeout = Duration.ofSeconds(30);

  private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

  public boolean hasApiKey() {
    return StringUtils.hasText(apiKey);
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public String getFramework() {
    return framework;
  }

  public void setFramework(String framework) {
    this.framework = framework;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getCompletionsPath() {
    return completionsPath;
  }

  public void setCompletionsPath(String completionsPath) {
    this.completionsPath = completionsPath;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public Double getTemperature() {
    return temperature;
  }

  public void setTemperature(Double temperature) {
    this.temperature = temperature;
  }

  public Integer getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(Integer maxTokens) {
    this.maxTokens = maxTokens;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public String getSystemPrompt() {
    return systemPrompt;
  }

  public void setSystemPrompt(String systemPrompt) {
    this.systemPrompt = systemPrompt;
  }
}
