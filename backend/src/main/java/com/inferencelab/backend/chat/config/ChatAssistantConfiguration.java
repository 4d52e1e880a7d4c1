package com.inferencelab.backend.chat.config;

import com.inferencelab.backend.chat.graph.AssistantReplyNode;
import com.inferencelab.backend.chat.graph.TurnGraph;
import com.inferencelab.backend.chat.logging.ChatLoggingSupport;
import com.inferencelab.backend.chat.provider.AssistantCapability;
import com.inferencelab.backend.chat.provider.AssistantRuntime;
import com.inferencelab.backend.chat.provider.SpringAiAssistantCapability;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(ChatAssistantProperties.class)
public class ChatAssistantConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ChatAssistantConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AssistantRuntime assistantRuntime(
      ChatAssistantProperties properties, ChatLoggingSupport chatLoggingSupport) {
    log.info("Initializing conversational AI assistant '{}'", properties.getProvider());

    if (!properties.hasApiKey()) {
      log.warn(
          "No API key configured for provider '{}'; chat requests will be rejected until one is"
              + " set (app.chat.assistant.api-key / GEMINI_API_KEY)",
          properties.getProvider());
      return AssistantRuntime.unavailable(false);
    }

    try {
      AssistantCapability assistant = createAssistant(properties, chatLoggingSupport);
      TurnGraph graph = TurnGraph.builder().addNode(new AssistantReplyNode(assistant)).compile();
      log.info(
          "Conversational AI assistant ready: provider={}, model={}, nodes={}",
          properties.getProvider(),
          assistant.modelId(),
          graph.nodeNames());
      return AssistantRuntime.ready(assistant, graph);
    } catch (RuntimeException ex) {
      log.error(
          "Failed to initialize conversational AI assistant '{}': {}",
          properties.getProvider(),
          ex.getMessage(),
          ex);
      return AssistantRuntime.unavailable(true);
    }
  }

  static AssistantCapability createAssistant(
      ChatAssistantProperties properties, ChatLoggingSupport chatLoggingSupport) {
    OpenAiApi.Builder apiBuilder = OpenAiApi.builder().apiKey(properties.getApiKey());
    if (StringUtils.hasText(properties.getBaseUrl())) {
      apiBuilder.baseUrl(properties.getBaseUrl());
    }
    if (StringUtils.hasText(properties.getCompletionsPath())) {
      apiBuilder.completionsPath(properties.getCompletionsPath());
    }

    OpenAiChatOptions options = defaultOptions(properties);
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder().openAiApi(apiBuilder.build()).defaultOptions(options).build();
    ChatModel decorated = chatLoggingSupport.decorateModel(chatModel);

    return new SpringAiAssistantCapability(
        properties.getModel(), decorated, options, properties.getTimeout());
  }

  static OpenAiChatOptions defaultOptions(ChatAssistantProperties properties) {
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder().model(properties.getModel());
    if (properties.getTemperature() != null) {
      builder.temperature(properties.getTemperature());
    }
    if (properties.getMaxTokens() != null) {
      builder.maxTokens(properties.getMaxTokens());
    }
    return builder.build();
  }
}
