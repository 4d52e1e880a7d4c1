package com.inferencelab.backend.chat.config;

import com.inferencelab.backend.chat.logging.ChatLoggingSupport;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChatLoggingProperties.class)
public class ChatLoggingConfiguration {

  @Bean
  public ChatLoggingSupport chatLoggingSupport(ChatLoggingProperties properties) {
    return new ChatLoggingSupport(properties);
  }
}
