package com.inferencelab.backend.common.web;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(CorsProperties.class)
public class WebCorsConfiguration implements WebMvcConfigurer {

  private final CorsProperties properties;

  public WebCorsConfiguration(CorsProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOrigins(properties.getAllowedOrigins().toArray(String[]::new))
        .allowedMethods(properties.getAllowedMethods().toArray(String[]::new))
        .allowedHeaders("*")
        .allowCredentials(properties.isAllowCredentials());
  }
}
