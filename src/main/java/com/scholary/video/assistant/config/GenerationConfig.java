package com.scholary.video.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.generation.GenerationBackend;
import com.scholary.video.assistant.generation.GenerationProperties;
import com.scholary.video.assistant.generation.OpenAiGenerationClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend client.
 *
 * <p>Wires the chat-completions client using properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

  @Bean
  public GenerationBackend generationBackend(
      GenerationProperties properties, ObjectMapper objectMapper) {
    return new OpenAiGenerationClient(properties, objectMapper);
  }
}
