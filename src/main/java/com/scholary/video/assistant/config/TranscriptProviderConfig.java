package com.scholary.video.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.transcript.HttpTranscriptProvider;
import com.scholary.video.assistant.transcript.TranscriptProvider;
import com.scholary.video.assistant.transcript.TranscriptProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the transcript provider client.
 *
 * <p>Wires the HTTP client using properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties(TranscriptProviderProperties.class)
public class TranscriptProviderConfig {

  @Bean
  public TranscriptProvider transcriptProvider(
      TranscriptProviderProperties properties, ObjectMapper objectMapper) {
    return new HttpTranscriptProvider(properties, objectMapper);
  }
}
