package com.scholary.dialogue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.diarization.DiarizationClient;
import com.scholary.dialogue.diarization.DiarizationProperties;
import com.scholary.dialogue.diarization.DiarizationProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the diarization provider.
 */
@Configuration
@EnableConfigurationProperties(DiarizationProperties.class)
public class DiarizationConfig {

  @Bean
  public DiarizationProvider diarizationProvider(
      DiarizationProperties properties, ObjectMapper objectMapper) {
    return new DiarizationClient(properties, objectMapper);
  }
}
