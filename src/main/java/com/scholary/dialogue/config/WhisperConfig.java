package com.scholary.dialogue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.whisper.CachingTranscriptionProvider;
import com.scholary.dialogue.whisper.TranscriptionProvider;
import com.scholary.dialogue.whisper.WhisperClient;
import com.scholary.dialogue.whisper.WhisperProperties;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the transcription provider.
 *
 * <p>The Whisper client is wrapped in a file cache kept in the output directory, so a recording is
 * only sent to Whisper once.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean
  public TranscriptionProvider transcriptionProvider(
      WhisperProperties properties, PrepProperties prepProperties, ObjectMapper objectMapper) {
    return new CachingTranscriptionProvider(
        new WhisperClient(properties, objectMapper), Paths.get(prepProperties.outputDir()));
  }
}
