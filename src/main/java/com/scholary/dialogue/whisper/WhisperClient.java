package com.scholary.dialogue.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.http.AudioUploadClient;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the faster-whisper transcription API.
 *
 * <p>Sends the whole recording to {@code /api/v1/transcribe} and returns the segments of the
 * response.
 */
public class WhisperClient implements TranscriptionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final AudioUploadClient uploadClient;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        new AudioUploadClient(
            "Whisper",
            properties.baseUrl(),
            properties.connectTimeout(),
            properties.readTimeout(),
            properties.maxRetries(),
            objectMapper));
  }

  WhisperClient(AudioUploadClient uploadClient) {
    this.uploadClient = uploadClient;
  }

  @Override
  public List<TranscriptSegment> transcribe(Path audioFile) {
    LOGGER.info("Transcribing recording: file={}", audioFile.getFileName());
    long startMs = System.currentTimeMillis();

    try {
      WhisperResponse response =
          uploadClient.upload("/api/v1/transcribe", audioFile, WhisperResponse.class);
      List<TranscriptSegment> segments =
          response.segments() != null ? response.segments() : List.of();

      LOGGER.info(
          "Transcription successful: {} segments, language={}, took {}ms",
          segments.size(),
          response.language(),
          System.currentTimeMillis() - startMs);
      return segments;

    } catch (IOException e) {
      throw new TranscriptionException("Transcription failed for " + audioFile.getFileName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription interrupted", e);
    }
  }
}
