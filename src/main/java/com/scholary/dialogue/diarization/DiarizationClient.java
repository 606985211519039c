package com.scholary.dialogue.diarization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.http.AudioUploadClient;
import com.scholary.dialogue.segment.SpeakerSegment;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the speaker diarization API.
 *
 * <p>Posts the recording to {@code /api/v1/diarize}, which answers with
 * {@code {"segments": [{"start": 0.0, "end": 4.2, "speakerTag": "3"}]}}.
 */
public class DiarizationClient implements DiarizationProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationClient.class);

  private final AudioUploadClient uploadClient;

  public DiarizationClient(DiarizationProperties properties, ObjectMapper objectMapper) {
    this(
        new AudioUploadClient(
            "Diarization",
            properties.baseUrl(),
            properties.connectTimeout(),
            properties.readTimeout(),
            properties.maxRetries(),
            objectMapper));
  }

  DiarizationClient(AudioUploadClient uploadClient) {
    this.uploadClient = uploadClient;
  }

  @Override
  public List<SpeakerSegment> diarize(Path audioFile) {
    LOGGER.info("Starting speaker diarization: file={}", audioFile.getFileName());

    try {
      DiarizationResponse response =
          uploadClient.upload("/api/v1/diarize", audioFile, DiarizationResponse.class);
      List<SpeakerSegment> segments =
          response.segments() != null ? response.segments() : List.of();

      long speakers = segments.stream().map(SpeakerSegment::speakerTag).distinct().count();
      LOGGER.info("Diarization complete: {} segments, {} speakers", segments.size(), speakers);
      return segments;

    } catch (IOException e) {
      throw new DiarizationException("Diarization failed for " + audioFile.getFileName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DiarizationException("Diarization interrupted", e);
    }
  }
}
