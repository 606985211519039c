package com.scholary.dialogue.service;

import com.scholary.dialogue.api.RecordingRequest;
import com.scholary.dialogue.config.PrepProperties;
import com.scholary.dialogue.grouping.SpeakerProfile;
import com.scholary.dialogue.grouping.SpeakerTags;
import com.scholary.dialogue.logging.StructuredLogger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes many recordings, one after another.
 *
 * <p>A recording whose input is missing is skipped. Any other problem with one recording, from a
 * bad speaker profile to a diarization outage, marks that recording failed and the batch carries
 * on. Output already written for a failed recording is left in place.
 */
@Service
public class BatchProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final RecordingProcessor recordingProcessor;
  private final PrepProperties properties;

  public BatchProcessor(RecordingProcessor recordingProcessor, PrepProperties properties) {
    this.recordingProcessor = recordingProcessor;
    this.properties = properties;
  }

  /**
   * Process every recording of a batch.
   *
   * @param recordings the recordings, in processing order
   * @param options windowing and formatting choices shared by the batch
   * @param regroupOnly regroup existing attributed transcripts instead of processing audio
   * @param progress notified after each recording
   * @return the batch summary
   */
  public BatchSummary run(
      List<RecordingRequest> recordings,
      ProcessingOptions options,
      boolean regroupOnly,
      ProgressListener progress) {

    LOGGER.info(
        "Starting batch of {} recordings (regroupOnly={}, windowSize={}, format={})",
        recordings.size(),
        regroupOnly,
        options.windowSize(),
        options.outputFormat());

    List<String> succeeded = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    List<RecordingResult> results = new ArrayList<>();

    for (int i = 0; i < recordings.size(); i++) {
      RecordingRequest recording = recordings.get(i);
      String name = recording.name();

      Path input;
      try {
        input =
            regroupOnly ? recordingProcessor.attributedTranscriptFor(name) : audioFileFor(recording);
      } catch (IllegalArgumentException e) {
        structuredLogger.logRecordingFailed(name, e.getClass().getSimpleName(), e.getMessage());
        failed.add(name);
        failures.put(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        progress.onProgress(i + 1, recordings.size());
        continue;
      }

      if (!Files.exists(input)) {
        structuredLogger.logRecordingSkipped(name, "File not found: " + input);
        skipped.add(name);
      } else {
        try {
          SpeakerProfile profile = profileFor(recording);
          RecordingResult result =
              regroupOnly
                  ? recordingProcessor.regroup(name, profile, options)
                  : recordingProcessor.process(name, input, profile, options);
          results.add(result);
          succeeded.add(name);
        } catch (Exception e) {
          structuredLogger.logRecordingFailed(name, e.getClass().getSimpleName(), e.getMessage());
          LOGGER.debug("Failure detail for {}", name, e);
          failed.add(name);
          failures.put(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
      }

      progress.onProgress(i + 1, recordings.size());
    }

    structuredLogger.logBatchSummary(succeeded, skipped, failed);
    return new BatchSummary(succeeded, skipped, failed, failures, results);
  }

  private Path audioFileFor(RecordingRequest recording) {
    if (recording.audioFile() != null && !recording.audioFile().isBlank()) {
      return Paths.get(recording.audioFile());
    }
    return OutputPaths.resolveWithin(Paths.get(properties.audioDir()), recording.name() + ".mp3");
  }

  /**
   * @throws IllegalStateException if neither the request nor configuration gives speaker roles
   * @throws IllegalArgumentException if a speaker is assigned more than one role
   */
  private SpeakerProfile profileFor(RecordingRequest recording) {
    SpeakerTags tags = recording.speakers();
    if (tags == null) {
      tags = properties.recordings().get(recording.name());
    }
    if (tags == null) {
      throw new IllegalStateException(
          "No speaker configuration found for recording " + recording.name());
    }
    return tags.toProfile();
  }
}
