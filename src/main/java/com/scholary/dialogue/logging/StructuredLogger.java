package com.scholary.dialogue.logging;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log events with structured fields that can be queried in Kibana.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log recording started event. */
  public void logRecordingStarted(String recording, String audioFile) {
    try {
      MDC.put("event_type", "recording_started");
      MDC.put("recording", recording);
      MDC.put("audioFile", audioFile);

      logger.info("Recording started: name={}, audio={}", recording, audioFile);
    } finally {
      clearEventFields();
    }
  }

  /** Log recording finished event. */
  public void logRecordingFinished(
      String recording, int utterances, int turns, int windows, long durationMs) {
    try {
      MDC.put("event_type", "recording_finished");
      MDC.put("recording", recording);
      MDC.put("utterances", String.valueOf(utterances));
      MDC.put("turns", String.valueOf(turns));
      MDC.put("windows", String.valueOf(windows));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Recording finished: name={}, utterances={}, turns={}, windows={}, took={}ms",
          recording,
          utterances,
          turns,
          windows,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log recording skipped event. */
  public void logRecordingSkipped(String recording, String reason) {
    try {
      MDC.put("event_type", "recording_skipped");
      MDC.put("recording", recording);

      logger.warn("Recording skipped: name={}, reason={}", recording, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log recording failure event. */
  public void logRecordingFailed(String recording, String errorType, String message) {
    try {
      MDC.put("event_type", "recording_failed");
      MDC.put("recording", recording);
      MDC.put("errorType", errorType);

      logger.error(
          "Recording failed: name={}, error={}, message={}", recording, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log speakers that the profile does not mention, with utterance counts. */
  public void logUnmappedSpeakers(String recording, Map<String, Integer> unmappedSpeakers) {
    try {
      MDC.put("event_type", "unmapped_speakers");
      MDC.put("recording", recording);
      MDC.put("unmappedSpeakers", String.valueOf(unmappedSpeakers.keySet()));

      logger.warn(
          "Unmapped speakers dropped: name={}, speakers={}", recording, unmappedSpeakers);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress event. */
  public void logBatchProgress(String jobId, int processed, int total, int percentComplete) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("jobId", jobId);
      MDC.put("processed", String.valueOf(processed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Batch progress: jobId={}, recordings={}/{}, progress={}%",
          jobId,
          processed,
          total,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of a whole batch. */
  public void logBatchSummary(List<String> succeeded, List<String> skipped, List<String> failed) {
    try {
      MDC.put("event_type", "batch_summary");
      MDC.put("succeeded", String.valueOf(succeeded.size()));
      MDC.put("skipped", String.valueOf(skipped.size()));
      MDC.put("failed", String.valueOf(failed.size()));

      logger.info(
          "Batch summary: succeeded={} {}, skipped={} {}, failed={} {}",
          succeeded.size(),
          succeeded,
          skipped.size(),
          skipped,
          failed.size(),
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("recording");
    MDC.remove("audioFile");
    MDC.remove("utterances");
    MDC.remove("turns");
    MDC.remove("windows");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("unmappedSpeakers");
    MDC.remove("processed");
    MDC.remove("total");
    MDC.remove("percentComplete");
    MDC.remove("succeeded");
    MDC.remove("skipped");
    MDC.remove("failed");
  }
}
