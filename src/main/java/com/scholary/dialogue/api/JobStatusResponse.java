package com.scholary.dialogue.api;

import com.scholary.dialogue.service.BatchSummary;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a batch job and includes the summary once it has finished.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    BatchSummary summary,
    String error,
    String kibanaUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
