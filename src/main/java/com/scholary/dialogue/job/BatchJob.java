package com.scholary.dialogue.job;

import com.scholary.dialogue.api.BatchRequest;
import com.scholary.dialogue.api.JobStatusResponse.Status;
import com.scholary.dialogue.service.BatchSummary;

/**
 * Represents an async batch job.
 *
 * <p>Tracks the job's state, progress, and summary. Stored in memory using Caffeine cache. Fields
 * are written by the worker thread and read by status requests, hence volatile.
 */
public class BatchJob {

  private final String jobId;
  private final BatchRequest request;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile BatchSummary summary;
  private volatile String error;

  public BatchJob(String jobId, BatchRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public BatchRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public BatchSummary getSummary() {
    return summary;
  }

  public void setSummary(BatchSummary summary) {
    this.summary = summary;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
