package com.scholary.dialogue.job;

import com.scholary.dialogue.api.BatchRequest;
import com.scholary.dialogue.api.JobStatusResponse.Status;
import com.scholary.dialogue.config.PrepProperties;
import com.scholary.dialogue.logging.StructuredLogger;
import com.scholary.dialogue.service.BatchProcessor;
import com.scholary.dialogue.service.BatchSummary;
import com.scholary.dialogue.service.ProcessingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs batch jobs on the async executor and records their progress.
 */
@Component
public class BatchJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final BatchProcessor batchProcessor;
  private final JobRepository jobRepository;
  private final PrepProperties properties;

  public BatchJobRunner(
      BatchProcessor batchProcessor, JobRepository jobRepository, PrepProperties properties) {
    this.batchProcessor = batchProcessor;
    this.jobRepository = jobRepository;
    this.properties = properties;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>This runs in the thread pool configured by AsyncConfig. The job status is updated as
   * processing progresses.
   */
  @Async
  public void runAsync(BatchJob job) {
    run(job);
  }

  void run(BatchJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      BatchRequest request = job.getRequest();
      BatchSummary summary =
          batchProcessor.run(
              request.recordings(),
              optionsFor(request),
              request.regroupOnly(),
              (processed, total) -> {
                int percent = total == 0 ? 100 : processed * 100 / total;
                job.setProgress(percent);
                structuredLogger.logBatchProgress(job.getJobId(), processed, total, percent);
              });

      job.setSummary(summary);
      job.setProgress(100);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /** Request values win over configured defaults. */
  ProcessingOptions optionsFor(BatchRequest request) {
    ProcessingOptions defaults = properties.defaultOptions();
    return new ProcessingOptions(
        request.windowSize() != null ? request.windowSize() : defaults.windowSize(),
        request.outputFormat() != null ? request.outputFormat() : defaults.outputFormat(),
        request.partnerPrefixPolicy() != null
            ? request.partnerPrefixPolicy()
            : defaults.partnerPrefixPolicy(),
        request.lineJoinPolicy() != null ? request.lineJoinPolicy() : defaults.lineJoinPolicy());
  }
}
