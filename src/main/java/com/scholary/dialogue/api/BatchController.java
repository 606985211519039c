package com.scholary.dialogue.api;

import com.scholary.dialogue.job.BatchJob;
import com.scholary.dialogue.job.BatchJobRunner;
import com.scholary.dialogue.job.JobRepository;
import com.scholary.dialogue.monitoring.KibanaUrlGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batch preparation.
 *
 * <p>Batches run asynchronously: submitting returns a job ID immediately and the client polls
 * {@code /api/batches/{id}} until the job completes.
 */
@RestController
@Tag(name = "Batches", description = "Prepare recordings into training data")
public class BatchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchController.class);

  private final BatchJobRunner batchJobRunner;
  private final JobRepository jobRepository;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public BatchController(
      BatchJobRunner batchJobRunner,
      JobRepository jobRepository,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.batchJobRunner = batchJobRunner;
    this.jobRepository = jobRepository;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  /** Start an asynchronous batch job. */
  @PostMapping("/api/batches")
  @Operation(
      summary = "Start batch",
      description = "Start an asynchronous batch job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody BatchRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Batch request: {} recordings", request.recordings().size());

    BatchJob job = new BatchJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async batch job: {}", jobId);

    batchJobRunner.runAsync(job);

    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(jobId, kibanaUrlGenerator.generateJobUrl(jobId)));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of a batch job. Once completed, includes the batch summary.
   */
  @GetMapping("/api/batches/{id}")
  @Operation(summary = "Get batch status", description = "Check the status of a batch job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getSummary(),
                        job.getError(),
                        kibanaUrlGenerator.generateJobUrl(job.getJobId()))))
        .orElse(ResponseEntity.notFound().build());
  }
}
