package com.scholary.dialogue.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.dialogue.api.BatchRequest;
import com.scholary.dialogue.api.JobStatusResponse.Status;
import com.scholary.dialogue.api.RecordingRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final BatchRequest request =
      new BatchRequest(List.of(new RecordingRequest("Ep.1", null, null)), null, null, null, null, null);

  @Test
  void save_shouldMakeJobFindable() {
    JobRepository repository = new JobRepository(10, 60);
    BatchJob job = new BatchJob("job-1", request);

    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
    assertThat(repository.findById("job-2")).isEmpty();
  }

  @Test
  void newJob_shouldStartPending() {
    BatchJob job = new BatchJob("job-1", request);

    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getRequest().regroupOnly()).isFalse();
  }
}
