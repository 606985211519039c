package com.scholary.dialogue.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for batch jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so completed jobs do not accumulate
 * forever. The artifacts themselves live on disk; only the job bookkeeping is lost on restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, BatchJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(BatchJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<BatchJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
