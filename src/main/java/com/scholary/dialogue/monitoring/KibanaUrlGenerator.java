package com.scholary.dialogue.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for batch job monitoring.
 *
 * <p>Every log line written while a batch runs carries the job ID in the MDC, so filtering on it
 * shows one batch's recordings end to end.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:dialogue-prep-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    return discoverUrl(String.format("jobId:\"%s\"", jobId));
  }

  // Format: /app/discover#/?_a=(index:'...',query:(language:kuery,query:'jobId:"abc-123"'))
  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
