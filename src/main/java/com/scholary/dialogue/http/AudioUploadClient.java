package com.scholary.dialogue.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads an audio file to an analysis service and parses its JSON reply.
 *
 * <p>Shared by the transcription and diarization clients. Both services take a single multipart
 * file part and answer with JSON, and both calls can run for a long time on a full recording, so
 * transient failures are retried with exponential backoff.
 *
 * <p>Uses the Java 11+ HttpClient directly; multipart bodies are assembled by hand because the
 * client has no built-in support for them.
 */
public class AudioUploadClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioUploadClient.class);

  private final String serviceName;
  private final String baseUrl;
  private final Duration readTimeout;
  private final int maxRetries;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public AudioUploadClient(
      String serviceName,
      String baseUrl,
      int connectTimeoutSeconds,
      int readTimeoutSeconds,
      int maxRetries,
      ObjectMapper objectMapper) {
    this.serviceName = serviceName;
    this.baseUrl = baseUrl;
    this.readTimeout = Duration.ofSeconds(readTimeoutSeconds);
    this.maxRetries = maxRetries;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connectTimeoutSeconds)).build();

    LOGGER.info("Initialized {} client: baseUrl={}", serviceName, baseUrl);
  }

  /**
   * Upload the file and parse the response, retrying transient failures.
   *
   * @param path endpoint path, appended to the base URL
   * @param audioFile the recording to upload
   * @param responseType type to parse the JSON response into
   * @return the parsed response
   * @throws IOException if every attempt failed; carries the last failure
   * @throws InterruptedException if interrupted while waiting to retry
   */
  public <T> T upload(String path, Path audioFile, Class<T> responseType)
      throws IOException, InterruptedException {

    IOException lastException = null;

    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      try {
        return attemptUpload(path, audioFile, responseType);
      } catch (IOException e) {
        lastException = e;
        if (attempt < maxRetries) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "{} attempt {} failed, retrying in {}ms: {}",
              serviceName,
              attempt,
              backoffMs,
              e.getMessage());
          Thread.sleep(backoffMs);
        }
      }
    }

    throw new IOException(
        String.format("%s failed after %d attempts", serviceName, maxRetries), lastException);
  }

  private <T> T attemptUpload(String path, Path audioFile, Class<T> responseType)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(readTimeout)
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(audioFile, boundary))
            .build();

    LOGGER.debug("Sending {} request to {}", serviceName, request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "%s returned status %d: %s", serviceName, response.statusCode(), response.body()));
    }

    return objectMapper.readValue(response.body(), responseType);
  }

  /**
   * Build a multipart/form-data body with a single file part.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="session.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    String contentType = Files.probeContentType(audioFile);
    if (contentType == null) {
      contentType = "application/octet-stream";
    }

    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + audioFile.getFileName()
            + "\"\r\n"
            + "Content-Type: "
            + contentType
            + "\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";

    byte[] prefix = head.getBytes(StandardCharsets.UTF_8);
    byte[] fileBytes = Files.readAllBytes(audioFile);
    byte[] suffix = tail.getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }
}
