package com.scholary.dialogue.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.diarization.DiarizationResponse;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the client against an in-process HTTP server standing in for the analysis service. */
class AudioUploadClientTest {

  private static final String RESPONSE =
      "{\"segments\":[{\"start\":0.0,\"end\":4.2,\"speakerTag\":\"3\"}]}";

  @TempDir Path tempDir;

  private HttpServer server;
  private Path audioFile;
  private final AtomicInteger requests = new AtomicInteger();
  private final AtomicReference<String> lastBody = new AtomicReference<>();

  @BeforeEach
  void setUp() throws IOException {
    audioFile = Files.write(tempDir.resolve("Ep.1.mp3"), new byte[] {1, 2, 3});
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private AudioUploadClient client(int maxRetries) {
    return new AudioUploadClient(
        "Diarization",
        "http://127.0.0.1:" + server.getAddress().getPort(),
        5,
        5,
        maxRetries,
        new ObjectMapper());
  }

  private void respond(int... statuses) {
    server.createContext(
        "/api/v1/diarize",
        exchange -> {
          int attempt = requests.getAndIncrement();
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1));
          int status = statuses[Math.min(attempt, statuses.length - 1)];
          byte[] body = (status == 200 ? RESPONSE : "unavailable").getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
  }

  @Test
  void upload_shouldSendMultipartFileAndParseResponse() throws Exception {
    respond(200);

    DiarizationResponse response =
        client(1).upload("/api/v1/diarize", audioFile, DiarizationResponse.class);

    assertThat(response.segments()).containsExactly(new SpeakerSegment(0.0, 4.2, "3"));
    assertThat(lastBody.get())
        .contains("Content-Disposition: form-data; name=\"file\"; filename=\"Ep.1.mp3\"")
        .contains("\u0001\u0002\u0003");
  }

  @Test
  void upload_shouldRetryAfterServerError() throws Exception {
    respond(503, 200);

    DiarizationResponse response =
        client(2).upload("/api/v1/diarize", audioFile, DiarizationResponse.class);

    assertThat(response.segments()).hasSize(1);
    assertThat(requests.get()).isEqualTo(2);
  }

  @Test
  void upload_shouldFailWithLastErrorWhenRetriesExhausted() {
    respond(500);

    assertThatThrownBy(
            () -> client(1).upload("/api/v1/diarize", audioFile, DiarizationResponse.class))
        .isInstanceOf(IOException.class)
        .hasMessage("Diarization failed after 1 attempts")
        .hasRootCauseMessage("Diarization returned status 500: unavailable");
  }
}
