package com.scholary.dialogue.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.dialogue.ConversationWindow;
import com.scholary.dialogue.dialogue.DialogueMessage;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/**
 * Writes the per-recording outputs.
 *
 * <p>Supports the attributed transcript (human-readable, one speaker line per segment) and two
 * training formats: a JSON array of messages and JSONL conversation windows.
 */
@Component
public class TrainingArtifactWriter {

  private final ObjectMapper objectMapper;

  public TrainingArtifactWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Open an attributed transcript for line-by-line writing.
   *
   * <p>Every line is flushed as soon as it is written so a crash mid-recording leaves the lines
   * attributed so far on disk. An existing file is replaced.
   */
  public AttributedTranscriptSink openAttributedTranscript(Path file) throws IOException {
    return new AttributedTranscriptSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  /**
   * Write messages as one pretty-printed JSON array.
   *
   * <pre>
   * [ {
   *   "from" : "gpt",
   *   "value" : "How was your week?"
   * } ]
   * </pre>
   */
  public byte[] writeMessagesJson(List<DialogueMessage> messages) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(messages);
  }

  /**
   * Write windows as JSON Lines, one {@code {"conversations": [...]}} record per line.
   */
  public byte[] writeConversationsJsonl(List<ConversationWindow> windows) throws IOException {
    StringBuilder jsonl = new StringBuilder();
    for (ConversationWindow window : windows) {
      jsonl.append(objectMapper.writeValueAsString(window)).append("\n");
    }
    return jsonl.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Write the training artifact for a recording in the requested format.
   *
   * @return the file written
   */
  public Path writeArtifact(
      Path outputDir, String recording, PipelineResult result, OutputFormat format)
      throws IOException {

    Path file = OutputPaths.resolveWithin(outputDir, recording + "_final" + format.extension());
    byte[] content =
        format == OutputFormat.JSON_ARRAY
            ? writeMessagesJson(result.messages())
            : writeConversationsJsonl(result.windows());

    Files.createDirectories(outputDir);
    Files.write(file, content);
    return file;
  }

  /** Appends attributed lines to a transcript file, flushing after each one. */
  public static final class AttributedTranscriptSink
      implements Consumer<AttributedUtterance>, Closeable {

    private final BufferedWriter writer;

    private AttributedTranscriptSink(BufferedWriter writer) {
      this.writer = writer;
    }

    @Override
    public void accept(AttributedUtterance utterance) {
      try {
        writer.write(utterance.toLine());
        writer.write("\n");
        writer.flush();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write attributed line", e);
      }
    }

    @Override
    public void close() throws IOException {
      writer.close();
    }
  }
}
