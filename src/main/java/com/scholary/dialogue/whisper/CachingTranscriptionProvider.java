package com.scholary.dialogue.whisper;

import com.scholary.dialogue.segment.TranscriptFormat;
import com.scholary.dialogue.segment.TranscriptFormatException;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a plain-text copy of every transcript next to the output artifacts.
 *
 * <p>Once a recording has been transcribed the result is written to {@code <name>_whisper.txt} and
 * reused on later runs. The file is human-editable; see {@link TranscriptFormat}.
 */
public class CachingTranscriptionProvider implements TranscriptionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingTranscriptionProvider.class);

  private final TranscriptionProvider delegate;
  private final Path cacheDir;

  public CachingTranscriptionProvider(TranscriptionProvider delegate, Path cacheDir) {
    this.delegate = delegate;
    this.cacheDir = cacheDir;
  }

  @Override
  public List<TranscriptSegment> transcribe(Path audioFile) {
    Path cacheFile = cacheFileFor(audioFile);

    try {
      if (Files.exists(cacheFile)) {
        LOGGER.info("Loading existing transcription: {}", cacheFile);
        List<TranscriptSegment> segments =
            TranscriptFormat.parse(Files.readAllLines(cacheFile, StandardCharsets.UTF_8));
        LOGGER.info("Loaded {} segments from {}", segments.size(), cacheFile.getFileName());
        return segments;
      }

      LOGGER.info("No cached transcription for {}, transcribing", audioFile.getFileName());
      List<TranscriptSegment> segments = delegate.transcribe(audioFile);

      Files.createDirectories(cacheDir);
      Files.write(cacheFile, TranscriptFormat.format(segments), StandardCharsets.UTF_8);
      LOGGER.info("Transcription saved to: {}", cacheFile);
      return segments;

    } catch (IOException e) {
      throw new TranscriptionException("Failed to access transcript cache " + cacheFile, e);
    } catch (TranscriptFormatException e) {
      throw new TranscriptionException("Corrupt transcript cache " + cacheFile, e);
    }
  }

  /** {@code Ep.1.mp3} is cached as {@code Ep.1_whisper.txt}. */
  Path cacheFileFor(Path audioFile) {
    String fileName = audioFile.getFileName().toString();
    String stem = fileName.replaceAll("\\.[^.]+$", "");
    return cacheDir.resolve(stem + "_whisper.txt");
  }
}
