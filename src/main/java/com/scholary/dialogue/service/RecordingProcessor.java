package com.scholary.dialogue.service;

import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.dialogue.DialogueMessage.Sender;
import com.scholary.dialogue.diarization.DiarizationProvider;
import com.scholary.dialogue.grouping.AttributedTranscriptParser;
import com.scholary.dialogue.grouping.SpeakerProfile;
import com.scholary.dialogue.logging.StructuredLogger;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import com.scholary.dialogue.whisper.TranscriptionProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns one recording into an attributed transcript and a training artifact.
 *
 * <p>Outputs, in the output directory:
 *
 * <ul>
 *   <li>{@code <name>_final.txt}: one {@code "Speaker N: text"} line per transcript segment,
 *       written as alignment goes
 *   <li>{@code <name>_final.json} or {@code <name>_final.jsonl}: the training data
 * </ul>
 *
 * <p>A failure part way through leaves whatever was already written in place.
 */
@Service
public class RecordingProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingProcessor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TranscriptionProvider transcriptionProvider;
  private final DiarizationProvider diarizationProvider;
  private final DialoguePipeline pipeline;
  private final TrainingArtifactWriter artifactWriter;
  private final Path outputDir;

  public RecordingProcessor(
      TranscriptionProvider transcriptionProvider,
      DiarizationProvider diarizationProvider,
      DialoguePipeline pipeline,
      TrainingArtifactWriter artifactWriter,
      @Value("${prep.outputDir}") String outputDir) {

    this.transcriptionProvider = transcriptionProvider;
    this.diarizationProvider = diarizationProvider;
    this.pipeline = pipeline;
    this.artifactWriter = artifactWriter;
    this.outputDir = Paths.get(outputDir);
  }

  /**
   * Transcribe, diarize, align, group and window one recording.
   *
   * @param recording recording name, used for output file names
   * @param audioFile the recording's audio
   * @param profile speaker roles for this recording
   * @param options windowing and formatting choices
   * @return counts and output locations
   * @throws IOException if an output file cannot be written
   */
  public RecordingResult process(
      String recording, Path audioFile, SpeakerProfile profile, ProcessingOptions options)
      throws IOException {

    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);
    long startMs = System.currentTimeMillis();

    try {
      structuredLogger.logRecordingStarted(recording, audioFile.toString());

      List<TranscriptSegment> transcript = transcriptionProvider.transcribe(audioFile);
      List<SpeakerSegment> speakers = diarizationProvider.diarize(audioFile);

      Files.createDirectories(outputDir);
      Path attributedFile = attributedTranscriptFor(recording);

      PipelineResult result;
      try (TrainingArtifactWriter.AttributedTranscriptSink sink =
          artifactWriter.openAttributedTranscript(attributedFile)) {
        result = pipeline.run(transcript, speakers, profile, options, sink);
      }
      LOGGER.info("Final transcript with speakers saved to: {}", attributedFile);

      return finish(recording, attributedFile, result, options, startMs);

    } finally {
      MDC.remove("correlationId");
    }
  }

  /**
   * Rebuild the training artifact from an existing attributed transcript.
   *
   * <p>Used after correcting a speaker profile: transcription and diarization are not repeated.
   *
   * @throws IOException if the attributed transcript cannot be read or the artifact written
   */
  public RecordingResult regroup(
      String recording, SpeakerProfile profile, ProcessingOptions options) throws IOException {

    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);
    long startMs = System.currentTimeMillis();

    try {
      Path attributedFile = attributedTranscriptFor(recording);
      structuredLogger.logRecordingStarted(recording, attributedFile.toString());

      String content = Files.readString(attributedFile, StandardCharsets.UTF_8);
      List<AttributedUtterance> utterances = AttributedTranscriptParser.parse(content);
      LOGGER.info("Parsed {} utterances from {}", utterances.size(), attributedFile.getFileName());

      PipelineResult result = pipeline.regroup(utterances, profile, options);
      return finish(recording, attributedFile, result, options, startMs);

    } finally {
      MDC.remove("correlationId");
    }
  }

  public Path attributedTranscriptFor(String recording) {
    return OutputPaths.resolveWithin(outputDir, recording + "_final.txt");
  }

  private RecordingResult finish(
      String recording,
      Path attributedFile,
      PipelineResult result,
      ProcessingOptions options,
      long startMs)
      throws IOException {

    if (!result.grouping().unmappedSpeakers().isEmpty()) {
      structuredLogger.logUnmappedSpeakers(recording, result.grouping().unmappedSpeakers());
    }

    Path artifact =
        artifactWriter.writeArtifact(outputDir, recording, result, options.outputFormat());
    LOGGER.info(
        "Training data saved to: {} ({} human, {} gpt messages)",
        artifact,
        countFrom(result, Sender.HUMAN),
        countFrom(result, Sender.GPT));

    structuredLogger.logRecordingFinished(
        recording,
        result.utterances().size(),
        result.grouping().turns().size(),
        result.windows().size(),
        System.currentTimeMillis() - startMs);

    return new RecordingResult(
        recording,
        attributedFile.toString(),
        artifact.toString(),
        result.utterances().size(),
        result.grouping().turns().size(),
        result.messages().size(),
        result.windows().size(),
        result.grouping().unmappedSpeakers());
  }

  private long countFrom(PipelineResult result, Sender sender) {
    return result.messages().stream().filter(m -> m.from() == sender).count();
  }
}
