package com.scholary.dialogue.api;

import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.config.PrepProperties;
import com.scholary.dialogue.grouping.SpeakerProfile;
import com.scholary.dialogue.service.DialoguePipeline;
import com.scholary.dialogue.service.MergeReport;
import com.scholary.dialogue.service.OutputPaths;
import com.scholary.dialogue.service.PipelineResult;
import com.scholary.dialogue.service.ProcessingOptions;
import com.scholary.dialogue.service.TrainingSetMerger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous endpoints: previewing the pipeline on inline segments and merging training files.
 */
@RestController
@Tag(name = "Dialogue", description = "Pipeline preview and training set assembly")
public class DialogueController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DialogueController.class);

  private final DialoguePipeline pipeline;
  private final TrainingSetMerger trainingSetMerger;
  private final PrepProperties properties;

  public DialogueController(
      DialoguePipeline pipeline, TrainingSetMerger trainingSetMerger, PrepProperties properties) {
    this.pipeline = pipeline;
    this.trainingSetMerger = trainingSetMerger;
    this.properties = properties;
  }

  /**
   * Run alignment, grouping and windowing without writing any files.
   *
   * <p>An invalid speaker profile (one speaker in two roles) is rejected with 400.
   */
  @PostMapping("/api/preview")
  @Operation(
      summary = "Preview pipeline",
      description = "Align inline segments and return every intermediate stage")
  public ResponseEntity<PreviewResponse> preview(@Valid @RequestBody PreviewRequest request) {
    SpeakerProfile profile = request.speakers().toProfile();

    ProcessingOptions defaults = properties.defaultOptions();
    ProcessingOptions options =
        new ProcessingOptions(
            request.windowSize() != null ? request.windowSize() : defaults.windowSize(),
            defaults.outputFormat(),
            request.partnerPrefixPolicy() != null
                ? request.partnerPrefixPolicy()
                : defaults.partnerPrefixPolicy(),
            request.lineJoinPolicy() != null ? request.lineJoinPolicy() : defaults.lineJoinPolicy());

    PipelineResult result =
        pipeline.run(request.transcriptSegments(), request.speakerSegments(), profile, options);

    List<String> lines = result.utterances().stream().map(AttributedUtterance::toLine).toList();
    return ResponseEntity.ok(
        new PreviewResponse(
            lines,
            result.grouping().turns(),
            result.messages(),
            result.windows(),
            result.grouping().unmappedSpeakers()));
  }

  /**
   * Merge per-recording JSONL files into one training file.
   *
   * <p>Inputs and output must stay inside the output directory; anything else is a 400.
   */
  @PostMapping("/api/training-set")
  @Operation(
      summary = "Merge training set",
      description = "Concatenate per-recording JSONL files into a single training file")
  public ResponseEntity<MergeReport> mergeTrainingSet(
      @Valid @RequestBody TrainingSetRequest request) throws IOException {

    Path outputDir = Paths.get(properties.outputDir());
    List<Path> inputs =
        request.inputs().stream()
            .map(input -> OutputPaths.resolveWithin(outputDir, input))
            .toList();
    Path output = OutputPaths.resolveWithin(outputDir, request.output());

    LOGGER.info("Merging {} files into {}", inputs.size(), output);
    return ResponseEntity.ok(trainingSetMerger.merge(inputs, output));
  }
}
