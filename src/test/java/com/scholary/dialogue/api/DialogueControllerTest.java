package com.scholary.dialogue.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.dialogue.align.MalformedSegmentPolicy;
import com.scholary.dialogue.align.TranscriptSpeakerAligner;
import com.scholary.dialogue.config.PrepProperties;
import com.scholary.dialogue.dialogue.DialogueMessage;
import com.scholary.dialogue.dialogue.DialogueWindowizer;
import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;
import com.scholary.dialogue.grouping.SpeakerTags;
import com.scholary.dialogue.grouping.UtteranceGrouper;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import com.scholary.dialogue.service.DialoguePipeline;
import com.scholary.dialogue.service.MergeReport;
import com.scholary.dialogue.service.OutputFormat;
import com.scholary.dialogue.service.TrainingSetMerger;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class DialogueControllerTest {

  @Mock private TrainingSetMerger trainingSetMerger;

  private DialogueController controller;

  private final List<TranscriptSegment> transcript =
      List.of(
          new TranscriptSegment(0, 4, "We argued again."),
          new TranscriptSegment(4, 6, "Go on."),
          new TranscriptSegment(6, 9, "About chores."),
          new TranscriptSegment(9, 12, "And then?"));
  private final List<SpeakerSegment> speakers =
      List.of(
          new SpeakerSegment(0, 4, "2"),
          new SpeakerSegment(4, 6, "6"),
          new SpeakerSegment(6, 9, "2"),
          new SpeakerSegment(9, 12, "6"));

  @BeforeEach
  void setUp() {
    PrepProperties properties =
        new PrepProperties(
            "audio",
            "output",
            5,
            OutputFormat.JSONL_WINDOWS,
            PartnerPrefixPolicy.PREFIX_ON_CHANGE,
            LineJoinPolicy.SPACE,
            MalformedSegmentPolicy.FALLBACK,
            1,
            10,
            null);
    DialoguePipeline pipeline =
        new DialoguePipeline(
            new TranscriptSpeakerAligner(MalformedSegmentPolicy.FALLBACK),
            new UtteranceGrouper(),
            new DialogueWindowizer());
    controller = new DialogueController(pipeline, trainingSetMerger, properties);
  }

  @Test
  void preview_shouldReturnEveryStage() {
    PreviewRequest request =
        new PreviewRequest(
            transcript,
            speakers,
            new SpeakerTags(List.of("6"), Map.of("Partner A", List.of("2")), List.of()),
            1,
            null,
            null);

    PreviewResponse response = controller.preview(request).getBody();

    assertThat(response.attributedLines())
        .containsExactly(
            "Speaker 2: We argued again.",
            "Speaker 6: Go on.",
            "Speaker 2: About chores.",
            "Speaker 6: And then?");
    assertThat(response.messages())
        .containsExactly(
            DialogueMessage.human("[Partner A]: We argued again."),
            DialogueMessage.gpt("Go on."),
            DialogueMessage.human("[Partner A]: About chores."),
            DialogueMessage.gpt("And then?"));
    assertThat(response.windows()).hasSize(2);
    assertThat(response.windows().get(1).messages()).hasSize(2);
    assertThat(response.unmappedSpeakers()).isEmpty();
  }

  @Test
  void preview_shouldReportSpeakersMissingFromProfile() {
    PreviewRequest request =
        new PreviewRequest(
            transcript, speakers, new SpeakerTags(List.of("6"), null, null), null, null, null);

    PreviewResponse response = controller.preview(request).getBody();

    assertThat(response.unmappedSpeakers()).containsExactly(Map.entry("Speaker 2", 2));
    assertThat(response.windows()).isEmpty();
  }

  @Test
  void preview_shouldRejectConflictingRoles() {
    PreviewRequest request =
        new PreviewRequest(
            transcript,
            speakers,
            new SpeakerTags(List.of("6"), Map.of("Partner A", List.of("6")), List.of()),
            null,
            null,
            null);

    assertThatThrownBy(() -> controller.preview(request))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void mergeTrainingSet_shouldResolvePathsAgainstOutputDir() throws Exception {
    Path outputDir = Path.of("output");
    MergeReport report =
        new MergeReport(
            List.of("Ep.1_final.jsonl"),
            List.of(),
            List.of(),
            4,
            0,
            outputDir.resolve("train.jsonl").toString());
    when(trainingSetMerger.merge(
            eq(List.of(outputDir.resolve("Ep.1_final.jsonl"))), eq(outputDir.resolve("train.jsonl"))))
        .thenReturn(report);

    ResponseEntity<MergeReport> response =
        controller.mergeTrainingSet(new TrainingSetRequest(List.of("Ep.1_final.jsonl"), null));

    assertThat(response.getBody()).isSameAs(report);
  }

  @Test
  void mergeTrainingSet_shouldRejectOutputOutsideOutputDir() throws Exception {
    TrainingSetRequest request =
        new TrainingSetRequest(List.of("Ep.1_final.jsonl"), "../../escaped.jsonl");

    assertThatThrownBy(() -> controller.mergeTrainingSet(request))
        .isInstanceOf(IllegalArgumentException.class);
    verify(trainingSetMerger, never()).merge(any(), any());
  }

  @Test
  void mergeTrainingSet_shouldRejectAbsoluteInput() throws Exception {
    String elsewhere = Path.of("elsewhere.jsonl").toAbsolutePath().toString();
    TrainingSetRequest request = new TrainingSetRequest(List.of(elsewhere), null);

    assertThatThrownBy(() -> controller.mergeTrainingSet(request))
        .isInstanceOf(IllegalArgumentException.class);
    verify(trainingSetMerger, never()).merge(any(), any());
  }
}
