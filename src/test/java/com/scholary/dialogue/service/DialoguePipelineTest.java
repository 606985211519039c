package com.scholary.dialogue.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.align.MalformedSegmentPolicy;
import com.scholary.dialogue.align.TranscriptSpeakerAligner;
import com.scholary.dialogue.dialogue.ConversationWindow;
import com.scholary.dialogue.dialogue.DialogueMessage;
import com.scholary.dialogue.dialogue.DialogueWindowizer;
import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;
import com.scholary.dialogue.grouping.Role;
import com.scholary.dialogue.grouping.SpeakerProfile;
import com.scholary.dialogue.grouping.TurnGroup;
import com.scholary.dialogue.grouping.UtteranceGrouper;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DialoguePipelineTest {

  private DialoguePipeline pipeline;
  private ProcessingOptions options;

  @BeforeEach
  void setUp() {
    pipeline =
        new DialoguePipeline(
            new TranscriptSpeakerAligner(MalformedSegmentPolicy.FALLBACK),
            new UtteranceGrouper(),
            new DialogueWindowizer());
    options =
        new ProcessingOptions(
            5, OutputFormat.JSONL_WINDOWS, PartnerPrefixPolicy.PREFIX_ON_CHANGE, LineJoinPolicy.SPACE);
  }

  @Test
  void run_shouldProduceNoWindowsWhenTherapistSpeaksFirstAndLast() {
    List<TranscriptSegment> transcript =
        List.of(new TranscriptSegment(0, 5, "hi"), new TranscriptSegment(5, 10, "how are you"));
    List<SpeakerSegment> speakers =
        List.of(new SpeakerSegment(0, 4, "A"), new SpeakerSegment(4, 10, "B"));
    SpeakerProfile profile =
        SpeakerProfile.fromSpeakerTags(
            List.of("A"), Map.of("Partner A", List.of("B")), List.of());

    PipelineResult result = pipeline.run(transcript, speakers, profile, options);

    assertThat(result.utterances())
        .extracting(AttributedUtterance::toLine)
        .containsExactly("Speaker A: hi", "Speaker B: how are you");
    assertThat(result.grouping().turns())
        .containsExactly(
            new TurnGroup(Role.THERAPIST, List.of("hi")),
            new TurnGroup(Role.CLIENT, List.of("[Partner A]: how are you")));
    assertThat(result.messages())
        .containsExactly(
            DialogueMessage.gpt("hi"), DialogueMessage.human("[Partner A]: how are you"));
    assertThat(result.windows()).isEmpty();
  }

  @Test
  void run_shouldBuildWindowsFromClientTherapistExchanges() {
    List<TranscriptSegment> transcript =
        List.of(
            new TranscriptSegment(0, 3, "We keep arguing."),
            new TranscriptSegment(3, 6, "About money."),
            new TranscriptSegment(6, 9, "Tell me more."),
            new TranscriptSegment(9, 12, "He never listens."),
            new TranscriptSegment(12, 15, "What do you hear?"));
    List<SpeakerSegment> speakers =
        List.of(
            new SpeakerSegment(0, 3, "2"),
            new SpeakerSegment(3, 6, "5"),
            new SpeakerSegment(6, 9, "6"),
            new SpeakerSegment(9, 12, "5"),
            new SpeakerSegment(12, 15, "6"));
    SpeakerProfile profile =
        SpeakerProfile.fromSpeakerTags(
            List.of("6"),
            Map.of("Partner A", List.of("2"), "Partner B", List.of("5")),
            List.of());

    PipelineResult result = pipeline.run(transcript, speakers, profile, options);

    DialogueMessage firstHuman =
        DialogueMessage.human("[Partner A]: We keep arguing. [Partner B]: About money.");
    DialogueMessage firstGpt = DialogueMessage.gpt("Tell me more.");
    DialogueMessage secondHuman = DialogueMessage.human("[Partner B]: He never listens.");
    DialogueMessage secondGpt = DialogueMessage.gpt("What do you hear?");

    assertThat(result.messages()).containsExactly(firstHuman, firstGpt, secondHuman, secondGpt);
    assertThat(result.windows())
        .extracting(ConversationWindow::messages)
        .containsExactly(
            List.of(firstHuman, firstGpt),
            List.of(firstHuman, firstGpt, secondHuman, secondGpt));
  }

  @Test
  void regroup_shouldApplyNewProfileToExistingUtterances() {
    List<AttributedUtterance> utterances =
        List.of(
            new AttributedUtterance("Speaker 1", "question"),
            new AttributedUtterance("Speaker 2", "answer"));
    SpeakerProfile profile =
        SpeakerProfile.fromSpeakerTags(
            List.of("2"), Map.of("Partner A", List.of("1")), List.of());
    ProcessingOptions newlineOptions =
        new ProcessingOptions(
            1, OutputFormat.JSON_ARRAY, PartnerPrefixPolicy.ALWAYS_PREFIX, LineJoinPolicy.NEWLINE);

    PipelineResult result = pipeline.regroup(utterances, profile, newlineOptions);

    assertThat(result.utterances()).isEqualTo(utterances);
    assertThat(result.messages())
        .containsExactly(
            DialogueMessage.human("[Partner A]: question"), DialogueMessage.gpt("answer"));
    assertThat(result.windows()).hasSize(1);
  }
}
