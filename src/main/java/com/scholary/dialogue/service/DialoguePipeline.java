package com.scholary.dialogue.service;

import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.align.TranscriptSpeakerAligner;
import com.scholary.dialogue.dialogue.ConversationWindow;
import com.scholary.dialogue.dialogue.DialogueMessage;
import com.scholary.dialogue.dialogue.DialogueWindowizer;
import com.scholary.dialogue.grouping.GroupingResult;
import com.scholary.dialogue.grouping.SpeakerProfile;
import com.scholary.dialogue.grouping.UtteranceGrouper;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/**
 * Chains alignment, grouping and windowing.
 *
 * <p>Pure in-memory processing: no files, no remote calls. Data only flows forward, so the same
 * inputs always give the same result.
 */
@Component
public class DialoguePipeline {

  private final TranscriptSpeakerAligner aligner;
  private final UtteranceGrouper grouper;
  private final DialogueWindowizer windowizer;

  public DialoguePipeline(
      TranscriptSpeakerAligner aligner, UtteranceGrouper grouper, DialogueWindowizer windowizer) {
    this.aligner = aligner;
    this.grouper = grouper;
    this.windowizer = windowizer;
  }

  public PipelineResult run(
      List<TranscriptSegment> transcript,
      List<SpeakerSegment> speakers,
      SpeakerProfile profile,
      ProcessingOptions options) {
    return run(transcript, speakers, profile, options, utterance -> {});
  }

  /**
   * Run every stage.
   *
   * @param listener receives each attributed utterance as soon as it is produced
   */
  public PipelineResult run(
      List<TranscriptSegment> transcript,
      List<SpeakerSegment> speakers,
      SpeakerProfile profile,
      ProcessingOptions options,
      Consumer<AttributedUtterance> listener) {

    List<AttributedUtterance> utterances = aligner.align(transcript, speakers, listener);
    return regroup(utterances, profile, options);
  }

  /** Run grouping and windowing on an already attributed transcript. */
  public PipelineResult regroup(
      List<AttributedUtterance> utterances, SpeakerProfile profile, ProcessingOptions options) {

    GroupingResult grouping = grouper.group(utterances, profile, options.partnerPrefixPolicy());
    List<DialogueMessage> messages =
        windowizer.toMessages(grouping.turns(), options.lineJoinPolicy());
    List<ConversationWindow> windows = windowizer.windows(messages, options.windowSize());

    return new PipelineResult(utterances, grouping, messages, windows);
  }
}
