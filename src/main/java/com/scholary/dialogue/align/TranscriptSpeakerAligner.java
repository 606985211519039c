package com.scholary.dialogue.align;

import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fuses transcript segments with diarization speaker segments.
 *
 * <p>Each transcript segment is attributed to the speaker segment that covers the largest share
 * of its duration. When no speaker segment overlaps it at all, which happens often at fast speaker
 * turnovers because the two engines segment audio independently, the speaker segment with the
 * nearest midpoint wins instead.
 *
 * <p>Output has exactly one utterance per transcript segment, in transcript order. Ties are broken
 * by first-seen order so repeated runs give identical results.
 *
 * <p>Cost is O(transcript segments x speaker segments).
 */
@Component
public class TranscriptSpeakerAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSpeakerAligner.class);

  public static final String SPEAKER_PREFIX = "Speaker ";
  public static final String UNKNOWN_SPEAKER = SPEAKER_PREFIX + "Unknown";

  private final MalformedSegmentPolicy malformedSegmentPolicy;

  public TranscriptSpeakerAligner(
      @Value("${prep.malformedSegmentPolicy:FALLBACK}")
          MalformedSegmentPolicy malformedSegmentPolicy) {
    this.malformedSegmentPolicy = malformedSegmentPolicy;
  }

  public List<AttributedUtterance> align(
      List<TranscriptSegment> transcript, List<SpeakerSegment> speakers) {
    return align(transcript, speakers, utterance -> {});
  }

  /**
   * Attribute every transcript segment to a speaker.
   *
   * @param transcript transcript segments in chronological order
   * @param speakers speaker segments in any order
   * @param listener receives each utterance as soon as it is attributed
   * @return one utterance per transcript segment, same order
   * @throws MalformedSegmentException if a segment has no positive duration and the policy is
   *     {@link MalformedSegmentPolicy#REJECT}
   */
  public List<AttributedUtterance> align(
      List<TranscriptSegment> transcript,
      List<SpeakerSegment> speakers,
      Consumer<AttributedUtterance> listener) {

    LOGGER.info(
        "Aligning {} transcript segments with {} speaker segments",
        transcript.size(),
        speakers.size());

    List<AttributedUtterance> utterances = new ArrayList<>(transcript.size());
    int fallbacks = 0;

    for (int i = 0; i < transcript.size(); i++) {
      TranscriptSegment segment = transcript.get(i);

      SpeakerSegment best = null;
      if (segment.isMalformed()) {
        if (malformedSegmentPolicy == MalformedSegmentPolicy.REJECT) {
          throw new MalformedSegmentException(i, segment.start(), segment.end());
        }
        LOGGER.warn(
            "Segment {} has non-positive duration ({}s-{}s), using midpoint match",
            i,
            segment.start(),
            segment.end());
      } else {
        best = bestOverlap(segment, speakers);
      }

      if (best == null) {
        best = nearestMidpoint(segment, speakers);
        fallbacks++;
      }

      String label = best != null ? SPEAKER_PREFIX + best.speakerTag() : UNKNOWN_SPEAKER;
      AttributedUtterance utterance = new AttributedUtterance(label, segment.text().strip());
      utterances.add(utterance);
      listener.accept(utterance);
    }

    LOGGER.info(
        "Alignment complete: {} utterances, {} attributed by midpoint fallback",
        utterances.size(),
        fallbacks);
    return utterances;
  }

  /**
   * Share of the transcript segment's duration covered by the speaker segment.
   *
   * <p>Not clamped: negative when the two do not overlap.
   */
  public static double score(TranscriptSegment segment, SpeakerSegment speaker) {
    return speaker.overlapWith(segment) / segment.duration();
  }

  /** Speaker segment with the strictly greatest positive score, or null. */
  private SpeakerSegment bestOverlap(TranscriptSegment segment, List<SpeakerSegment> speakers) {
    double maxScore = 0;
    SpeakerSegment best = null;

    for (SpeakerSegment speaker : speakers) {
      double score = score(segment, speaker);
      if (score > maxScore) {
        maxScore = score;
        best = speaker;
      }
    }
    return best;
  }

  /** Speaker segment whose midpoint is closest, or null when there are none. */
  private SpeakerSegment nearestMidpoint(TranscriptSegment segment, List<SpeakerSegment> speakers) {
    double midpoint = segment.midpoint();
    double minDistance = Double.POSITIVE_INFINITY;
    SpeakerSegment closest = null;

    for (SpeakerSegment speaker : speakers) {
      double distance = Math.abs(midpoint - speaker.midpoint());
      if (distance < minDistance) {
        minDistance = distance;
        closest = speaker;
      }
    }
    return closest;
  }
}
