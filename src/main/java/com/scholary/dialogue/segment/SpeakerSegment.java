package com.scholary.dialogue.segment;

import jakarta.validation.constraints.NotBlank;

/**
 * A speaker turn reported by the diarization service.
 *
 * <p>Speaker segments are unordered relative to the transcript and may overlap each other. The tag
 * is an anonymous identifier assigned by the diarization engine.
 */
public record SpeakerSegment(double start, double end, @NotBlank String speakerTag) {

  public double midpoint() {
    return (start + end) / 2;
  }

  /**
   * Overlap in seconds with a transcript segment.
   *
   * <p>Negative when the two do not overlap.
   */
  public double overlapWith(TranscriptSegment segment) {
    return Math.min(segment.end(), end) - Math.max(segment.start(), start);
  }
}
