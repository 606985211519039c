package com.scholary.dialogue.segment;

import jakarta.validation.constraints.NotNull;

/**
 * A single segment of transcribed audio.
 *
 * <p>This matches the structure returned by the Whisper service. Segments arrive in chronological
 * order; {@code end > start} is expected but not guaranteed.
 */
public record TranscriptSegment(double start, double end, @NotNull String text) {

  public double duration() {
    return end - start;
  }

  public double midpoint() {
    return (start + end) / 2;
  }

  /** A segment with no positive duration cannot be scored by overlap ratio. */
  public boolean isMalformed() {
    return end <= start;
  }
}
