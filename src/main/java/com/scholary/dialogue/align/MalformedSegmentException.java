package com.scholary.dialogue.align;

/**
 * Exception thrown when a transcript segment has zero or negative duration and the aligner is
 * configured to reject such input.
 */
public class MalformedSegmentException extends RuntimeException {

  private final int segmentIndex;

  public MalformedSegmentException(int segmentIndex, double start, double end) {
    super(
        String.format(
            "Transcript segment %d has non-positive duration: start=%ss, end=%ss",
            segmentIndex, start, end));
    this.segmentIndex = segmentIndex;
  }

  public int getSegmentIndex() {
    return segmentIndex;
  }
}
