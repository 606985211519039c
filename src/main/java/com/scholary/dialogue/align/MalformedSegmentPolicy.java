package com.scholary.dialogue.align;

/**
 * How the aligner treats transcript segments whose end is not after their start.
 */
public enum MalformedSegmentPolicy {
  /** Skip overlap scoring and attribute the segment by nearest midpoint. */
  FALLBACK,

  /** Abort alignment of the recording with a {@link MalformedSegmentException}. */
  REJECT
}
