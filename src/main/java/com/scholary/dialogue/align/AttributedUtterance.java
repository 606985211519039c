package com.scholary.dialogue.align;

/**
 * One transcript segment fused with the label of its best-matching speaker.
 *
 * <p>The label is already formatted, e.g. {@code "Speaker 7"} or {@code "Speaker Unknown"}.
 */
public record AttributedUtterance(String speakerLabel, String text) {

  /** Render as a transcript line: {@code "<speakerLabel>: <text>"}. */
  public String toLine() {
    return speakerLabel + ": " + text;
  }
}
