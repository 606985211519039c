package com.scholary.dialogue.dialogue;

/** Separator used to join the lines of a turn into one message. */
public enum LineJoinPolicy {
  NEWLINE("\n"),
  SPACE(" ");

  private final String separator;

  LineJoinPolicy(String separator) {
    this.separator = separator;
  }

  public String separator() {
    return separator;
  }
}
