package com.scholary.dialogue.service;

/**
 * Shape of the training artifact written for each recording.
 */
public enum OutputFormat {
  /** One pretty-printed JSON array of every message: {@code <name>_final.json}. */
  JSON_ARRAY(".json"),

  /** One {@code {"conversations": [...]}} record per window and line: {@code <name>_final.jsonl}. */
  JSONL_WINDOWS(".jsonl");

  private final String extension;

  OutputFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }
}
