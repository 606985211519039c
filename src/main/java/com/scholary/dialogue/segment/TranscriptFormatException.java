package com.scholary.dialogue.segment;

/**
 * Exception thrown when a cached transcript file contains a line that cannot be parsed.
 */
public class TranscriptFormatException extends RuntimeException {

  public TranscriptFormatException(String message) {
    super(message);
  }

  public TranscriptFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
