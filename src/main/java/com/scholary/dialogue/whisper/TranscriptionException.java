package com.scholary.dialogue.whisper;

/**
 * Exception thrown when a recording cannot be transcribed.
 *
 * <p>This could be due to network issues, service unavailability, invalid responses, or an
 * unreadable transcript cache file.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
