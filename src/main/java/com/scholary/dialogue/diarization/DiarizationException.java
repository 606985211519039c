package com.scholary.dialogue.diarization;

/**
 * Exception thrown when diarization of a recording fails.
 */
public class DiarizationException extends RuntimeException {

  public DiarizationException(String message) {
    super(message);
  }

  public DiarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
