package com.scholary.dialogue.service;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch: which recordings succeeded, which were skipped because their input was
 * missing, and which failed and why.
 */
public record BatchSummary(
    List<String> succeeded,
    List<String> skipped,
    List<String> failed,
    Map<String, String> failures,
    List<RecordingResult> results) {

  public int attempted() {
    return succeeded.size() + skipped.size() + failed.size();
  }
}
