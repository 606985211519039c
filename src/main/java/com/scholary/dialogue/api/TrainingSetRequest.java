package com.scholary.dialogue.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for merging per-recording JSONL files into one training file.
 *
 * <p>Paths resolve against the output directory and may not leave it.
 */
public record TrainingSetRequest(@NotEmpty List<@NotBlank String> inputs, String output) {

  // Provide defaults
  public TrainingSetRequest {
    if (output == null || output.isBlank()) {
      output = "train.jsonl";
    }
  }
}
