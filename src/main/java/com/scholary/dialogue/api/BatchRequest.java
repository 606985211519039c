package com.scholary.dialogue.api;

import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;
import com.scholary.dialogue.service.OutputFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for preparing a batch of recordings.
 *
 * <p>Unset options fall back to the configured defaults. With {@code regroupOnly} the existing
 * attributed transcripts are regrouped and nothing is sent to transcription or diarization.
 */
public record BatchRequest(
    @NotEmpty List<@Valid RecordingRequest> recordings,
    @Min(1) @Max(100) Integer windowSize,
    OutputFormat outputFormat,
    PartnerPrefixPolicy partnerPrefixPolicy,
    LineJoinPolicy lineJoinPolicy,
    Boolean regroupOnly) {

  // Provide defaults
  public BatchRequest {
    if (regroupOnly == null) {
      regroupOnly = false;
    }
  }
}
