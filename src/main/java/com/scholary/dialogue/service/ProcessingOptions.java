package com.scholary.dialogue.service;

import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;

/** Per-run choices for turning an attributed transcript into training data. */
public record ProcessingOptions(
    int windowSize,
    OutputFormat outputFormat,
    PartnerPrefixPolicy partnerPrefixPolicy,
    LineJoinPolicy lineJoinPolicy) {

  public ProcessingOptions {
    if (windowSize < 1) {
      throw new IllegalArgumentException("Window size must be positive: " + windowSize);
    }
  }
}
