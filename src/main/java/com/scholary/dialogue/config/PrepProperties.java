package com.scholary.dialogue.config;

import com.scholary.dialogue.align.MalformedSegmentPolicy;
import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;
import com.scholary.dialogue.grouping.SpeakerTags;
import com.scholary.dialogue.service.OutputFormat;
import com.scholary.dialogue.service.ProcessingOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for dialogue preparation.
 *
 * <p>{@code recordings} holds the speaker roles of known recordings, keyed by recording name. A
 * batch request that names a recording without giving its roles falls back to this map.
 */
@ConfigurationProperties(prefix = "prep")
@Validated
public record PrepProperties(
    @NotBlank String audioDir,
    @NotBlank String outputDir,
    @Positive int windowSize,
    @NotNull OutputFormat outputFormat,
    @NotNull PartnerPrefixPolicy partnerPrefixPolicy,
    @NotNull LineJoinPolicy lineJoinPolicy,
    @NotNull MalformedSegmentPolicy malformedSegmentPolicy,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    Map<String, SpeakerTags> recordings) {

  public PrepProperties {
    recordings = recordings != null ? recordings : Map.of();
  }

  public ProcessingOptions defaultOptions() {
    return new ProcessingOptions(windowSize, outputFormat, partnerPrefixPolicy, lineJoinPolicy);
  }
}
