package com.scholary.dialogue.api;

import com.scholary.dialogue.dialogue.LineJoinPolicy;
import com.scholary.dialogue.grouping.PartnerPrefixPolicy;
import com.scholary.dialogue.grouping.SpeakerTags;
import com.scholary.dialogue.segment.SpeakerSegment;
import com.scholary.dialogue.segment.TranscriptSegment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request for running the pipeline on segments supplied inline.
 *
 * <p>Useful for checking a speaker profile against a short excerpt before running a batch.
 */
public record PreviewRequest(
    @NotNull List<@NotNull @Valid TranscriptSegment> transcriptSegments,
    @NotNull List<@NotNull @Valid SpeakerSegment> speakerSegments,
    @NotNull SpeakerTags speakers,
    @Min(1) @Max(100) Integer windowSize,
    PartnerPrefixPolicy partnerPrefixPolicy,
    LineJoinPolicy lineJoinPolicy) {}
