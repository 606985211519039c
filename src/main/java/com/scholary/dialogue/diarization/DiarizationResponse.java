package com.scholary.dialogue.diarization;

import com.scholary.dialogue.segment.SpeakerSegment;
import java.util.List;

/** Response from the diarization API. */
public record DiarizationResponse(List<SpeakerSegment> segments) {}
