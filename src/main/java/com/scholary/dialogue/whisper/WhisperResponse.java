package com.scholary.dialogue.whisper;

import com.scholary.dialogue.segment.TranscriptSegment;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments and the detected language.
 */
public record WhisperResponse(List<TranscriptSegment> segments, String language) {}
