package com.scholary.dialogue.service;

import java.util.Map;

/**
 * Outcome of processing one recording.
 *
 * <p>Paths are kept as strings so the result can be returned over the API as is.
 */
public record RecordingResult(
    String recording,
    String attributedTranscript,
    String artifact,
    int utterances,
    int turns,
    int messages,
    int windows,
    Map<String, Integer> unmappedSpeakers) {}
