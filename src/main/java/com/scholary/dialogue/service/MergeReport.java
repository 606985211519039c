package com.scholary.dialogue.service;

import java.util.List;

/**
 * Outcome of merging JSONL files into one training file.
 *
 * <p>{@code output} is null when there was nothing to write.
 */
public record MergeReport(
    List<String> mergedFiles,
    List<String> missingFiles,
    List<String> unreadableFiles,
    int recordsWritten,
    int invalidLines,
    String output) {}
