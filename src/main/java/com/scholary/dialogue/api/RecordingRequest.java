package com.scholary.dialogue.api;

import com.scholary.dialogue.grouping.SpeakerTags;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * One recording of a batch.
 *
 * <p>{@code audioFile} defaults to {@code <audioDir>/<name>.mp3}. {@code speakers} defaults to the
 * roles configured for the name under {@code prep.recordings}. The name becomes part of
 * output file names, so it may not contain path separators.
 */
public record RecordingRequest(
    @NotBlank @Pattern(regexp = "[^/\\\\]+", message = "must not contain path separators")
        String name,
    String audioFile,
    SpeakerTags speakers) {}
