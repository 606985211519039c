package com.scholary.dialogue.grouping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns produced by the grouper, plus what it dropped.
 *
 * <p>{@code unmappedSpeakers} counts utterances per speaker label that the profile does not
 * mention, in first-seen order, so a profile can be audited against the transcript.
 */
public record GroupingResult(
    List<TurnGroup> turns, int droppedExcluded, Map<String, Integer> unmappedSpeakers) {

  public GroupingResult {
    turns = List.copyOf(turns);
    unmappedSpeakers = Collections.unmodifiableMap(new LinkedHashMap<>(unmappedSpeakers));
  }

  public int droppedUnmapped() {
    return unmappedSpeakers.values().stream().mapToInt(Integer::intValue).sum();
  }
}
