package com.scholary.dialogue.grouping;

import java.util.List;
import java.util.Map;

/**
 * Speaker roles as written in configuration or a request: raw diarization tags per role.
 *
 * <pre>
 * therapistSpeakers: [6, 12]
 * partners:
 *   Partner A: [2, 4]
 *   Partner B: [5]
 * excludedSpeakers: [1, 3]
 * </pre>
 */
public record SpeakerTags(
    List<String> therapistSpeakers,
    Map<String, List<String>> partners,
    List<String> excludedSpeakers) {

  public SpeakerTags {
    therapistSpeakers = therapistSpeakers != null ? therapistSpeakers : List.of();
    partners = partners != null ? partners : Map.of();
    excludedSpeakers = excludedSpeakers != null ? excludedSpeakers : List.of();
  }

  /**
   * @throws IllegalArgumentException if a tag is assigned to more than one role
   */
  public SpeakerProfile toProfile() {
    return SpeakerProfile.fromSpeakerTags(therapistSpeakers, partners, excludedSpeakers);
  }
}
