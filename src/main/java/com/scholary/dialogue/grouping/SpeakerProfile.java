package com.scholary.dialogue.grouping;

import com.scholary.dialogue.align.TranscriptSpeakerAligner;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which diarized speakers of one recording are the therapist, which are clients and which are
 * noise to be left out.
 *
 * <p>Diarization usually splits one real person into several anonymous speakers, so each role is
 * a set of speaker labels. Client labels map to a partner name such as {@code "Partner A"}. A label
 * may appear in at most one of the three groups; labels in none are dropped when grouping.
 */
public record SpeakerProfile(
    Set<String> therapistSpeakers,
    Set<String> excludedSpeakers,
    Map<String, String> partnerMapping) {

  public SpeakerProfile {
    therapistSpeakers = Set.copyOf(therapistSpeakers);
    excludedSpeakers = Set.copyOf(excludedSpeakers);
    partnerMapping = Collections.unmodifiableMap(new LinkedHashMap<>(partnerMapping));

    for (String label : therapistSpeakers) {
      if (excludedSpeakers.contains(label)) {
        throw new IllegalArgumentException(label + " is both a therapist and an excluded speaker");
      }
      if (partnerMapping.containsKey(label)) {
        throw new IllegalArgumentException(label + " is both a therapist and a partner speaker");
      }
    }
    for (String label : excludedSpeakers) {
      if (partnerMapping.containsKey(label)) {
        throw new IllegalArgumentException(label + " is both an excluded and a partner speaker");
      }
    }
  }

  /**
   * Build a profile from the numeric speaker tags used by the diarization engine.
   *
   * @param therapist tags of the therapist
   * @param partners partner name to the tags of that partner
   * @param excluded tags to leave out of the output
   */
  public static SpeakerProfile fromSpeakerTags(
      List<String> therapist, Map<String, List<String>> partners, List<String> excluded) {

    Map<String, String> partnerMapping = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> partner : partners.entrySet()) {
      for (String tag : partner.getValue()) {
        String label = label(tag);
        String previous = partnerMapping.put(label, partner.getKey());
        if (previous != null && !previous.equals(partner.getKey())) {
          throw new IllegalArgumentException(
              label + " is mapped to both " + previous + " and " + partner.getKey());
        }
      }
    }

    return new SpeakerProfile(labels(therapist), labels(excluded), partnerMapping);
  }

  public boolean isTherapist(String speakerLabel) {
    return therapistSpeakers.contains(speakerLabel);
  }

  public boolean isExcluded(String speakerLabel) {
    return excludedSpeakers.contains(speakerLabel);
  }

  private static Set<String> labels(List<String> tags) {
    Set<String> labels = new HashSet<>();
    for (String tag : tags) {
      labels.add(label(tag));
    }
    return labels;
  }

  private static String label(String tag) {
    return TranscriptSpeakerAligner.SPEAKER_PREFIX + tag.strip();
  }
}
