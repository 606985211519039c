package com.scholary.dialogue.grouping;

import com.scholary.dialogue.align.AttributedUtterance;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collapses attributed utterances into therapist and client turns.
 *
 * <p>Walks the utterances once with a single open group. Excluded and unmapped speakers are
 * dropped without closing the open group, so a therapist turn interrupted only by noise stays one
 * turn. A change of role closes the open group and starts a new one.
 */
@Component
public class UtteranceGrouper {

  private static final Logger LOGGER = LoggerFactory.getLogger(UtteranceGrouper.class);

  /**
   * Group utterances by role.
   *
   * @param utterances attributed utterances in transcript order
   * @param profile speaker roles for this recording
   * @param prefixPolicy when client lines get a partner prefix
   * @return the turns in order, with counts of dropped utterances
   */
  public GroupingResult group(
      List<AttributedUtterance> utterances,
      SpeakerProfile profile,
      PartnerPrefixPolicy prefixPolicy) {

    List<TurnGroup> turns = new ArrayList<>();
    Map<String, Integer> unmapped = new LinkedHashMap<>();
    int excluded = 0;
    OpenGroup open = null;

    for (AttributedUtterance utterance : utterances) {
      String speaker = utterance.speakerLabel();

      if (profile.isExcluded(speaker)) {
        excluded++;
        continue;
      }

      Role role;
      String partnerName = null;
      if (profile.isTherapist(speaker)) {
        role = Role.THERAPIST;
      } else if (profile.partnerMapping().containsKey(speaker)) {
        role = Role.CLIENT;
        partnerName = profile.partnerMapping().get(speaker);
      } else {
        unmapped.merge(speaker, 1, Integer::sum);
        continue;
      }

      if (open == null || open.role != role) {
        if (open != null && !open.lines.isEmpty()) {
          turns.add(open.close());
        }
        open = new OpenGroup(role);
      }

      if (role == Role.THERAPIST) {
        open.lines.add(utterance.text());
      } else {
        open.addClientLine(partnerName, utterance.text(), prefixPolicy);
      }
    }

    if (open != null && !open.lines.isEmpty()) {
      turns.add(open.close());
    }

    LOGGER.debug(
        "Grouped {} utterances into {} turns ({} excluded, {} unmapped)",
        utterances.size(),
        turns.size(),
        excluded,
        unmapped.size());
    return new GroupingResult(turns, excluded, unmapped);
  }

  private static final class OpenGroup {

    private final Role role;
    private final List<String> lines = new ArrayList<>();
    private String lastPartner;

    private OpenGroup(Role role) {
      this.role = role;
    }

    private void addClientLine(String partnerName, String text, PartnerPrefixPolicy policy) {
      boolean prefix =
          policy == PartnerPrefixPolicy.ALWAYS_PREFIX || !partnerName.equals(lastPartner);
      lines.add(prefix ? "[" + partnerName + "]: " + text : text);
      lastPartner = partnerName;
    }

    private TurnGroup close() {
      return new TurnGroup(role, lines);
    }
  }
}
