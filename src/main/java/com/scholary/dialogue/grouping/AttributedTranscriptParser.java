package com.scholary.dialogue.grouping;

import com.scholary.dialogue.align.AttributedUtterance;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an attributed transcript ({@code "Speaker N: text"} lines) back into utterances.
 *
 * <p>Used to regroup a recording with a corrected speaker profile without re-running
 * transcription and diarization. An utterance runs until the next speaker marker, so text that
 * wrapped onto following lines stays with its speaker. Empty utterances are dropped.
 */
public final class AttributedTranscriptParser {

  private static final Pattern UTTERANCE =
      Pattern.compile("(Speaker \\S+):\\s*(.*?)(?=Speaker \\S+:|\\z)", Pattern.DOTALL);

  private AttributedTranscriptParser() {}

  public static List<AttributedUtterance> parse(String content) {
    List<AttributedUtterance> utterances = new ArrayList<>();
    Matcher matcher = UTTERANCE.matcher(content);

    while (matcher.find()) {
      String text = matcher.group(2).strip();
      if (!text.isEmpty()) {
        utterances.add(new AttributedUtterance(matcher.group(1), text));
      }
    }
    return utterances;
  }
}
