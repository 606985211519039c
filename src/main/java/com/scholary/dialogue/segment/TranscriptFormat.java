package com.scholary.dialogue.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes the plain-text transcript cache format.
 *
 * <p>Format, one segment per line:
 *
 * <pre>
 * [00:00.000 --> 00:06.140]  Welcome to the session.
 * [01:02:03.500 --> 01:02:07.000]  Past the first hour the timestamps gain an hours field.
 * </pre>
 *
 * <p>Lines that do not start with a bracketed time range are ignored, which lets the file carry
 * blank lines.
 */
public final class TranscriptFormat {

  private static final String ARROW = " --> ";

  private TranscriptFormat() {}

  /** Render segments as cache lines. */
  public static List<String> format(List<TranscriptSegment> segments) {
    List<String> lines = new ArrayList<>(segments.size());
    for (TranscriptSegment segment : segments) {
      lines.add(formatLine(segment));
    }
    return lines;
  }

  public static String formatLine(TranscriptSegment segment) {
    return "["
        + formatTimestamp(segment.start())
        + ARROW
        + formatTimestamp(segment.end())
        + "]  "
        + segment.text().strip();
  }

  /**
   * Format a time in seconds as a cache timestamp.
   *
   * <p>Format: MM:SS.mmm, or HH:MM:SS.mmm once the hour field is non-zero.
   */
  public static String formatTimestamp(double seconds) {
    // Round once to whole milliseconds so a carry reaches the minute and hour fields
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    if (hours > 0) {
      return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, secs, millis);
    }
    return String.format(Locale.ROOT, "%02d:%02d.%03d", minutes, secs, millis);
  }

  /**
   * Parse cache lines back into segments.
   *
   * @throws TranscriptFormatException if a time-range line carries an unparseable timestamp
   */
  public static List<TranscriptSegment> parse(List<String> lines) {
    List<TranscriptSegment> segments = new ArrayList<>();

    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty() || !line.startsWith("[") || !line.contains("-->")) {
        continue;
      }

      int bracketEnd = line.indexOf(']');
      if (bracketEnd == -1) {
        continue;
      }

      String range = line.substring(1, bracketEnd);
      int arrow = range.indexOf(ARROW);
      if (arrow == -1) {
        continue;
      }

      int lineNumber = i + 1;
      double start = parseTimestamp(range.substring(0, arrow), lineNumber);
      double end = parseTimestamp(range.substring(arrow + ARROW.length()), lineNumber);
      String text = line.substring(bracketEnd + 1).strip();

      segments.add(new TranscriptSegment(start, end, text));
    }

    return segments;
  }

  /** Parse MM:SS.mmm or HH:MM:SS.mmm to seconds. */
  static double parseTimestamp(String timestamp, int lineNumber) {
    String[] parts = timestamp.strip().split(":");
    try {
      if (parts.length == 2) {
        return Integer.parseInt(parts[0]) * 60 + Double.parseDouble(parts[1]);
      }
      if (parts.length == 3) {
        return Integer.parseInt(parts[0]) * 3600
            + Integer.parseInt(parts[1]) * 60
            + Double.parseDouble(parts[2]);
      }
    } catch (NumberFormatException e) {
      throw new TranscriptFormatException(
          String.format("Invalid timestamp '%s' on line %d", timestamp, lineNumber), e);
    }
    throw new TranscriptFormatException(
        String.format("Invalid timestamp '%s' on line %d", timestamp, lineNumber));
  }
}
