package io.cronwindow.parser;

import io.cronwindow.CronWindowException;
import io.cronwindow.Span;
import io.cronwindow.ast.CronField;
import io.cronwindow.ast.CronPattern;
import io.cronwindow.ast.FieldMatcher;
import io.cronwindow.ast.ScheduleEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses crontab-style schedule text into an ordered list of entries.
 *
 * <p>Each non-blank line holds five cron fields followed by a label, which is the rest of the
 * line. A {@code #} starts a comment that runs to the end of the line.
 */
public final class ScheduleParser {
  private static final Logger log = LoggerFactory.getLogger(ScheduleParser.class);

  /** The line delimiter used when none is given. */
  public static final char DEFAULT_DELIMITER = '\n';

  private static final int FIELD_COUNT = 5;
  private static final CronField[] FIELDS = CronField.values();

  private ScheduleParser() {}

  /**
   * Parses schedule text.
   *
   * @param text the schedule text
   * @param delimiter the character separating lines
   * @return the entries in source line order
   * @throws CronWindowException on the first malformed line
   */
  public static List<ScheduleEntry> parse(String text, char delimiter)
      throws CronWindowException {
    Objects.requireNonNull(text, "text");
    String[] lines = text.split(Pattern.quote(String.valueOf(delimiter)), -1);

    List<ScheduleEntry> entries = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      ScheduleEntry entry = parseLine(lines[i], i + 1);
      if (entry != null) {
        entries.add(entry);
      }
    }

    log.debug("Parsed {} schedule entries from {} lines", entries.size(), lines.length);
    return List.copyOf(entries);
  }

  /**
   * Parses exactly five whitespace-separated cron fields.
   *
   * @param text the pattern text
   * @return the parsed pattern
   * @throws CronWindowException if the field count is wrong or a field is malformed
   */
  public static CronPattern parsePattern(String text) throws CronWindowException {
    Objects.requireNonNull(text, "text");
    List<Span> words = splitWords(text, Integer.MAX_VALUE);
    if (words.size() != FIELD_COUNT) {
      throw CronWindowException.parse(
          "expected " + FIELD_COUNT + " cron fields, got " + words.size(),
          new Span(0, text.length()),
          text,
          0,
          null);
    }
    return parseFields(text, words, 0);
  }

  /** Returns null for blank and comment-only lines. */
  private static ScheduleEntry parseLine(String rawLine, int lineNumber)
      throws CronWindowException {
    String line = stripComment(rawLine);
    if (line.isBlank()) {
      return null;
    }

    String display = rawLine.stripTrailing();
    List<Span> words = splitWords(line, FIELD_COUNT);
    if (words.size() < FIELD_COUNT) {
      throw CronWindowException.parse(
          "expected " + FIELD_COUNT + " cron fields and a label, got " + words.size() + " fields",
          words.get(0).to(words.get(words.size() - 1)),
          display,
          lineNumber,
          null);
    }

    String label = line.substring(words.get(FIELD_COUNT - 1).end()).trim();
    if (label.isEmpty()) {
      int end = words.get(FIELD_COUNT - 1).end();
      throw CronWindowException.parse(
          "missing label after the cron fields", new Span(end, end + 1), display, lineNumber, null);
    }

    int labelStart = line.indexOf(label, words.get(FIELD_COUNT - 1).end());
    int lineBreak = label.indexOf('\n');
    if (lineBreak >= 0) {
      int at = labelStart + lineBreak;
      throw CronWindowException.parse(
          "labels must not contain line breaks", new Span(at, at + 1), display, lineNumber, null);
    }

    CronPattern pattern = parseFields(display, words, lineNumber);
    return new ScheduleEntry(pattern, label);
  }

  private static CronPattern parseFields(String line, List<Span> words, int lineNumber)
      throws CronWindowException {
    FieldMatcher[] matchers = new FieldMatcher[FIELD_COUNT];
    for (int i = 0; i < FIELD_COUNT; i++) {
      Span word = words.get(i);
      matchers[i] = FieldParser.parse(line, word.start(), word.end(), FIELDS[i], lineNumber);
    }
    return new CronPattern(matchers[0], matchers[1], matchers[2], matchers[3], matchers[4]);
  }

  private static String stripComment(String line) {
    int hash = line.indexOf('#');
    return hash < 0 ? line : line.substring(0, hash);
  }

  /** Returns the spans of at most {@code limit} whitespace-separated words. */
  private static List<Span> splitWords(String s, int limit) {
    List<Span> words = new ArrayList<>();
    int pos = 0;
    while (pos < s.length() && words.size() < limit) {
      while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
        pos++;
      }
      if (pos >= s.length()) {
        break;
      }
      int start = pos;
      while (pos < s.length() && !Character.isWhitespace(s.charAt(pos))) {
        pos++;
      }
      words.add(new Span(start, pos));
    }
    return words;
  }
}
