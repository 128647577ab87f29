package io.cronwindow.ast;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Three-letter weekday abbreviations accepted in the weekday field. */
public enum Weekday {
  SUNDAY(0, "sun"),
  MONDAY(1, "mon"),
  TUESDAY(2, "tue"),
  WEDNESDAY(3, "wed"),
  THURSDAY(4, "thu"),
  FRIDAY(5, "fri"),
  SATURDAY(6, "sat");

  private final int cronNumber;
  private final String abbreviation;

  Weekday(int cronNumber, String abbreviation) {
    this.cronNumber = cronNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the cron day of week number (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the cron day of week number
   */
  public int cronDOW() {
    return cronNumber;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("sun", SUNDAY),
          Map.entry("mon", MONDAY),
          Map.entry("tue", TUESDAY),
          Map.entry("wed", WEDNESDAY),
          Map.entry("thu", THURSDAY),
          Map.entry("fri", FRIDAY),
          Map.entry("sat", SATURDAY));

  /**
   * Parses a three-letter weekday abbreviation (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns the cron day of week number for a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return 0 for Sunday through 6 for Saturday
   */
  public static int toCronDOW(DayOfWeek dow) {
    return dow.getValue() % 7;
  }
}
