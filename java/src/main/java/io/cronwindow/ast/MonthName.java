package io.cronwindow.ast;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Three-letter month abbreviations accepted in the month field. */
public enum MonthName {
  JANUARY(1, "jan"),
  FEBRUARY(2, "feb"),
  MARCH(3, "mar"),
  APRIL(4, "apr"),
  MAY(5, "may"),
  JUNE(6, "jun"),
  JULY(7, "jul"),
  AUGUST(8, "aug"),
  SEPTEMBER(9, "sep"),
  OCTOBER(10, "oct"),
  NOVEMBER(11, "nov"),
  DECEMBER(12, "dec");

  private final int monthNumber;
  private final String abbreviation;

  MonthName(int monthNumber, String abbreviation) {
    this.monthNumber = monthNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  private static final Map<String, MonthName> PARSE_MAP =
      Map.ofEntries(
          Map.entry("jan", JANUARY),
          Map.entry("feb", FEBRUARY),
          Map.entry("mar", MARCH),
          Map.entry("apr", APRIL),
          Map.entry("may", MAY),
          Map.entry("jun", JUNE),
          Map.entry("jul", JULY),
          Map.entry("aug", AUGUST),
          Map.entry("sep", SEPTEMBER),
          Map.entry("oct", OCTOBER),
          Map.entry("nov", NOVEMBER),
          Map.entry("dec", DECEMBER));

  /**
   * Parses a three-letter month abbreviation (case insensitive).
   *
   * @param s the string to parse
   * @return the month if valid
   */
  public static Optional<MonthName> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }
}
