package io.cronwindow.ast;

import io.cronwindow.CronWindowException;
import io.cronwindow.display.Display;
import io.cronwindow.parser.ScheduleParser;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * A five-field crontab pattern: minute, hour, day-of-month, month and weekday.
 *
 * <p>A minute matches when every field matches. Day-of-month and weekday are combined with AND,
 * like the other fields.
 *
 * @param minute the minute field (0-59)
 * @param hour the hour field (0-23)
 * @param dayOfMonth the day-of-month field (1-31)
 * @param month the month field (1-12)
 * @param dayOfWeek the weekday field (0-6, Sunday=0)
 */
public record CronPattern(
    FieldMatcher minute,
    FieldMatcher hour,
    FieldMatcher dayOfMonth,
    FieldMatcher month,
    FieldMatcher dayOfWeek) {

  /**
   * Upper bound for {@link #nextMatchAfter}. The Gregorian calendar repeats every 400 years, so a
   * pattern without a match in that horizon never matches.
   */
  private static final int SEARCH_YEARS = 400;

  /** Last minute a search may reach; jumps from it still fit in a {@link LocalDateTime}. */
  private static final LocalDateTime SEARCH_CEILING =
      LocalDateTime.MAX.minusYears(1).truncatedTo(ChronoUnit.MINUTES);

  /** Validates that each matcher sits in its own field. */
  public CronPattern {
    requireField(minute, CronField.MINUTE);
    requireField(hour, CronField.HOUR);
    requireField(dayOfMonth, CronField.DAY_OF_MONTH);
    requireField(month, CronField.MONTH);
    requireField(dayOfWeek, CronField.DAY_OF_WEEK);
  }

  /**
   * Parses five whitespace-separated cron fields.
   *
   * @param text the pattern text, e.g. {@code "0-29 13 * * Mon-Fri"}
   * @return the parsed pattern
   * @throws CronWindowException if the text is not exactly five valid fields
   */
  public static CronPattern parse(String text) throws CronWindowException {
    return ScheduleParser.parsePattern(text);
  }

  /**
   * Checks whether the minute containing {@code dt} matches this pattern.
   *
   * @param dt the timestamp; seconds and smaller units are ignored
   * @return true if every field matches
   */
  public boolean matches(LocalDateTime dt) {
    return month.matches(dt.getMonthValue())
        && dayOfMonth.matches(dt.getDayOfMonth())
        && dayOfWeek.matches(Weekday.toCronDOW(dt.getDayOfWeek()))
        && hour.matches(dt.getHour())
        && minute.matches(dt.getMinute());
  }

  /**
   * Finds the earliest matching minute at or after {@code after}.
   *
   * <p>If {@code after} is minute aligned it is itself a candidate; otherwise the search starts at
   * the next whole minute. Non-matching months, days and hours are skipped whole, so rare patterns
   * (once a year, or Feb 29 on a given weekday) are found without walking every minute.
   *
   * @param after the reference time
   * @return the next matching minute, or empty if the pattern can never match
   */
  public Optional<LocalDateTime> nextMatchAfter(LocalDateTime after) {
    if (after.isAfter(SEARCH_CEILING)) {
      return Optional.empty();
    }
    LocalDateTime t = ceilToMinute(after);
    LocalDateTime limit = searchLimit(t);

    while (!t.isAfter(limit)) {
      int m = t.getMonthValue();
      if (!month.matches(m)) {
        int nextMonth = month.nextFrom(m + 1);
        t =
            nextMonth < 0
                ? LocalDate.of(t.getYear() + 1, month.first(), 1).atStartOfDay()
                : LocalDate.of(t.getYear(), nextMonth, 1).atStartOfDay();
        continue;
      }

      if (!dayOfMonth.matches(t.getDayOfMonth())
          || !dayOfWeek.matches(Weekday.toCronDOW(t.getDayOfWeek()))) {
        t = t.toLocalDate().plusDays(1).atStartOfDay();
        continue;
      }

      int h = t.getHour();
      if (!hour.matches(h)) {
        int nextHour = hour.nextFrom(h + 1);
        t =
            nextHour < 0
                ? t.toLocalDate().plusDays(1).atStartOfDay()
                : t.withHour(nextHour).withMinute(0);
        continue;
      }

      int mi = t.getMinute();
      if (!minute.matches(mi)) {
        int nextMinute = minute.nextFrom(mi + 1);
        t = nextMinute < 0 ? t.withMinute(0).plusHours(1) : t.withMinute(nextMinute);
        continue;
      }

      return Optional.of(t);
    }

    return Optional.empty();
  }

  /**
   * Finds the earliest minute at or after {@code after} that does not match this pattern.
   *
   * <p>Uses the same alignment rule and horizon as {@link #nextMatchAfter}. Runs of matching
   * minutes and hours are skipped by field, so only whole matching days are stepped through.
   *
   * @param after the reference time
   * @return the next non-matching minute, or empty if the pattern matches every minute of the
   *     horizon
   */
  public Optional<LocalDateTime> nextMismatchAfter(LocalDateTime after) {
    if (after.isAfter(SEARCH_CEILING)) {
      return Optional.empty();
    }
    LocalDateTime t = ceilToMinute(after);
    LocalDateTime limit = searchLimit(t);

    while (!t.isAfter(limit)) {
      if (!matches(t)) {
        return Optional.of(t);
      }

      int missedMinute = minute.nextMissFrom(t.getMinute());
      if (missedMinute >= 0) {
        return Optional.of(t.withMinute(missedMinute));
      }
      if (!minute.isFull()) {
        t = t.withMinute(0).plusHours(1);
        continue;
      }

      int missedHour = hour.nextMissFrom(t.getHour());
      if (missedHour >= 0) {
        return Optional.of(t.withHour(missedHour).withMinute(0));
      }
      t = t.toLocalDate().plusDays(1).atStartOfDay();
    }

    return Optional.empty();
  }

  /**
   * Returns the last minute a lookup starting at {@code from} examines: 400 years later, or the
   * end of the supported range, whichever comes first.
   *
   * @param from the first minute of the lookup
   * @return the inclusive search limit
   */
  public static LocalDateTime searchLimit(LocalDateTime from) {
    if (from.getYear() >= SEARCH_CEILING.getYear() - SEARCH_YEARS) {
      return SEARCH_CEILING;
    }
    LocalDateTime limit = from.plusYears(SEARCH_YEARS);
    return limit.isAfter(SEARCH_CEILING) ? SEARCH_CEILING : limit;
  }

  @Override
  public String toString() {
    return Display.renderPattern(this);
  }

  private static LocalDateTime ceilToMinute(LocalDateTime dt) {
    LocalDateTime truncated = dt.truncatedTo(ChronoUnit.MINUTES);
    return truncated.equals(dt) ? dt : truncated.plusMinutes(1);
  }

  private static void requireField(FieldMatcher matcher, CronField expected) {
    Objects.requireNonNull(matcher, expected.toString());
    if (matcher.field() != expected) {
      throw new IllegalArgumentException(
          "expected a " + expected + " matcher, got " + matcher.field());
    }
  }
}
