package io.cronwindow;

import io.cronwindow.ast.ScheduleEntry;
import io.cronwindow.display.Display;
import io.cronwindow.eval.Evaluator;
import io.cronwindow.eval.WindowLabeler;
import io.cronwindow.parser.ScheduleParser;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The main entry point for parsing crontab-style schedules and iterating their windows.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Schedule schedule = Schedule.parse("0-29 13 * * Mon-Fri lunch\n* 14-21 * * Mon-Fri afternoon");
 * schedule.windows(LocalDateTime.of(2015, 1, 1, 0, 0), LocalDateTime.of(2015, 1, 8, 0, 0))
 *     .forEach(System.out::println);
 * }</pre>
 *
 * <p>A schedule is immutable and can be iterated by several streams at once. All timestamps are
 * naive local times; seconds and smaller units are truncated.
 */
public final class Schedule {
  private final List<ScheduleEntry> entries;

  private Schedule(List<ScheduleEntry> entries) {
    this.entries = entries;
  }

  /**
   * Parses newline-separated schedule text.
   *
   * @param text the schedule text
   * @return the parsed schedule
   * @throws CronWindowException if any line is invalid
   */
  public static Schedule parse(String text) throws CronWindowException {
    return parse(text, ScheduleParser.DEFAULT_DELIMITER);
  }

  /**
   * Parses schedule text whose lines are separated by {@code delimiter}.
   *
   * @param text the schedule text
   * @param delimiter the line delimiter
   * @return the parsed schedule
   * @throws CronWindowException if any line is invalid
   */
  public static Schedule parse(String text, char delimiter) throws CronWindowException {
    return new Schedule(ScheduleParser.parse(text, delimiter));
  }

  /**
   * Builds a schedule from already parsed entries.
   *
   * @param entries the entries, in label order
   * @return a new schedule
   */
  public static Schedule of(List<ScheduleEntry> entries) {
    return new Schedule(List.copyOf(entries));
  }

  /**
   * Validates schedule text without throwing.
   *
   * @param text the schedule text
   * @return true if the text parses
   */
  public static boolean validate(String text) {
    try {
      ScheduleParser.parse(text, ScheduleParser.DEFAULT_DELIMITER);
      return true;
    } catch (CronWindowException e) {
      return false;
    }
  }

  /**
   * Returns the entries in source order.
   *
   * @return an immutable list of entries
   */
  public List<ScheduleEntry> entries() {
    return entries;
  }

  /**
   * Returns the number of entries.
   *
   * @return the entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Returns whether the schedule has no entries.
   *
   * @return true for an empty schedule
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns the start of the next whole minute after the current time.
   *
   * @return the next minute boundary
   */
  public LocalDateTime nextMinute() {
    return nextMinute(LocalDateTime.now());
  }

  /**
   * Returns the start of the next whole minute strictly after {@code now}.
   *
   * @param now the reference time
   * @return the next minute boundary
   */
  public LocalDateTime nextMinute(LocalDateTime now) {
    return now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
  }

  /**
   * Finds the next window with an active entry, starting from the next minute.
   *
   * @return the window, or empty if no entry can ever match
   * @throws CronWindowException if the schedule is empty or the window is ambiguous
   */
  public Optional<TimeWindow<String>> nextActive() throws CronWindowException {
    return nextActive(LocalDateTime.now());
  }

  /**
   * Finds the first single-label window with an active entry at or after {@code
   * nextMinute(now)}.
   *
   * <p>The window is found with {@link io.cronwindow.ast.CronPattern#nextMatchAfter} and {@link
   * io.cronwindow.ast.CronPattern#nextMismatchAfter} per entry, so rarely matching patterns and
   * long windows do not require a minute-by-minute walk.
   *
   * <p>The window ends where its label changes. If the next minute has two active entries the
   * window is still returned, ending just before that minute; the ambiguity is reported only
   * when it falls on the window's first minute. A window that is still open 400 years after its
   * start (for example a single {@code * * * * *} entry) is returned ending at that limit.
   *
   * @param now the reference time
   * @return the window, or empty if no entry can ever match
   * @throws CronWindowException if the schedule is empty or the window's first minute is
   *     ambiguous
   */
  public Optional<TimeWindow<String>> nextActive(LocalDateTime now) throws CronWindowException {
    if (entries.isEmpty()) {
      throw CronWindowException.emptySchedule("schedule has no entries");
    }
    return Evaluator.firstActiveWindow(entries, nextMinute(now));
  }

  /**
   * Returns the labels of the entries active in the minute containing {@code dt}.
   *
   * @param dt the timestamp
   * @return the active labels, in entry order
   */
  public List<String> activeLabels(LocalDateTime dt) {
    return WindowLabeler.labels(
        entries, Evaluator.activeAt(entries, dt.truncatedTo(ChronoUnit.MINUTES)));
  }

  /**
   * Returns an unbounded stream of single-label windows starting at the next minute.
   *
   * @return a lazy, infinite stream of windows
   */
  public Stream<TimeWindow<Optional<String>>> windows() {
    return windows(nextMinute(), null);
  }

  /**
   * Returns an unbounded stream of single-label windows.
   *
   * @param start the first minute
   * @return a lazy, infinite stream of windows
   */
  public Stream<TimeWindow<Optional<String>>> windows(LocalDateTime start) {
    return windows(start, null);
  }

  /**
   * Returns a stream of single-label windows covering {@code [start, end]}.
   *
   * <p>Each window carries the label of its only active entry, or is empty when no entry is
   * active. If two or more entries are active in the same minute the stream fails when that
   * minute is reached, with an {@link UncheckedCronWindowException} of kind {@link
   * ErrorKind#AMBIGUITY}.
   *
   * @param start the first minute
   * @param end the last minute (inclusive), or null for an unbounded stream
   * @return a lazy stream of windows
   */
  public Stream<TimeWindow<Optional<String>>> windows(LocalDateTime start, LocalDateTime end) {
    Objects.requireNonNull(start, "start");
    return Evaluator.windows(entries, start, end, WindowLabeler.single(entries));
  }

  /**
   * Returns an unbounded stream of multi-label windows starting at the next minute.
   *
   * @return a lazy, infinite stream of windows
   */
  public Stream<TimeWindow<List<String>>> multiWindows() {
    return multiWindows(nextMinute(), null);
  }

  /**
   * Returns an unbounded stream of multi-label windows.
   *
   * @param start the first minute
   * @return a lazy, infinite stream of windows
   */
  public Stream<TimeWindow<List<String>>> multiWindows(LocalDateTime start) {
    return multiWindows(start, null);
  }

  /**
   * Returns a stream of multi-label windows covering {@code [start, end]}.
   *
   * <p>Each window carries the labels of all active entries in entry order; minutes without an
   * active entry form windows with an empty list.
   *
   * @param start the first minute
   * @param end the last minute (inclusive), or null for an unbounded stream
   * @return a lazy stream of windows
   */
  public Stream<TimeWindow<List<String>>> multiWindows(LocalDateTime start, LocalDateTime end) {
    Objects.requireNonNull(start, "start");
    return Evaluator.windows(entries, start, end, WindowLabeler.multi(entries));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Schedule other && entries.equals(other.entries));
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  /**
   * Returns the canonical schedule text, one entry per line.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.renderSchedule(entries);
  }
}
