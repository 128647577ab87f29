package io.cronwindow.display;

import io.cronwindow.TimeWindow;
import io.cronwindow.ast.CronPattern;
import io.cronwindow.ast.FieldMatcher;
import io.cronwindow.ast.ScheduleEntry;
import java.time.format.DateTimeFormatter;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Renders patterns, schedules and windows as canonical strings. */
public final class Display {
  private static final DateTimeFormatter MINUTE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

  private Display() {}

  /**
   * Renders schedule entries as schedule text, one entry per line.
   *
   * <p>The output parses back to an equal list of entries.
   *
   * @param entries the entries to render
   * @return the canonical schedule text
   */
  public static String renderSchedule(List<ScheduleEntry> entries) {
    return entries.stream()
        .map(e -> renderPattern(e.pattern()) + " " + e.label())
        .collect(Collectors.joining("\n"));
  }

  /**
   * Renders a pattern as five space-separated fields.
   *
   * @param pattern the pattern to render
   * @return the canonical pattern text
   */
  public static String renderPattern(CronPattern pattern) {
    return String.join(
        " ",
        renderField(pattern.minute()),
        renderField(pattern.hour()),
        renderField(pattern.dayOfMonth()),
        renderField(pattern.month()),
        renderField(pattern.dayOfWeek()));
  }

  /**
   * Renders a field as {@code *} or a list of numeric values and ranges.
   *
   * <p>Consecutive values collapse into ranges: {0, 1, 2, 5} renders as {@code 0-2,5}.
   *
   * @param matcher the matcher to render
   * @return the canonical field text
   */
  public static String renderField(FieldMatcher matcher) {
    if (matcher.isWildcard()) {
      return "*";
    }

    BitSet values = matcher.values();
    StringBuilder sb = new StringBuilder();
    int start = values.nextSetBit(0);
    while (start >= 0) {
      int end = values.nextClearBit(start) - 1;
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(start);
      if (end > start) {
        sb.append('-').append(end);
      }
      start = values.nextSetBit(end + 1);
    }
    return sb.toString();
  }

  /**
   * Renders a window as {@code [start, end] label}.
   *
   * <p>A single-mode window without a label renders as {@code -}, a multi-mode window renders its
   * labels as a parenthesised tuple.
   *
   * @param window the window to render
   * @return the rendered window
   */
  public static String renderWindow(TimeWindow<?> window) {
    return "["
        + MINUTE_FORMAT.format(window.start())
        + ", "
        + MINUTE_FORMAT.format(window.end())
        + "] "
        + renderLabel(window.label());
  }

  private static String renderLabel(Object label) {
    if (label instanceof Optional<?> single) {
      return single.map(String::valueOf).orElse("-");
    }
    if (label instanceof List<?> multi) {
      return multi.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
    return String.valueOf(label);
  }
}
