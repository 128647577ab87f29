package io.cronwindow.ast;

import java.util.Objects;

/**
 * One schedule line: a pattern and the opaque label it contributes while active.
 *
 * @param pattern the cron pattern
 * @param label the label, non-empty, without {@code #} or line breaks
 */
public record ScheduleEntry(CronPattern pattern, String label) {
  /** Validates the entry. */
  public ScheduleEntry {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(label, "label");
    if (label.isBlank()) {
      throw new IllegalArgumentException("label must not be blank");
    }
    if (label.indexOf('#') >= 0) {
      throw new IllegalArgumentException("label must not contain '#': " + label);
    }
    if (label.indexOf('\n') >= 0) {
      throw new IllegalArgumentException("label must not contain a line break: " + label);
    }
  }

  @Override
  public String toString() {
    return pattern + " " + label;
  }
}
