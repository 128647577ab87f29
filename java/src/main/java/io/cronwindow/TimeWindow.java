package io.cronwindow;

import io.cronwindow.display.Display;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A contiguous run of minutes sharing one label payload.
 *
 * <p>Both bounds are inclusive and minute aligned. Single-label streams use {@code
 * Optional<String>} as the payload type, multi-label streams use {@code List<String>}.
 *
 * @param start the first minute of the window
 * @param end the last minute of the window (inclusive)
 * @param label the label payload shared by every minute of the window
 * @param <L> the label payload type
 */
public record TimeWindow<L>(LocalDateTime start, LocalDateTime end, L label) {
  /** Validates bounds. */
  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(label, "label");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("window end " + end + " is before start " + start);
    }
  }

  /**
   * Checks whether a timestamp falls inside this window.
   *
   * @param dt the timestamp, truncated to the minute before comparing
   * @return true if the minute of {@code dt} belongs to this window
   */
  public boolean contains(LocalDateTime dt) {
    LocalDateTime minute = dt.truncatedTo(ChronoUnit.MINUTES);
    return !minute.isBefore(start) && !minute.isAfter(end);
  }

  /**
   * Returns the number of minutes covered by this window.
   *
   * @return the minute count, at least one
   */
  public long minutes() {
    return ChronoUnit.MINUTES.between(start, end) + 1;
  }

  @Override
  public String toString() {
    return Display.renderWindow(this);
  }
}
