package io.cronwindow.eval;

import io.cronwindow.CronWindowException;
import io.cronwindow.TimeWindow;
import io.cronwindow.UncheckedCronWindowException;
import io.cronwindow.ast.CronPattern;
import io.cronwindow.ast.ScheduleEntry;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks time forward minute by minute and coalesces the active entries into windows.
 *
 * <h2>Window boundaries</h2>
 *
 * <p>For every minute the patterns are evaluated in entry order into a {@link BitSet} of active
 * indices. A window stays open while the active set is unchanged. When the set changes, the new
 * set is labelled; if the label payload equals the open window's payload the window is extended,
 * so two entries carrying the same label text hand over without a boundary. Otherwise the open
 * window is emitted and a new one starts at the current minute.
 *
 * <h2>Lazy failures</h2>
 *
 * <p>A labeler may reject an active set (single-label mode with overlapping entries). The window
 * closed by the offending minute is still emitted; the error is raised on the following pull,
 * wrapped in {@link UncheckedCronWindowException}. Nothing is evaluated before the consumer pulls.
 *
 * <h2>Range</h2>
 *
 * <p>Streams stop at the last minute a {@link LocalDateTime} can hold, so an unbounded stream or
 * one ending at {@link LocalDateTime#MAX} ends there instead of overflowing.
 */
public final class Evaluator {
  private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

  private static final LocalDateTime LAST_MINUTE =
      LocalDateTime.MAX.truncatedTo(ChronoUnit.MINUTES);

  private Evaluator() {}

  /**
   * Computes the indices of the entries whose pattern matches a minute.
   *
   * @param entries the schedule entries
   * @param minute the minute to evaluate
   * @return the active indices, in entry order
   */
  public static BitSet activeAt(List<ScheduleEntry> entries, LocalDateTime minute) {
    BitSet active = new BitSet(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).pattern().matches(minute)) {
        active.set(i);
      }
    }
    return active;
  }

  /**
   * Returns a lazy stream of windows covering {@code [start, end]}.
   *
   * @param entries the schedule entries
   * @param start the first minute (truncated to the minute)
   * @param end the last minute, inclusive (truncated to the minute), or null for no end
   * @param labeler derives the label payload of each window
   * @param <L> the label payload type
   * @return a stream of windows; infinite when {@code end} is null
   */
  public static <L> Stream<TimeWindow<L>> windows(
      List<ScheduleEntry> entries,
      LocalDateTime start,
      LocalDateTime end,
      WindowLabeler<L> labeler) {
    LocalDateTime first = start.truncatedTo(ChronoUnit.MINUTES);
    LocalDateTime last = end == null ? null : end.truncatedTo(ChronoUnit.MINUTES);
    Iterator<TimeWindow<L>> iterator = new WindowIterator<>(entries, first, last, labeler);

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Finds the earliest minute at or after {@code from} at which any entry matches.
   *
   * @param entries the schedule entries
   * @param from the reference time
   * @return the earliest match over all entries, or empty if no entry can ever match
   */
  public static Optional<LocalDateTime> firstActive(
      List<ScheduleEntry> entries, LocalDateTime from) {
    LocalDateTime best = null;
    for (ScheduleEntry entry : entries) {
      Optional<LocalDateTime> next = entry.pattern().nextMatchAfter(from);
      if (next.isPresent() && (best == null || next.get().isBefore(best))) {
        best = next.get();
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Finds the first single-label window with an active entry, starting at or after {@code from}.
   *
   * <p>Instead of walking minutes, the search jumps between the points where some entry starts or
   * stops matching; between two such points the active set cannot change. A window ending right
   * before an ambiguous minute is returned as is. A window still open at the search limit (see
   * {@link CronPattern#searchLimit}) is returned ending at that limit.
   *
   * @param entries the schedule entries
   * @param from the reference time
   * @return the window, or empty if no entry can ever match
   * @throws CronWindowException if more than one entry is active at the window's first minute
   */
  public static Optional<TimeWindow<String>> firstActiveWindow(
      List<ScheduleEntry> entries, LocalDateTime from) throws CronWindowException {
    Optional<LocalDateTime> first = firstActive(entries, from);
    if (first.isEmpty()) {
      return Optional.empty();
    }

    LocalDateTime start = first.get();
    LocalDateTime limit = CronPattern.searchLimit(start);
    WindowLabeler<Optional<String>> labeler = WindowLabeler.single(entries);
    BitSet active = activeAt(entries, start);
    Optional<String> label = labeler.label(active, start);

    LocalDateTime t = start;
    while (t.isBefore(limit)) {
      Optional<LocalDateTime> change = nextChange(entries, active, t.plusMinutes(1), limit);
      if (change.isEmpty()) {
        break;
      }
      t = change.get();
      active = activeAt(entries, t);
      Optional<String> next;
      try {
        next = labeler.label(active, t);
      } catch (CronWindowException e) {
        log.debug("Window labelling failed at {}: {}", t, e.getMessage());
        next = Optional.empty();
      }
      if (!next.equals(label)) {
        return Optional.of(new TimeWindow<>(start, t.minusMinutes(1), label.orElseThrow()));
      }
    }

    log.debug("Window starting at {} is still open at {}", start, limit);
    return Optional.of(new TimeWindow<>(start, limit, label.orElseThrow()));
  }

  /** Earliest minute in {@code [from, limit]} at which some entry flips its active state. */
  private static Optional<LocalDateTime> nextChange(
      List<ScheduleEntry> entries, BitSet active, LocalDateTime from, LocalDateTime limit) {
    LocalDateTime best = null;
    for (int i = 0; i < entries.size(); i++) {
      CronPattern pattern = entries.get(i).pattern();
      Optional<LocalDateTime> flip =
          active.get(i) ? pattern.nextMismatchAfter(from) : pattern.nextMatchAfter(from);
      if (flip.isPresent()
          && !flip.get().isAfter(limit)
          && (best == null || flip.get().isBefore(best))) {
        best = flip.get();
      }
    }
    return Optional.ofNullable(best);
  }

  private static final class WindowIterator<L> implements Iterator<TimeWindow<L>> {
    private final List<ScheduleEntry> entries;
    private final LocalDateTime end;
    private final WindowLabeler<L> labeler;

    private LocalDateTime cursor;

    private BitSet openSet;
    private LocalDateTime openStart;
    private LocalDateTime openEnd;
    private L openLabel;

    private TimeWindow<L> next;
    private CronWindowException pending;
    private boolean finished;
    private boolean exhausted;

    WindowIterator(
        List<ScheduleEntry> entries,
        LocalDateTime start,
        LocalDateTime end,
        WindowLabeler<L> labeler) {
      this.entries = entries;
      this.end = end;
      this.labeler = labeler;
      this.cursor = start;
    }

    private void computeNext() {
      if (next != null || finished) {
        return;
      }
      if (pending != null) {
        CronWindowException e = pending;
        pending = null;
        finished = true;
        throw new UncheckedCronWindowException(e);
      }

      while (true) {
        if (exhausted || (end != null && cursor.isAfter(end))) {
          finished = true;
          if (openStart != null) {
            next = new TimeWindow<>(openStart, openEnd, openLabel);
            openStart = null;
          }
          return;
        }

        BitSet active = activeAt(entries, cursor);
        if (openSet != null && active.equals(openSet)) {
          openEnd = cursor;
          advance();
          continue;
        }

        L label;
        try {
          label = labeler.label(active, cursor);
        } catch (CronWindowException e) {
          log.debug("Window labelling failed at {}: {}", cursor, e.getMessage());
          if (openStart == null) {
            finished = true;
            throw new UncheckedCronWindowException(e);
          }
          next = new TimeWindow<>(openStart, openEnd, openLabel);
          openStart = null;
          pending = e;
          return;
        }

        openSet = active;
        if (openStart != null && label.equals(openLabel)) {
          openEnd = cursor;
          advance();
          continue;
        }

        TimeWindow<L> closed =
            openStart == null ? null : new TimeWindow<>(openStart, openEnd, openLabel);
        openStart = cursor;
        openEnd = cursor;
        openLabel = label;
        advance();
        if (closed != null) {
          next = closed;
          return;
        }
      }
    }

    private void advance() {
      if (cursor.equals(LAST_MINUTE)) {
        exhausted = true;
      } else {
        cursor = cursor.plusMinutes(1);
      }
    }

    @Override
    public boolean hasNext() {
      computeNext();
      return next != null;
    }

    @Override
    public TimeWindow<L> next() {
      computeNext();
      if (next == null) {
        throw new NoSuchElementException();
      }
      TimeWindow<L> result = next;
      next = null;
      return result;
    }
  }
}
