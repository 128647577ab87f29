package io.cronwindow.eval;

import io.cronwindow.CronWindowException;
import io.cronwindow.ast.ScheduleEntry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Turns the set of entries active in a minute into a window label payload.
 *
 * @param <L> the label payload type
 */
@FunctionalInterface
public interface WindowLabeler<L> {

  /**
   * Derives the label for an active set.
   *
   * @param active the indices of the active entries
   * @param minute the first minute with this active set
   * @return the label payload
   * @throws CronWindowException if the active set cannot be labelled
   */
  L label(BitSet active, LocalDateTime minute) throws CronWindowException;

  /**
   * Labels each window with at most one entry label, failing when several entries overlap.
   *
   * @param entries the schedule entries
   * @return a single-label labeler
   */
  static WindowLabeler<Optional<String>> single(List<ScheduleEntry> entries) {
    return (active, minute) -> {
      int count = active.cardinality();
      if (count == 0) {
        return Optional.empty();
      }
      if (count > 1) {
        throw CronWindowException.ambiguity(minute, labels(entries, active));
      }
      return Optional.of(entries.get(active.nextSetBit(0)).label());
    };
  }

  /**
   * Labels each window with the labels of all active entries, in entry order.
   *
   * @param entries the schedule entries
   * @return a multi-label labeler
   */
  static WindowLabeler<List<String>> multi(List<ScheduleEntry> entries) {
    return (active, minute) -> labels(entries, active);
  }

  /**
   * Returns the labels of the active entries, in entry order.
   *
   * @param entries the schedule entries
   * @param active the indices of the active entries
   * @return an immutable list of labels
   */
  static List<String> labels(List<ScheduleEntry> entries, BitSet active) {
    List<String> labels = new ArrayList<>(active.cardinality());
    for (int i = active.nextSetBit(0); i >= 0; i = active.nextSetBit(i + 1)) {
      labels.add(entries.get(i).label());
    }
    return List.copyOf(labels);
  }
}
