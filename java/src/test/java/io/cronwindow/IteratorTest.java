package io.cronwindow;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stream-specific tests for {@code windows()} and {@code multiWindows()}.
 *
 * These tests verify Java-specific Stream behavior beyond conformance tests:
 * - Laziness (streams don't evaluate eagerly)
 * - Early termination on unbounded streams
 * - Independent streams over one schedule
 * - Integration with Stream methods (filter, takeWhile, collect)
 */
class IteratorTest {

    private static final LocalDateTime JAN_1 = LocalDateTime.of(2015, 1, 1, 0, 0);

    // =========================================================================
    // Laziness Tests
    // =========================================================================

    @Test
    void windowsIsLazy() throws CronWindowException {
        // Overlapping entries would fail in single mode, but only once a window is pulled
        Schedule schedule = Schedule.parse(ScheduleTest.MULTI_SCHEDULE);
        Stream<TimeWindow<Optional<String>>> stream = schedule.windows(LocalDateTime.of(2015, 1, 1, 8, 0));
        assertNotNull(stream);

        assertThrows(UncheckedCronWindowException.class, () -> stream.findFirst());
    }

    @Test
    void ambiguityIsNotRaisedBeforeTheOffendingMinute() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.MULTI_SCHEDULE);

        // Bounded before 07:00 the schedule is never ambiguous
        List<TimeWindow<Optional<String>>> windows = schedule
                .windows(JAN_1, LocalDateTime.of(2015, 1, 1, 6, 59))
                .collect(Collectors.toList());
        assertEquals(1, windows.size());
        assertEquals(Optional.of("A"), windows.get(0).label());

        // Including 07:00 yields the A window, then fails
        Iterator<TimeWindow<Optional<String>>> it = schedule
                .windows(JAN_1, LocalDateTime.of(2015, 1, 1, 7, 0))
                .iterator();
        assertEquals(LocalDateTime.of(2015, 1, 1, 6, 59), it.next().end());
        UncheckedCronWindowException e = assertThrows(UncheckedCronWindowException.class, it::next);
        assertEquals(ErrorKind.AMBIGUITY, e.getCause().kind());
        assertFalse(it.hasNext());
    }

    @Test
    void nextActiveOnEmptyScheduleDoesNotIterate() throws CronWindowException {
        Schedule schedule = Schedule.parse("");
        CronWindowException e = assertThrows(CronWindowException.class, () -> schedule.nextActive(JAN_1));
        assertEquals(ErrorKind.EMPTY_SCHEDULE, e.kind());
    }

    // =========================================================================
    // Early Termination Tests
    // =========================================================================

    @Test
    void unboundedWindowsWithLimit() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);

        List<TimeWindow<Optional<String>>> results = schedule.windows(JAN_1)
                .limit(100)
                .collect(Collectors.toList());

        assertEquals(100, results.size());
    }

    @Test
    void unboundedWindowsWithTakeWhile() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);
        LocalDateTime cutoff = LocalDateTime.of(2015, 1, 3, 0, 0);

        List<TimeWindow<Optional<String>>> results = schedule.windows(JAN_1)
                .takeWhile(w -> w.start().isBefore(cutoff))
                .collect(Collectors.toList());

        // Thursday and Friday alternate 300 / 90 / 300 / 90 / 300
        assertEquals(5, results.size());
    }

    @Test
    void defaultStartIsNextMinute() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);
        LocalDateTime before = LocalDateTime.now();

        TimeWindow<Optional<String>> first = schedule.windows().findFirst().orElseThrow();
        TimeWindow<List<String>> firstMulti = schedule.multiWindows().findFirst().orElseThrow();

        assertTrue(first.start().isAfter(before));
        assertEquals(0, first.start().getSecond());
        assertTrue(firstMulti.start().isAfter(before));
    }

    @Test
    void abandonedStreamDoesNotAffectOthers() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);

        Iterator<TimeWindow<Optional<String>>> first = schedule.windows(JAN_1).iterator();
        first.next();
        first.next();

        List<TimeWindow<Optional<String>>> fresh = schedule.windows(JAN_1)
                .limit(2)
                .collect(Collectors.toList());
        assertEquals(JAN_1, fresh.get(0).start());
        assertEquals(LocalDateTime.of(2015, 1, 1, 22, 0), first.next().start());
    }

    // =========================================================================
    // Stream Methods Tests
    // =========================================================================

    @Test
    void findFirstIdleWindow() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);

        Optional<TimeWindow<Optional<String>>> idle = schedule.windows(JAN_1)
                .filter(w -> w.label().isEmpty())
                .findFirst();

        assertTrue(idle.isPresent());
        assertEquals(LocalDateTime.of(2015, 1, 3, 0, 0), idle.get().start());
        assertEquals(24 * 60, idle.get().minutes());
    }

    @Test
    void multiWindowsPreserveEntryOrder() throws CronWindowException {
        // Labels sort differently from entry order
        Schedule schedule = Schedule.parse("* 0-11 * * * zulu\n* 6-17 * * * alpha");

        List<List<String>> labels = schedule.multiWindows(JAN_1, LocalDateTime.of(2015, 1, 1, 23, 59))
                .map(TimeWindow::label)
                .collect(Collectors.toList());

        assertEquals(List.of(List.of("zulu"), List.of("zulu", "alpha"), List.of("alpha"), List.of()), labels);
    }

    @Test
    void sameLabelOnAdjacentEntriesMerges() throws CronWindowException {
        Schedule schedule = Schedule.parse("* 0-11 * * * on\n* 12-23 * * * on");

        List<TimeWindow<List<String>>> windows = schedule
                .multiWindows(JAN_1, LocalDateTime.of(2015, 1, 3, 23, 59))
                .collect(Collectors.toList());

        assertEquals(1, windows.size());
        assertEquals(List.of("on"), windows.get(0).label());
        assertEquals(3 * 24 * 60, windows.get(0).minutes());
    }

    @Test
    void windowContains() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.SCHEDULE);
        TimeWindow<Optional<String>> first = schedule.windows(JAN_1).findFirst().orElseThrow();

        assertTrue(first.contains(LocalDateTime.of(2015, 1, 1, 13, 29, 59)));
        assertFalse(first.contains(LocalDateTime.of(2015, 1, 1, 13, 30)));
        assertEquals("[2015-01-01T00:00, 2015-01-01T13:29] 300", first.toString());
    }

    @Test
    void multiWindowToString() throws CronWindowException {
        Schedule schedule = Schedule.parse(ScheduleTest.MULTI_SCHEDULE);
        List<String> rendered = schedule.multiWindows(JAN_1)
                .limit(2)
                .map(TimeWindow::toString)
                .collect(Collectors.toList());

        assertEquals(
                List.of("[2015-01-01T00:00, 2015-01-01T06:59] (A)", "[2015-01-01T07:00, 2015-01-01T11:59] (A, B)"),
                rendered);
    }

    @Test
    void windowsStopAtLastRepresentableMinute() throws CronWindowException {
        Schedule schedule = Schedule.parse("* * * * * x");
        LocalDateTime lastMinute = LocalDateTime.of(999_999_999, 12, 31, 23, 59);

        List<TimeWindow<List<String>>> bounded = schedule
                .multiWindows(lastMinute.minusMinutes(3), LocalDateTime.MAX)
                .collect(Collectors.toList());
        assertEquals(List.of(new TimeWindow<>(lastMinute.minusMinutes(3), lastMinute, List.of("x"))), bounded);

        List<TimeWindow<Optional<String>>> unbounded = schedule
                .windows(lastMinute.minusMinutes(1))
                .collect(Collectors.toList());
        assertEquals(1, unbounded.size());
        assertEquals(lastMinute, unbounded.get(0).end());
    }
}
