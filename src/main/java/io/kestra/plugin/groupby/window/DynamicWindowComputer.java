package io.kestra.plugin.groupby.window;

import io.kestra.plugin.groupby.GroupByException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes fixed-cadence windows over a sorted index. Window {@code k} starts at
 * {@code first + k * every} and spans {@code period}; windows are generated until a start goes
 * past the largest index value.
 */
public final class DynamicWindowComputer {
    private final CalendarDuration every;
    private final CalendarDuration period;
    private final CalendarDuration offset;
    private final ClosedWindow closed;
    private final StartBy startBy;
    private final boolean includeEmptyWindows;

    public DynamicWindowComputer(CalendarDuration every,
                                 CalendarDuration period,
                                 CalendarDuration offset,
                                 ClosedWindow closed,
                                 StartBy startBy,
                                 boolean includeEmptyWindows) {
        this.every = Objects.requireNonNull(every, "every is required");
        this.period = period == null ? every : period;
        this.offset = offset == null ? CalendarDuration.zero() : offset;
        this.closed = closed == null ? ClosedWindow.LEFT : closed;
        this.startBy = startBy == null ? StartBy.WINDOW : startBy;
        this.includeEmptyWindows = includeEmptyWindows;
    }

    public void validate(IndexColumn index) throws GroupByException {
        if (!every.isPositive()) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "every must be strictly positive, got '" + every + "'");
        }
        if (!period.isPositive()) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "period must be strictly positive, got '" + period + "'");
        }
        index.checkUnits(every, "every");
        index.checkUnits(period, "period");
        index.checkUnits(offset, "offset");
        if (startBy.isWeekday() && !index.isTemporal()) {
            throw new GroupByException(GroupByException.Kind.INVALID_START_BY,
                "start_by '" + startBy.value() + "' requires a DATE or DATETIME index, got " + index.type());
        }
    }

    /**
     * Windows over {@code rows}, a partition of the index column given in row order.
     */
    public List<Window> compute(IndexColumn index, int[] rows) throws GroupByException {
        index.checkSorted(rows);
        List<Window> windows = new ArrayList<>();
        if (rows.length == 0) {
            return windows;
        }
        boolean temporal = index.isTemporal();
        long min = index.value(rows[0]);
        long max = index.value(rows[rows.length - 1]);
        try {
            long first = firstStart(min, temporal);
            int lower = 0;
            int upper = 0;
            for (long k = 0; ; k++) {
                long start = every.addTo(first, k, temporal);
                if (start > max || (start == max && !closed.isStartIncluded())) {
                    break;
                }
                long end = period.addTo(start, temporal);
                while (lower < rows.length && closed.isBefore(index.value(rows[lower]), start)) {
                    lower++;
                }
                upper = Math.max(upper, lower);
                while (upper < rows.length && closed.isWithinEnd(index.value(rows[upper]), end)) {
                    upper++;
                }
                if (upper > lower || includeEmptyWindows) {
                    windows.add(new Window(start, end, Arrays.copyOfRange(rows, lower, upper)));
                }
            }
        } catch (ArithmeticException | DateTimeException e) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "Window bounds overflow the index range of '" + index.name() + "'", e);
        }
        return windows;
    }

    /**
     * Start of the first window. If the anchoring rule leaves the smallest value before the window,
     * the start moves back by whole {@code every} steps until the smallest value is inside it.
     */
    long firstStart(long min, boolean temporal) {
        long start = switch (startBy) {
            case WINDOW -> offset.addTo(every.truncate(min, temporal), temporal);
            case DATAPOINT -> offset.addTo(min, temporal);
            default -> {
                LocalDate day = CalendarDuration.toDateTime(min).toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(startBy.dayOfWeek()));
                yield offset.addTo(CalendarDuration.fromDateTime(day.atStartOfDay()), temporal);
            }
        };
        if (!closed.isBefore(min, start)) {
            return start;
        }
        if (every.hasCalendarPart()) {
            long steps = 1;
            while (closed.isBefore(min, every.addTo(start, -steps, temporal))) {
                steps++;
            }
            return every.addTo(start, -steps, temporal);
        }
        long size = every.addTo(0L, temporal);
        long distance = Math.subtractExact(start, min);
        long steps = closed.isStartIncluded()
            ? Math.floorDiv(Math.addExact(distance, size - 1), size)
            : Math.floorDiv(distance, size) + 1;
        return every.addTo(start, -steps, temporal);
    }
}
