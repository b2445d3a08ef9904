package io.kestra.plugin.groupby.window;

import io.kestra.plugin.groupby.GroupByException;

import java.time.DateTimeException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Computes one window per row of a sorted index: the rows whose index value falls in
 * {@code [t + offset, t + offset + period]}, with boundaries included according to
 * {@link ClosedWindow}.
 *
 * <p>Window starts and ends never decrease as the anchor advances, so both edges are tracked
 * with forward-only pointers and a partition of {@code n} rows costs {@code O(n)} pointer moves
 * plus the output.</p>
 */
public final class RollingWindowComputer {
    private final CalendarDuration period;
    private final CalendarDuration offset;
    private final ClosedWindow closed;

    public RollingWindowComputer(CalendarDuration period, CalendarDuration offset, ClosedWindow closed) {
        this.period = Objects.requireNonNull(period, "period is required");
        this.offset = Objects.requireNonNull(offset, "offset is required");
        this.closed = Objects.requireNonNull(closed, "closed is required");
    }

    /**
     * Validates the window parameters against the index column.
     */
    public void validate(IndexColumn index) throws GroupByException {
        if (!period.isPositive()) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "period must be strictly positive, got '" + period + "'");
        }
        index.checkUnits(period, "period");
        index.checkUnits(offset, "offset");
    }

    /**
     * Windows anchored at each of {@code rows}, a partition of the index column given in row order.
     */
    public Window[] compute(IndexColumn index, int[] rows) throws GroupByException {
        index.checkSorted(rows);
        boolean temporal = index.isTemporal();
        Window[] windows = new Window[rows.length];
        int lower = 0;
        int upper = 0;
        try {
            for (int anchor = 0; anchor < rows.length; anchor++) {
                long start = offset.addTo(index.value(rows[anchor]), temporal);
                long end = period.addTo(start, temporal);
                while (lower < rows.length && closed.isBefore(index.value(rows[lower]), start)) {
                    lower++;
                }
                upper = Math.max(upper, lower);
                while (upper < rows.length && closed.isWithinEnd(index.value(rows[upper]), end)) {
                    upper++;
                }
                windows[anchor] = new Window(start, end, Arrays.copyOfRange(rows, lower, upper));
            }
        } catch (ArithmeticException | DateTimeException e) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "Window bounds overflow the index range of '" + index.name() + "'", e);
        }
        return windows;
    }
}
