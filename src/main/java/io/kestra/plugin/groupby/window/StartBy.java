package io.kestra.plugin.groupby.window;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.kestra.plugin.groupby.GroupByException;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Anchoring rule for the first window of a dynamic grouping.
 */
public enum StartBy {
    /** Align on the boundary of the {@code every} unit, then apply the offset. */
    WINDOW(null),
    /** Start at the first index value, then apply the offset. */
    DATAPOINT(null),
    MONDAY(DayOfWeek.MONDAY),
    TUESDAY(DayOfWeek.TUESDAY),
    WEDNESDAY(DayOfWeek.WEDNESDAY),
    THURSDAY(DayOfWeek.THURSDAY),
    FRIDAY(DayOfWeek.FRIDAY),
    SATURDAY(DayOfWeek.SATURDAY),
    SUNDAY(DayOfWeek.SUNDAY);

    private final DayOfWeek dayOfWeek;

    StartBy(DayOfWeek dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }

    public DayOfWeek dayOfWeek() {
        return dayOfWeek;
    }

    public boolean isWeekday() {
        return dayOfWeek != null;
    }

    public static StartBy parse(String value) throws GroupByException {
        if (value == null || value.isBlank()) {
            throw new GroupByException(GroupByException.Kind.INVALID_START_BY, "start_by is empty");
        }
        try {
            return StartBy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GroupByException(GroupByException.Kind.INVALID_START_BY,
                "Unknown start_by '" + value + "', expected window, datapoint or a weekday", e);
        }
    }

    @JsonCreator
    public static StartBy from(String value) {
        try {
            return parse(value);
        } catch (GroupByException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
