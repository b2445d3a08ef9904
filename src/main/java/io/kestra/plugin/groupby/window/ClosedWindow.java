package io.kestra.plugin.groupby.window;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which boundaries of a window are inclusive.
 */
public enum ClosedWindow {
    /** {@code [start, end)} */
    LEFT(true, false),
    /** {@code (start, end]} */
    RIGHT(false, true),
    /** {@code [start, end]} */
    BOTH(true, true),
    /** {@code (start, end)} */
    NONE(false, false);

    private final boolean startIncluded;
    private final boolean endIncluded;

    ClosedWindow(boolean startIncluded, boolean endIncluded) {
        this.startIncluded = startIncluded;
        this.endIncluded = endIncluded;
    }

    public boolean isStartIncluded() {
        return startIncluded;
    }

    /**
     * Whether {@code value} lies before the window starting at {@code start}.
     */
    boolean isBefore(long value, long start) {
        return startIncluded ? value < start : value <= start;
    }

    /**
     * Whether {@code value} does not go past the window ending at {@code end}.
     */
    boolean isWithinEnd(long value, long end) {
        return endIncluded ? value <= end : value < end;
    }

    @JsonCreator
    public static ClosedWindow from(String value) {
        return ClosedWindow.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
