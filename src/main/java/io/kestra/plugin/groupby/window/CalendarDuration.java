package io.kestra.plugin.groupby.window;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.kestra.plugin.groupby.GroupByException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Signed duration mixing calendar months, fixed weeks/days/nanoseconds and integer index steps.
 *
 * <p>Text form: an optional leading {@code -} followed by one or more {@code <integer><unit>}
 * terms, for example {@code 3d}, {@code 1mo}, {@code 1d12h} or {@code -2h}. Units are
 * {@code ns, us, ms, s, m, h, d, w, mo, q, y} and {@code i} (index steps, for integer index
 * columns only; it cannot be combined with the other units).</p>
 *
 * <p>Temporal values are handled as nanoseconds since 1970-01-01T00:00 on a naive clock, so
 * days and weeks are always 24h and 168h long. Months go through calendar arithmetic, clamping
 * the day of month.</p>
 */
public final class CalendarDuration {
    public static final long NANOS_PER_MICRO = 1_000L;
    public static final long NANOS_PER_MILLI = 1_000_000L;
    public static final long NANOS_PER_SECOND = 1_000_000_000L;
    public static final long NANOS_PER_MINUTE = 60L * NANOS_PER_SECOND;
    public static final long NANOS_PER_HOUR = 60L * NANOS_PER_MINUTE;
    public static final long NANOS_PER_DAY = 24L * NANOS_PER_HOUR;
    public static final long NANOS_PER_WEEK = 7L * NANOS_PER_DAY;

    // 1970-01-01 is a Thursday; weekly windows start on Mondays.
    private static final long WEEK_ORIGIN_SHIFT = 3L * NANOS_PER_DAY;

    private static final CalendarDuration ZERO = new CalendarDuration(0L, 0L, 0L, 0L, 0L, false, false);

    private final long months;
    private final long weeks;
    private final long days;
    private final long nanos;
    private final long indexSteps;
    private final boolean indexBased;
    private final boolean negative;

    private CalendarDuration(long months, long weeks, long days, long nanos, long indexSteps,
                             boolean indexBased, boolean negative) {
        this.months = months;
        this.weeks = weeks;
        this.days = days;
        this.nanos = nanos;
        this.indexSteps = indexSteps;
        this.indexBased = indexBased;
        this.negative = negative && (months | weeks | days | nanos | indexSteps) != 0L;
    }

    public static CalendarDuration zero() {
        return ZERO;
    }

    public static CalendarDuration parse(String text) throws GroupByException {
        if (text == null || text.isBlank()) {
            throw invalid(text, "duration is empty");
        }
        String input = text.trim();
        int index = 0;
        boolean negative = false;
        if (input.charAt(0) == '-') {
            negative = true;
            index++;
        }
        if (index >= input.length()) {
            throw invalid(text, "missing value");
        }

        long months = 0L;
        long weeks = 0L;
        long days = 0L;
        long nanos = 0L;
        long indexSteps = 0L;
        boolean indexBased = false;
        boolean timeBased = false;
        try {
            while (index < input.length()) {
                int start = index;
                while (index < input.length() && Character.isDigit(input.charAt(index))) {
                    index++;
                }
                if (start == index) {
                    throw invalid(text, "expected a number at position " + start);
                }
                long value = Long.parseLong(input.substring(start, index));
                int unitStart = index;
                while (index < input.length() && Character.isLetter(input.charAt(index))) {
                    index++;
                }
                String unit = input.substring(unitStart, index);
                switch (unit) {
                    case "ns" -> nanos = Math.addExact(nanos, value);
                    case "us" -> nanos = Math.addExact(nanos, Math.multiplyExact(value, NANOS_PER_MICRO));
                    case "ms" -> nanos = Math.addExact(nanos, Math.multiplyExact(value, NANOS_PER_MILLI));
                    case "s" -> nanos = Math.addExact(nanos, Math.multiplyExact(value, NANOS_PER_SECOND));
                    case "m" -> nanos = Math.addExact(nanos, Math.multiplyExact(value, NANOS_PER_MINUTE));
                    case "h" -> nanos = Math.addExact(nanos, Math.multiplyExact(value, NANOS_PER_HOUR));
                    case "d" -> days = Math.addExact(days, value);
                    case "w" -> weeks = Math.addExact(weeks, value);
                    case "mo" -> months = Math.addExact(months, value);
                    case "q" -> months = Math.addExact(months, Math.multiplyExact(value, 3L));
                    case "y" -> months = Math.addExact(months, Math.multiplyExact(value, 12L));
                    case "i" -> {
                        indexSteps = Math.addExact(indexSteps, value);
                        indexBased = true;
                    }
                    case "" -> throw invalid(text, "missing unit after " + value);
                    default -> throw invalid(text, "unknown unit '" + unit + "'");
                }
                if (!"i".equals(unit)) {
                    timeBased = true;
                }
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                "Invalid duration '" + text + "': value out of range", e);
        }
        if (indexBased && timeBased) {
            throw invalid(text, "index steps 'i' cannot be mixed with time units");
        }
        return new CalendarDuration(months, weeks, days, nanos, indexSteps, indexBased, negative);
    }

    public static CalendarDuration from(Duration duration) {
        Objects.requireNonNull(duration, "duration is required");
        Duration absolute = duration.abs();
        return new CalendarDuration(0L, 0L, 0L, absolute.toNanos(), 0L, false, duration.isNegative());
    }

    public static CalendarDuration ofIndex(long steps) {
        return new CalendarDuration(0L, 0L, 0L, 0L, Math.abs(steps), true, steps < 0);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CalendarDuration fromValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CalendarDuration duration) {
            return duration;
        }
        if (value instanceof Duration duration) {
            return from(duration);
        }
        try {
            return parse(String.valueOf(value));
        } catch (GroupByException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    public boolean isZero() {
        return (months | weeks | days | nanos | indexSteps) == 0L;
    }

    public boolean isNegative() {
        return negative;
    }

    public boolean isPositive() {
        return !negative && !isZero();
    }

    public boolean isIndexBased() {
        return indexBased;
    }

    public boolean hasCalendarPart() {
        return months != 0L;
    }

    public CalendarDuration negate() {
        return new CalendarDuration(months, weeks, days, nanos, indexSteps, indexBased, !negative);
    }

    /**
     * Shifts {@code value} (index steps, or nanoseconds since the epoch) by this duration.
     */
    public long addTo(long value, boolean temporal) {
        return addTo(value, 1L, temporal);
    }

    /**
     * Shifts {@code value} by {@code times} repetitions of this duration in one step, so that
     * calendar months do not drift through repeated day-of-month clamping.
     */
    public long addTo(long value, long times, boolean temporal) {
        long sign = negative ? -times : times;
        if (!temporal) {
            return Math.addExact(value, Math.multiplyExact(indexSteps, sign));
        }
        long shifted = value;
        if (months != 0L) {
            LocalDateTime dateTime = toDateTime(shifted).plusMonths(Math.multiplyExact(months, sign));
            shifted = fromDateTime(dateTime);
        }
        return Math.addExact(shifted, Math.multiplyExact(fixedNanos(), sign));
    }

    /**
     * Start of the window of this length that contains {@code value}. Calendar durations align on
     * month boundaries counted from 1970-01, pure week durations on Mondays and all other fixed
     * durations on multiples counted from the epoch.
     */
    public long truncate(long value, boolean temporal) {
        if (!temporal) {
            return value - Math.floorMod(value, indexSteps);
        }
        if (months != 0L) {
            LocalDateTime dateTime = toDateTime(value);
            long monthIndex = (dateTime.getYear() - 1970L) * 12L + dateTime.getMonthValue() - 1L;
            long aligned = monthIndex - Math.floorMod(monthIndex, months);
            LocalDate start = LocalDate.of((int) (1970L + Math.floorDiv(aligned, 12L)), (int) Math.floorMod(aligned, 12L) + 1, 1);
            return fromDateTime(start.atStartOfDay());
        }
        long every = fixedNanos();
        if (weeks != 0L && days == 0L && nanos == 0L) {
            return value - Math.floorMod(value + WEEK_ORIGIN_SHIFT, every);
        }
        return value - Math.floorMod(value, every);
    }

    private long fixedNanos() {
        return Math.addExact(Math.multiplyExact(Math.addExact(Math.multiplyExact(weeks, 7L), days), NANOS_PER_DAY), nanos);
    }

    static LocalDateTime toDateTime(long epochNanos) {
        long seconds = Math.floorDiv(epochNanos, NANOS_PER_SECOND);
        int nano = (int) Math.floorMod(epochNanos, NANOS_PER_SECOND);
        return LocalDateTime.ofEpochSecond(seconds, nano, ZoneOffset.UTC);
    }

    static long fromDateTime(LocalDateTime dateTime) {
        return Math.addExact(Math.multiplyExact(dateTime.toEpochSecond(ZoneOffset.UTC), NANOS_PER_SECOND), dateTime.getNano());
    }

    private static GroupByException invalid(String text, String reason) {
        return new GroupByException(GroupByException.Kind.INVALID_DURATION, "Invalid duration '" + text + "': " + reason);
    }

    @JsonValue
    @Override
    public String toString() {
        if (isZero()) {
            return indexBased ? "0i" : "0ns";
        }
        StringBuilder builder = new StringBuilder(negative ? "-" : "");
        if (indexBased) {
            return builder.append(indexSteps).append('i').toString();
        }
        if (months != 0L) {
            builder.append(months).append("mo");
        }
        if (weeks != 0L) {
            builder.append(weeks).append('w');
        }
        if (days != 0L) {
            builder.append(days).append('d');
        }
        long remaining = nanos;
        long[] sizes = {NANOS_PER_HOUR, NANOS_PER_MINUTE, NANOS_PER_SECOND, NANOS_PER_MILLI, NANOS_PER_MICRO, 1L};
        String[] units = {"h", "m", "s", "ms", "us", "ns"};
        for (int i = 0; i < sizes.length && remaining != 0L; i++) {
            long count = remaining / sizes[i];
            if (count != 0L) {
                builder.append(count).append(units[i]);
                remaining -= count * sizes[i];
            }
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CalendarDuration that)) {
            return false;
        }
        return months == that.months
            && weeks == that.weeks
            && days == that.days
            && nanos == that.nanos
            && indexSteps == that.indexSteps
            && indexBased == that.indexBased
            && negative == that.negative;
    }

    @Override
    public int hashCode() {
        return Objects.hash(months, weeks, days, nanos, indexSteps, indexBased, negative);
    }
}
