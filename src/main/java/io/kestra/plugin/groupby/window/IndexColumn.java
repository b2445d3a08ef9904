package io.kestra.plugin.groupby.window;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Index column of a rolling or dynamic grouping, converted to {@code long}s: raw values for
 * {@code INT} columns, nanoseconds since 1970-01-01T00:00 for {@code DATE} and {@code DATETIME}.
 */
public final class IndexColumn {
    private final Column column;
    private final long[] values;

    private IndexColumn(Column column, long[] values) {
        this.column = column;
        this.values = values;
    }

    public static IndexColumn of(Column column) throws GroupByException {
        DataType type = column.type();
        if (type != DataType.INT && type != DataType.DATE && type != DataType.DATETIME) {
            throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                "Index column '" + column.name() + "' must be INT, DATE or DATETIME, got " + column.fieldType());
        }
        long[] values = new long[column.size()];
        for (int i = 0; i < values.length; i++) {
            Object value = column.get(i);
            if (value == null) {
                throw new GroupByException(GroupByException.Kind.UNSORTED_INDEX,
                    "Index column '" + column.name() + "' contains a null at row " + i);
            }
            try {
                values[i] = toLong(value);
            } catch (ArithmeticException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                    "Index value " + value + " at row " + i + " is out of the supported range", e);
            }
        }
        return new IndexColumn(column, values);
    }

    private static long toLong(Object value) {
        if (value instanceof LocalDate date) {
            return Math.multiplyExact(date.toEpochDay(), CalendarDuration.NANOS_PER_DAY);
        }
        if (value instanceof LocalDateTime dateTime) {
            return CalendarDuration.fromDateTime(dateTime);
        }
        return (Long) value;
    }

    public String name() {
        return column.name();
    }

    public DataType type() {
        return column.type();
    }

    public boolean isTemporal() {
        return column.type() != DataType.INT;
    }

    public int size() {
        return values.length;
    }

    public long value(int row) {
        return values[row];
    }

    /**
     * Converts an index-space value back to the column's own type. {@code DATE} values are
     * floored to their day.
     */
    public Object toValue(long value) {
        return switch (column.type()) {
            case DATE -> LocalDate.ofEpochDay(Math.floorDiv(value, CalendarDuration.NANOS_PER_DAY));
            case DATETIME -> CalendarDuration.toDateTime(value);
            default -> value;
        };
    }

    /**
     * Converts an index-space value to a window boundary value: {@code DATETIME} for temporal
     * indexes, {@code INT} otherwise.
     */
    public Object toBoundary(long value) {
        return isTemporal() ? CalendarDuration.toDateTime(value) : value;
    }

    public DataType boundaryType() {
        return isTemporal() ? DataType.DATETIME : DataType.INT;
    }

    /**
     * Checks that {@code duration} uses units matching this column: index steps for integer
     * columns, time units for temporal ones.
     */
    public void checkUnits(CalendarDuration duration, String parameter) throws GroupByException {
        if (duration.isZero()) {
            return;
        }
        if (isTemporal() && duration.isIndexBased()) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                parameter + " '" + duration + "' uses index steps but index column '" + name() + "' is " + type());
        }
        if (!isTemporal() && !duration.isIndexBased()) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION,
                parameter + " '" + duration + "' must use the 'i' unit for integer index column '" + name() + "'");
        }
    }

    /**
     * Checks that the index is non-decreasing over {@code rows}.
     */
    public void checkSorted(int[] rows) throws GroupByException {
        for (int k = 1; k < rows.length; k++) {
            if (values[rows[k - 1]] > values[rows[k]]) {
                throw new GroupByException(GroupByException.Kind.UNSORTED_INDEX,
                    "Index column '" + name() + "' is not sorted ascending at row " + rows[k]);
            }
        }
    }
}
