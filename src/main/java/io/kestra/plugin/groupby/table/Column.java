package io.kestra.plugin.groupby.table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, homogeneously typed sequence of cells. A {@code null} cell is the null marker.
 */
public final class Column {
    private final String name;
    private final FieldType type;
    private final Object[] values;

    public Column(String name, FieldType type, Object[] values) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.values = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            Object value = Values.normalize(values[i], type.type());
            if (!type.type().accepts(value)) {
                throw new IllegalArgumentException("Column '" + name + "' of type " + type
                    + " cannot hold " + value.getClass().getSimpleName() + " at row " + i);
            }
            this.values[i] = value;
        }
    }

    public static Column of(String name, DataType type, Object... values) {
        return new Column(name, FieldType.of(type), values);
    }

    public static Column of(String name, FieldType type, Object... values) {
        return new Column(name, type, values);
    }

    public static Column ints(String name, long... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new Column(name, FieldType.of(DataType.INT), boxed);
    }

    public static Column floats(String name, double... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new Column(name, FieldType.of(DataType.FLOAT), boxed);
    }

    public static Column decimals(String name, BigDecimal... values) {
        return new Column(name, FieldType.of(DataType.DECIMAL), values);
    }

    public static Column strings(String name, String... values) {
        return new Column(name, FieldType.of(DataType.STRING), values);
    }

    public static Column booleans(String name, Boolean... values) {
        return new Column(name, FieldType.of(DataType.BOOLEAN), values);
    }

    public static Column dates(String name, LocalDate... values) {
        return new Column(name, FieldType.of(DataType.DATE), values);
    }

    public static Column datetimes(String name, LocalDateTime... values) {
        return new Column(name, FieldType.of(DataType.DATETIME), values);
    }

    public static Column nulls(String name, int length) {
        return new Column(name, FieldType.of(DataType.NULL), new Object[length]);
    }

    public String name() {
        return name;
    }

    public FieldType fieldType() {
        return type;
    }

    public DataType type() {
        return type.type();
    }

    public int size() {
        return values.length;
    }

    public Object get(int row) {
        return values[row];
    }

    public boolean isNull(int row) {
        return values[row] == null;
    }

    /**
     * Gathers the cells at {@code rows}, in that order, into a new column.
     */
    public Column take(int[] rows) {
        Object[] taken = new Object[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new Column(name, type, taken);
    }

    public Column slice(int offset, int length) {
        int start = Math.max(0, Math.min(offset, values.length));
        int end = Math.min(values.length, start + Math.max(0, length));
        return new Column(name, type, Arrays.copyOfRange(values, start, end));
    }

    /**
     * Whether the column is null-free and non-decreasing.
     */
    public boolean isSorted() {
        if (!type.type().isOrdered()) {
            return false;
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                return false;
            }
            if (i > 0 && Values.compare(values[i - 1], values[i]) > 0) {
                return false;
            }
        }
        return true;
    }

    public List<Object> toList() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column that)) {
            return false;
        }
        return name.equals(that.name) && type.equals(that.type) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return name + ": " + type + " " + Arrays.toString(values);
    }
}
