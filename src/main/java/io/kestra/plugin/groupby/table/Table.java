package io.kestra.plugin.groupby.table;

import io.kestra.plugin.groupby.GroupByException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, named collection of equal-length columns. Rows are addressed by 0-based position.
 * Tables are immutable: every operation returns a new table.
 */
public final class Table {
    private static final Table EMPTY = new Table(List.of());

    private final List<Column> columns;
    private final Map<String, Column> byName;
    private final int height;

    public Table(List<Column> columns) {
        this.columns = List.copyOf(columns);
        this.byName = new LinkedHashMap<>();
        int expectedHeight = this.columns.isEmpty() ? 0 : this.columns.get(0).size();
        for (Column column : this.columns) {
            if (column.size() != expectedHeight) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                    + " rows, expected " + expectedHeight);
            }
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
        this.height = expectedHeight;
    }

    public static Table of(Column... columns) {
        return new Table(Arrays.asList(columns));
    }

    public static Table empty() {
        return EMPTY;
    }

    public int height() {
        return height;
    }

    public int width() {
        return columns.size();
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(byName.keySet());
    }

    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }

    public Column column(String name) throws GroupByException {
        Column column = byName.get(name);
        if (column == null) {
            throw new GroupByException(GroupByException.Kind.UNKNOWN_COLUMN, "Unknown column: " + name);
        }
        return column;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public List<FieldType> schema() {
        List<FieldType> schema = new ArrayList<>(columns.size());
        for (Column column : columns) {
            schema.add(column.fieldType());
        }
        return schema;
    }

    /**
     * Gathers the rows at the given positions, in that order.
     */
    public Table take(int[] rows) {
        List<Column> taken = new ArrayList<>(columns.size());
        for (Column column : columns) {
            taken.add(column.take(rows));
        }
        return new Table(taken);
    }

    public Table slice(int offset, int length) {
        List<Column> sliced = new ArrayList<>(columns.size());
        for (Column column : columns) {
            sliced.add(column.slice(offset, length));
        }
        return new Table(sliced);
    }

    public Table select(List<String> names) throws GroupByException {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(column(name));
        }
        return new Table(selected);
    }

    public List<Object> row(int index) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Column column : columns) {
            row.add(column.get(index));
        }
        return Collections.unmodifiableList(row);
    }

    public List<List<Object>> rows() {
        List<List<Object>> rows = new ArrayList<>(height);
        for (int i = 0; i < height; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(height);
        for (int i = 0; i < height; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (Column column : columns) {
                record.put(column.name(), column.get(i));
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Concatenates tables row-wise. All tables must share column names and types, in order.
     */
    public static Table concat(List<Table> tables) throws GroupByException {
        if (tables.isEmpty()) {
            return EMPTY;
        }
        Table first = tables.get(0);
        int total = 0;
        for (Table table : tables) {
            if (!table.columnNames().equals(first.columnNames()) || !table.schema().equals(first.schema())) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                    "Cannot concatenate tables with different schemas: " + first.describeSchema()
                        + " and " + table.describeSchema());
            }
            total += table.height;
        }
        List<Column> merged = new ArrayList<>(first.width());
        for (int c = 0; c < first.width(); c++) {
            Object[] values = new Object[total];
            int offset = 0;
            for (Table table : tables) {
                Column column = table.column(c);
                for (int i = 0; i < column.size(); i++) {
                    values[offset++] = column.get(i);
                }
            }
            merged.add(new Column(first.column(c).name(), first.column(c).fieldType(), values));
        }
        return new Table(merged);
    }

    /**
     * Flattens list columns back into rows. Every other column is repeated once per element.
     * A null or empty list produces a single row holding null.
     */
    public Table explode(List<String> names) throws GroupByException {
        Set<String> exploded = Set.copyOf(names);
        for (String name : names) {
            Column column = column(name);
            if (column.type() != DataType.LIST) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                    "Cannot explode column '" + name + "' of type " + column.fieldType());
            }
        }
        List<Integer> sourceRows = new ArrayList<>();
        List<Integer> elementIndexes = new ArrayList<>();
        for (int row = 0; row < height; row++) {
            int length = -1;
            for (String name : names) {
                List<?> list = (List<?>) byName.get(name).get(row);
                int size = list == null ? 0 : list.size();
                if (length >= 0 && size != length) {
                    throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                        "Exploded columns have different list lengths at row " + row);
                }
                length = size;
            }
            int repeat = Math.max(1, length);
            for (int element = 0; element < repeat; element++) {
                sourceRows.add(row);
                elementIndexes.add(length <= 0 ? -1 : element);
            }
        }
        List<Column> result = new ArrayList<>(columns.size());
        for (Column column : columns) {
            Object[] values = new Object[sourceRows.size()];
            boolean explode = exploded.contains(column.name());
            for (int i = 0; i < values.length; i++) {
                Object cell = column.get(sourceRows.get(i));
                if (explode) {
                    int element = elementIndexes.get(i);
                    values[i] = element < 0 ? null : ((List<?>) cell).get(element);
                } else {
                    values[i] = cell;
                }
            }
            FieldType type = explode ? FieldType.of(column.fieldType().elementType()) : column.fieldType();
            result.add(new Column(column.name(), type, values));
        }
        return new Table(result);
    }

    private String describeSchema() {
        StringBuilder builder = new StringBuilder("{");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(columns.get(i).name()).append(": ").append(columns.get(i).fieldType());
        }
        return builder.append('}').toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Table that)) {
            return false;
        }
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("shape: (").append(height).append(", ").append(width()).append(")\n");
        builder.append(describeSchema()).append('\n');
        for (int i = 0; i < height; i++) {
            List<Object> row = row(i);
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) {
                    builder.append(" | ");
                }
                builder.append(Values.render(row.get(c)));
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
