package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Physical manifest of a grouping: one row per group holding the group's label values and the
 * ordered source-row positions that belong to it. Aggregation, iteration and the positional
 * selectors all read this structure, so they always agree on group order and membership.
 */
public final class GroupIndexTable {
    public static final String GROUPS_COLUMN = "groups";

    private final List<Column> labels;
    private final int[][] groups;

    public GroupIndexTable(List<Column> labels, int[][] groups) {
        this.labels = List.copyOf(labels);
        this.groups = groups;
        for (Column label : this.labels) {
            if (label.size() != groups.length) {
                throw new IllegalArgumentException("Label column '" + label.name() + "' has " + label.size()
                    + " rows for " + groups.length + " groups");
            }
        }
    }

    public int size() {
        return groups.length;
    }

    public List<Column> labels() {
        return labels;
    }

    public List<String> labelNames() {
        List<String> names = new ArrayList<>(labels.size());
        for (Column label : labels) {
            names.add(label.name());
        }
        return names;
    }

    public int groupSize(int group) {
        return groups[group].length;
    }

    /**
     * Copy of the row positions of {@code group}.
     */
    public int[] indices(int group) {
        return groups[group].clone();
    }

    int[] rows(int group) {
        return groups[group];
    }

    /**
     * Key of {@code group}: the bare label value for a single label column, else the list of
     * label values in label order.
     */
    public Object key(int group) {
        if (labels.size() == 1) {
            return labels.get(0).get(group);
        }
        List<Object> values = new ArrayList<>(labels.size());
        for (Column label : labels) {
            values.add(label.get(group));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Same labels, new row positions per group. Used by head/tail to narrow each group.
     */
    public GroupIndexTable withIndices(int[][] indices) {
        if (indices.length != groups.length) {
            throw new IllegalArgumentException("Expected " + groups.length + " groups, got " + indices.length);
        }
        return new GroupIndexTable(labels, indices);
    }

    public Table keyTable() {
        return new Table(labels);
    }

    /**
     * The labels plus a {@code LIST<INT>} column of row positions, as a regular table.
     */
    public Table toTable() {
        Object[] lists = new Object[groups.length];
        for (int g = 0; g < groups.length; g++) {
            List<Object> positions = new ArrayList<>(groups[g].length);
            for (int row : groups[g]) {
                positions.add((long) row);
            }
            lists[g] = positions;
        }
        List<Column> columns = new ArrayList<>(labels);
        columns.add(new Column(GROUPS_COLUMN, FieldType.listOf(DataType.INT), lists));
        return new Table(columns);
    }
}
