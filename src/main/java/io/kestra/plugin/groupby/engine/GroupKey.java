package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hashable tuple of normalized key values for one row. Nulls are ordinary values, so all rows
 * with a null key form one group.
 */
record GroupKey(List<Object> values) {
    static GroupKey of(List<Column> columns, int row) {
        if (columns.size() == 1) {
            return new GroupKey(Collections.singletonList(Values.keyOf(columns.get(0).get(row))));
        }
        List<Object> values = new ArrayList<>(columns.size());
        for (Column column : columns) {
            values.add(Values.keyOf(column.get(row)));
        }
        return new GroupKey(values);
    }

    /**
     * Hash spread over the low bits, used to pick a partition.
     */
    int spread() {
        int hash = hashCode();
        return hash ^ (hash >>> 16);
    }
}
