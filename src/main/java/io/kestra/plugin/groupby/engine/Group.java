package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Table;

/**
 * One group as seen by iteration: its key and the sub-table of its rows, in row order.
 * The key is a bare value when the grouping has one label column, otherwise a list of values.
 */
public record Group(Object key, Table rows) {
}
