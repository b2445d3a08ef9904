package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Table;

/**
 * User function applied to each group's sub-table. It owns the table it receives and returns a
 * replacement table; it is never invoked concurrently.
 */
@FunctionalInterface
public interface GroupCallback {
    Table apply(Table group) throws Exception;
}
