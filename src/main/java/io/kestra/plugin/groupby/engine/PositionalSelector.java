package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Table;

import java.util.Arrays;

/**
 * Keeps the first or last {@code n} rows of every group and gathers them, group after group,
 * from the source table.
 */
public final class PositionalSelector {
    private PositionalSelector() {
    }

    public static Table head(Table source, GroupIndexTable groups, int n) {
        return gather(source, narrow(groups, n, true));
    }

    public static Table tail(Table source, GroupIndexTable groups, int n) {
        return gather(source, narrow(groups, n, false));
    }

    static GroupIndexTable narrow(GroupIndexTable groups, int n, boolean fromStart) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative, got " + n);
        }
        int[][] narrowed = new int[groups.size()][];
        for (int g = 0; g < narrowed.length; g++) {
            int[] rows = groups.rows(g);
            int keep = Math.min(n, rows.length);
            narrowed[g] = fromStart
                ? Arrays.copyOfRange(rows, 0, keep)
                : Arrays.copyOfRange(rows, rows.length - keep, rows.length);
        }
        return groups.withIndices(narrowed);
    }

    private static Table gather(Table source, GroupIndexTable groups) {
        int total = 0;
        for (int g = 0; g < groups.size(); g++) {
            total += groups.groupSize(g);
        }
        int[] rows = new int[total];
        int position = 0;
        for (int g = 0; g < groups.size(); g++) {
            int[] groupRows = groups.rows(g);
            System.arraycopy(groupRows, 0, rows, position, groupRows.length);
            position += groupRows.length;
        }
        return source.take(rows);
    }
}
