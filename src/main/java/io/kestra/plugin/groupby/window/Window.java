package io.kestra.plugin.groupby.window;

/**
 * One window: its boundaries in index space and the source rows inside it, in row order.
 */
public record Window(long lower, long upper, int[] rows) {
    public boolean isEmpty() {
        return rows.length == 0;
    }
}
