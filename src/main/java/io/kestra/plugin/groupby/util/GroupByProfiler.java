package io.kestra.plugin.groupby.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-thread counters for group materialization and aggregation, keyed by grouping mode
 * ({@code keys}, {@code rolling}, {@code dynamic}). Off unless {@code -Dgroupby.profile=true}
 * or {@link #setEnabled(boolean)}.
 */
public final class GroupByProfiler {
    private static volatile boolean enabled = Boolean.getBoolean("groupby.profile");
    private static final ThreadLocal<Counters> COUNTERS = ThreadLocal.withInitial(Counters::new);

    private GroupByProfiler() {
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void setEnabled(boolean value) {
        enabled = value;
    }

    public static void reset() {
        COUNTERS.get().reset();
    }

    /**
     * Records one materialization of {@code groups} groups holding {@code rows} row references
     * in total (overlapping windows count a row once per window).
     */
    public static void recordPartition(String mode, long nanos, int groups, long rows) {
        if (!enabled) {
            return;
        }
        ModeCounters counters = COUNTERS.get().modes.computeIfAbsent(mode, m -> new ModeCounters());
        counters.materializations++;
        counters.partitionNs += nanos;
        counters.groups += groups;
        counters.rows += rows;
    }

    public static void recordAggregation(long nanos, int groups) {
        if (!enabled) {
            return;
        }
        Counters counters = COUNTERS.get();
        counters.aggregateNs += nanos;
        counters.aggregatedGroups += groups;
    }

    public static Snapshot snapshot() {
        Counters counters = COUNTERS.get();
        Map<String, ModeSnapshot> modes = new LinkedHashMap<>();
        counters.modes.forEach((mode, c) ->
            modes.put(mode, new ModeSnapshot(c.materializations, c.partitionNs, c.groups, c.rows)));
        return new Snapshot(Collections.unmodifiableMap(modes), counters.aggregateNs, counters.aggregatedGroups);
    }

    public record ModeSnapshot(long materializations, long partitionNs, long groups, long rows) {
    }

    public record Snapshot(Map<String, ModeSnapshot> modes, long aggregateNs, long aggregatedGroups) {
        public ModeSnapshot mode(String mode) {
            return modes.getOrDefault(mode, new ModeSnapshot(0L, 0L, 0L, 0L));
        }
    }

    private static final class ModeCounters {
        private long materializations;
        private long partitionNs;
        private long groups;
        private long rows;
    }

    private static final class Counters {
        private final Map<String, ModeCounters> modes = new LinkedHashMap<>();
        private long aggregateNs;
        private long aggregatedGroups;

        private void reset() {
            modes.clear();
            aggregateNs = 0L;
            aggregatedGroups = 0L;
        }
    }
}
