package io.kestra.plugin.groupby.util;

/**
 * Execution settings of the engine.
 *
 * @param parallelism       maximum number of workers used by one request
 * @param parallelThreshold number of rows (or groups) below which work stays on the calling thread
 * @param partitionCount    hash partitions used by unordered parallel key grouping, a power of two
 */
public record GroupByOptions(int parallelism, int parallelThreshold, int partitionCount) {
    public static final String PARALLELISM_PROPERTY = "groupby.parallelism";
    public static final String THRESHOLD_PROPERTY = "groupby.parallel.threshold";
    public static final String PARTITIONS_PROPERTY = "groupby.partitions";
    public static final int DEFAULT_PARALLEL_THRESHOLD = 1000;

    public GroupByOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be positive, got " + parallelThreshold);
        }
        if (partitionCount < 1 || Integer.bitCount(partitionCount) != 1) {
            throw new IllegalArgumentException("partitionCount must be a power of two, got " + partitionCount);
        }
    }

    public static GroupByOptions defaults() {
        int parallelism = intProperty(PARALLELISM_PROPERTY, ParallelExecutor.poolSize());
        int threshold = intProperty(THRESHOLD_PROPERTY, DEFAULT_PARALLEL_THRESHOLD);
        int partitions = intProperty(PARTITIONS_PROPERTY, nextPowerOfTwo(parallelism));
        return new GroupByOptions(parallelism, threshold, nextPowerOfTwo(partitions));
    }

    public static GroupByOptions sequential() {
        return new GroupByOptions(1, Integer.MAX_VALUE, 1);
    }

    public static GroupByOptions parallel(int parallelism, int parallelThreshold) {
        return new GroupByOptions(parallelism, parallelThreshold, nextPowerOfTwo(parallelism));
    }

    /**
     * Whether {@code size} units of work justify fanning out.
     */
    public boolean runsParallel(int size) {
        return parallelism > 1 && size >= parallelThreshold;
    }

    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        int highest = Integer.highestOneBit(value);
        return highest == value ? value : highest << 1;
    }

    private static int intProperty(String name, int defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + raw, e);
        }
    }
}
