package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.ExpressionEvaluator;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.table.Values;
import io.kestra.plugin.groupby.util.GroupByOptions;
import io.kestra.plugin.groupby.util.ParallelExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partitions rows by equality of one or more key columns.
 *
 * <p>Three strategies are used, picked per call:</p>
 * <ul>
 *     <li>a single sorted, null-free key is split into runs of equal values;</li>
 *     <li>large inputs are partitioned in parallel. When order must be kept, contiguous row
 *     chunks are grouped concurrently and merged in chunk order. Otherwise every worker owns a
 *     slice of the key hash space and groups only the keys hashing into it;</li>
 *     <li>everything else goes through one insertion-ordered hash map.</li>
 * </ul>
 * Rows inside a group always keep source order. Key values of a group are taken from its first row.
 */
public final class KeyPartitioner {
    private static final Logger logger = LoggerFactory.getLogger(KeyPartitioner.class);

    private final GroupByContext context;

    public KeyPartitioner(GroupByContext context) {
        this.context = context;
    }

    public record Partitioning(List<Column> keys, int[][] groups) {
        public int size() {
            return groups.length;
        }
    }

    public GroupIndexTable partition(Table table, List<Expr> keys, boolean maintainOrder) throws GroupByException {
        List<Column> keyColumns = evaluateKeys(table, keys);
        Partitioning partitioning = partitionRows(keyColumns, maintainOrder);
        return new GroupIndexTable(partitioning.keys(), partitioning.groups());
    }

    /**
     * Evaluates grouping key expressions to columns, rejecting anything that is not a computable
     * row-wise expression over the table.
     */
    public List<Column> evaluateKeys(Table table, List<Expr> keys) throws GroupByException {
        ExpressionEvaluator evaluator = context.evaluator();
        checkKeys(evaluator, table, keys);
        List<Column> columns = new ArrayList<>(keys.size());
        for (Expr key : keys) {
            columns.add(evaluator.evaluate(key, table));
        }
        return columns;
    }

    /**
     * Resolves grouping keys against the table's schema without touching its rows.
     */
    public static void checkKeys(ExpressionEvaluator evaluator, Table table, List<Expr> keys) throws GroupByException {
        if (keys == null || keys.isEmpty()) {
            throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "At least one grouping key is required");
        }
        Set<String> names = new HashSet<>();
        for (Expr key : keys) {
            if (key == null) {
                throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "Grouping key is null");
            }
            if (evaluator.containsWildcard(key) || evaluator.isAggregating(key)) {
                throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY,
                    "Grouping key must be a column or a row-wise expression, got " + key);
            }
            FieldType type;
            try {
                type = evaluator.resolveType(key, table);
            } catch (GroupByException e) {
                if (e.getKind() == GroupByException.Kind.UNKNOWN_COLUMN
                    || e.getKind() == GroupByException.Kind.INVALID_EXPRESSION) {
                    throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY,
                        "Invalid grouping key " + key + ": " + e.getMessage(), e);
                }
                throw e;
            }
            String name = evaluator.outputName(key);
            if (type.isList()) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                    "Grouping key '" + name + "' of type " + type + " cannot be compared for equality");
            }
            if (!names.add(name)) {
                throw new GroupByException(GroupByException.Kind.DUPLICATE_COLUMN,
                    "Grouping key name '" + name + "' is used more than once");
            }
        }
    }

    public Partitioning partitionRows(List<Column> keyColumns, boolean maintainOrder) throws GroupByException {
        int height = keyColumns.get(0).size();
        GroupByOptions options = context.options();
        List<IntList> groups;
        String path;
        if (keyColumns.size() == 1 && keyColumns.get(0).isSorted()) {
            path = "sorted";
            groups = sortedRuns(keyColumns.get(0));
        } else if (options.runsParallel(height)) {
            if (maintainOrder) {
                path = "parallel-ordered";
                groups = orderedChunks(keyColumns, height, options.parallelism());
            } else {
                path = "parallel-hash";
                groups = hashPartitions(keyColumns, height, options);
            }
        } else {
            path = "sequential";
            groups = new ArrayList<>(sequential(keyColumns, 0, height).values());
        }

        int[][] rows = new int[groups.size()][];
        int[] firstRows = new int[groups.size()];
        for (int g = 0; g < rows.length; g++) {
            rows[g] = groups.get(g).toArray();
            firstRows[g] = groups.get(g).first();
        }
        List<Column> keys = new ArrayList<>(keyColumns.size());
        for (Column column : keyColumns) {
            keys.add(column.take(firstRows));
        }
        logger.debug("Partitioned {} rows into {} groups using the {} path", height, rows.length, path);
        return new Partitioning(keys, rows);
    }

    private List<IntList> sortedRuns(Column column) {
        List<IntList> runs = new ArrayList<>();
        IntList current = null;
        Object currentKey = null;
        for (int row = 0; row < column.size(); row++) {
            Object key = Values.keyOf(column.get(row));
            if (current == null || !Objects.equals(key, currentKey)) {
                current = new IntList();
                runs.add(current);
                currentKey = key;
            }
            current.add(row);
        }
        return runs;
    }

    private Map<GroupKey, IntList> sequential(List<Column> keyColumns, int start, int end) {
        Map<GroupKey, IntList> groups = new LinkedHashMap<>();
        for (int row = start; row < end; row++) {
            groups.computeIfAbsent(GroupKey.of(keyColumns, row), key -> new IntList()).add(row);
        }
        return groups;
    }

    private List<IntList> orderedChunks(List<Column> keyColumns, int height, int workers) throws GroupByException {
        int chunkSize = (height + workers - 1) / workers;
        int chunks = (height + chunkSize - 1) / chunkSize;
        List<Map<GroupKey, IntList>> partials = ParallelExecutor.map(chunks, workers,
            chunk -> sequential(keyColumns, chunk * chunkSize, Math.min(height, (chunk + 1) * chunkSize)));

        Map<GroupKey, IntList> merged = new LinkedHashMap<>();
        for (Map<GroupKey, IntList> partial : partials) {
            for (Map.Entry<GroupKey, IntList> entry : partial.entrySet()) {
                IntList existing = merged.get(entry.getKey());
                if (existing == null) {
                    merged.put(entry.getKey(), entry.getValue());
                } else {
                    existing.addAll(entry.getValue());
                }
            }
        }
        return new ArrayList<>(merged.values());
    }

    private List<IntList> hashPartitions(List<Column> keyColumns, int height, GroupByOptions options) throws GroupByException {
        int workers = options.parallelism();
        int chunkSize = (height + workers - 1) / workers;
        int chunks = (height + chunkSize - 1) / chunkSize;
        GroupKey[] keys = new GroupKey[height];
        ParallelExecutor.map(chunks, workers, chunk -> {
            int end = Math.min(height, (chunk + 1) * chunkSize);
            for (int row = chunk * chunkSize; row < end; row++) {
                keys[row] = GroupKey.of(keyColumns, row);
            }
            return null;
        });

        int partitionCount = options.partitionCount();
        int mask = partitionCount - 1;
        List<List<IntList>> partitions = ParallelExecutor.map(partitionCount, workers, partition -> {
            Map<GroupKey, IntList> owned = new LinkedHashMap<>();
            for (int row = 0; row < height; row++) {
                if ((keys[row].spread() & mask) == partition) {
                    owned.computeIfAbsent(keys[row], key -> new IntList()).add(row);
                }
            }
            return new ArrayList<>(owned.values());
        });

        List<IntList> groups = new ArrayList<>();
        for (List<IntList> partition : partitions) {
            groups.addAll(partition);
        }
        return groups;
    }
}
