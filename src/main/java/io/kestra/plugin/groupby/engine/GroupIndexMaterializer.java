package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.GroupByProfiler;
import io.kestra.plugin.groupby.util.ParallelExecutor;
import io.kestra.plugin.groupby.window.DynamicWindowComputer;
import io.kestra.plugin.groupby.window.IndexColumn;
import io.kestra.plugin.groupby.window.RollingWindowComputer;
import io.kestra.plugin.groupby.window.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a grouping (by keys, rolling windows or dynamic windows) into a {@link GroupIndexTable}.
 */
public final class GroupIndexMaterializer {
    public static final String LOWER_BOUNDARY = "_lower_boundary";
    public static final String UPPER_BOUNDARY = "_upper_boundary";

    private static final Logger logger = LoggerFactory.getLogger(GroupIndexMaterializer.class);

    private final GroupByContext context;
    private final KeyPartitioner partitioner;

    public GroupIndexMaterializer(GroupByContext context) {
        this.context = context;
        this.partitioner = new KeyPartitioner(context);
    }

    public GroupIndexTable byKeys(Table table, List<Expr> keys, boolean maintainOrder) throws GroupByException {
        boolean profile = GroupByProfiler.isEnabled();
        long start = profile || logger.isDebugEnabled() ? System.nanoTime() : 0L;
        GroupIndexTable groups = partitioner.partition(table, keys, maintainOrder);
        finish("keys", groups, start, profile);
        return groups;
    }

    /**
     * One group per row of {@code indexColumn}, labelled by the {@code by} keys and the anchor's
     * index value. With {@code by}, partitions follow first occurrence and anchors follow row order.
     */
    public GroupIndexTable rolling(Table table,
                                   String indexColumn,
                                   RollingWindowComputer computer,
                                   List<Expr> by) throws GroupByException {
        boolean profile = GroupByProfiler.isEnabled();
        long startNs = profile || logger.isDebugEnabled() ? System.nanoTime() : 0L;

        Column indexSource = table.column(indexColumn);
        IndexColumn index = IndexColumn.of(indexSource);
        computer.validate(index);
        KeyPartitioner.Partitioning partitions = partitionBy(table, by, indexColumn);

        List<Window[]> computed = ParallelExecutor.map(partitions.size(), context.workersFor(table.height()),
            p -> computer.compute(index, partitions.groups()[p]));

        int total = 0;
        for (Window[] windows : computed) {
            total += windows.length;
        }
        int[][] groups = new int[total][];
        int[] anchors = new int[total];
        int[] partitionOfGroup = new int[total];
        int position = 0;
        for (int p = 0; p < computed.size(); p++) {
            int[] partitionRows = partitions.groups()[p];
            Window[] windows = computed.get(p);
            for (int k = 0; k < windows.length; k++) {
                groups[position] = windows[k].rows();
                anchors[position] = partitionRows[k];
                partitionOfGroup[position] = p;
                position++;
            }
        }

        List<Column> labels = new ArrayList<>();
        for (Column key : partitions.keys()) {
            labels.add(key.take(partitionOfGroup));
        }
        labels.add(indexSource.take(anchors));
        GroupIndexTable result = new GroupIndexTable(labels, groups);
        finish("rolling", result, startNs, profile);
        return result;
    }

    /**
     * Fixed-cadence windows per {@code by} partition. Labels are the {@code by} keys, the window
     * boundaries when requested, then the index column holding either the window start
     * ({@code truncate}) or the first member's index value.
     */
    public GroupIndexTable dynamic(Table table,
                                   String indexColumn,
                                   DynamicWindowComputer computer,
                                   List<Expr> by,
                                   boolean truncate,
                                   boolean includeBoundaries) throws GroupByException {
        boolean profile = GroupByProfiler.isEnabled();
        long startNs = profile || logger.isDebugEnabled() ? System.nanoTime() : 0L;

        Column indexSource = table.column(indexColumn);
        IndexColumn index = IndexColumn.of(indexSource);
        computer.validate(index);
        KeyPartitioner.Partitioning partitions = partitionBy(table, by, indexColumn);
        if (includeBoundaries) {
            for (Column key : partitions.keys()) {
                if (key.name().equals(LOWER_BOUNDARY) || key.name().equals(UPPER_BOUNDARY)) {
                    throw new GroupByException(GroupByException.Kind.DUPLICATE_COLUMN,
                        "Grouping key '" + key.name() + "' clashes with a window boundary column");
                }
            }
        }

        List<List<Window>> computed = ParallelExecutor.map(partitions.size(), context.workersFor(table.height()),
            p -> computer.compute(index, partitions.groups()[p]));

        List<int[]> groups = new ArrayList<>();
        List<Integer> partitionOfGroup = new ArrayList<>();
        List<Object> lower = new ArrayList<>();
        List<Object> upper = new ArrayList<>();
        List<Object> keys = new ArrayList<>();
        for (int p = 0; p < computed.size(); p++) {
            for (Window window : computed.get(p)) {
                groups.add(window.rows());
                partitionOfGroup.add(p);
                lower.add(index.toBoundary(window.lower()));
                upper.add(index.toBoundary(window.upper()));
                if (truncate || window.isEmpty()) {
                    keys.add(index.toValue(window.lower()));
                } else {
                    keys.add(indexSource.get(window.rows()[0]));
                }
            }
        }

        int[] partitionIndexes = new int[groups.size()];
        for (int g = 0; g < partitionIndexes.length; g++) {
            partitionIndexes[g] = partitionOfGroup.get(g);
        }
        List<Column> labels = new ArrayList<>();
        for (Column key : partitions.keys()) {
            labels.add(key.take(partitionIndexes));
        }
        if (includeBoundaries) {
            FieldType boundaryType = FieldType.of(index.boundaryType());
            labels.add(new Column(LOWER_BOUNDARY, boundaryType, lower.toArray()));
            labels.add(new Column(UPPER_BOUNDARY, boundaryType, upper.toArray()));
        }
        labels.add(new Column(indexSource.name(), indexSource.fieldType(), keys.toArray()));
        GroupIndexTable result = new GroupIndexTable(labels, groups.toArray(new int[0][]));
        finish("dynamic", result, startNs, profile);
        return result;
    }

    private KeyPartitioner.Partitioning partitionBy(Table table, List<Expr> by, String indexColumn) throws GroupByException {
        if (isUngrouped(by)) {
            int[] all = new int[table.height()];
            for (int i = 0; i < all.length; i++) {
                all[i] = i;
            }
            return new KeyPartitioner.Partitioning(List.of(), new int[][]{all});
        }
        List<Column> keys = partitioner.evaluateKeys(table, by);
        Set<String> names = new HashSet<>();
        for (Column key : keys) {
            names.add(key.name());
        }
        if (names.contains(indexColumn)) {
            throw new GroupByException(GroupByException.Kind.DUPLICATE_COLUMN,
                "Index column '" + indexColumn + "' cannot also be a 'by' key");
        }
        return partitioner.partitionRows(keys, true);
    }

    private static boolean isUngrouped(List<Expr> by) {
        return by == null || by.isEmpty();
    }

    private void finish(String mode, GroupIndexTable groups, long startNs, boolean profile) {
        if (startNs == 0L) {
            return;
        }
        long elapsed = System.nanoTime() - startNs;
        if (profile) {
            long rows = 0L;
            for (int g = 0; g < groups.size(); g++) {
                rows += groups.groupSize(g);
            }
            GroupByProfiler.recordPartition(mode, elapsed, groups.size(), rows);
        }
        logger.debug("Materialized {} groups for {} grouping in {} us", groups.size(), mode, elapsed / 1_000L);
    }
}
