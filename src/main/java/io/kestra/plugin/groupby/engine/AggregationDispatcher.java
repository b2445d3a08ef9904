package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.ExpressionEvaluator;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.GroupByProfiler;
import io.kestra.plugin.groupby.util.ParallelExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates aggregation expressions for every group of a {@link GroupIndexTable} and assembles
 * one output row per group: the label columns followed by one column per expression.
 *
 * <p>Groups are evaluated in parallel for large group counts; each worker fills the result slots
 * of its own groups, so output order is the group index order.</p>
 */
public final class AggregationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(AggregationDispatcher.class);

    private final GroupByContext context;

    public AggregationDispatcher(GroupByContext context) {
        this.context = context;
    }

    public Table aggregate(Table source, GroupIndexTable groups, List<Expr> expressions) throws GroupByException {
        ExpressionEvaluator evaluator = context.evaluator();
        List<String> labelNames = groups.labelNames();
        List<Expr> expanded = expand(source, labelNames, expressions);

        List<String> names = new ArrayList<>(expanded.size());
        List<FieldType> types = new ArrayList<>(expanded.size());
        Set<String> used = new HashSet<>(labelNames);
        for (Expr expr : expanded) {
            String name = evaluator.outputName(expr);
            if (!used.add(name)) {
                throw new GroupByException(GroupByException.Kind.DUPLICATE_COLUMN,
                    "Aggregation output column '" + name + "' is produced more than once; use alias() to rename it");
            }
            names.add(name);
            types.add(evaluator.aggregateType(expr, source));
        }

        boolean profile = GroupByProfiler.isEnabled();
        long start = profile ? System.nanoTime() : 0L;
        List<Object[]> rows = ParallelExecutor.map(groups.size(), context.workersFor(groups.size()), g -> {
            int[] groupRows = groups.rows(g);
            Object[] values = new Object[expanded.size()];
            for (int e = 0; e < values.length; e++) {
                values[e] = evaluator.aggregate(expanded.get(e), source, groupRows);
            }
            return values;
        });
        if (profile) {
            GroupByProfiler.recordAggregation(System.nanoTime() - start, groups.size());
        }

        List<Column> columns = new ArrayList<>(groups.labels());
        for (int e = 0; e < expanded.size(); e++) {
            Object[] values = new Object[rows.size()];
            for (int g = 0; g < values.length; g++) {
                values[g] = rows.get(g)[e];
            }
            columns.add(new Column(names.get(e), types.get(e), values));
        }
        logger.debug("Aggregated {} expressions over {} groups", expanded.size(), groups.size());
        return new Table(columns);
    }

    /**
     * Expands {@code all()} to every source column that is not a group label.
     */
    private List<Expr> expand(Table source, List<String> labelNames, List<Expr> expressions) {
        List<String> valueColumns = new ArrayList<>();
        for (String name : source.columnNames()) {
            if (!labelNames.contains(name)) {
                valueColumns.add(name);
            }
        }
        List<Expr> expanded = new ArrayList<>();
        for (Expr expr : expressions) {
            expanded.addAll(context.evaluator().expandWildcard(expr, valueColumns));
        }
        return expanded;
    }
}
