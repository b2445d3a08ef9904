package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.AggregationDispatcher;
import io.kestra.plugin.groupby.engine.GroupApplier;
import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.engine.GroupCallback;
import io.kestra.plugin.groupby.engine.GroupIndexMaterializer;
import io.kestra.plugin.groupby.engine.GroupIndexTable;
import io.kestra.plugin.groupby.engine.GroupIterator;
import io.kestra.plugin.groupby.engine.PositionalSelector;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.QuantileMethod;
import io.kestra.plugin.groupby.table.Table;

import java.util.Arrays;
import java.util.List;

/**
 * A grouping bound to a table. The group index is materialized on first use and then shared by
 * every consumer of this handle, so aggregation, iteration, head/tail and apply all see the same
 * groups in the same order.
 */
public final class GroupHandle {
    private static final int DEFAULT_ROWS = 5;

    private final Table source;
    private final GroupByRequest request;
    private final GroupByContext context;
    private GroupIndexTable groupIndex;

    GroupHandle(Table source, GroupByRequest request, GroupByContext context) {
        this.source = source;
        this.request = request;
        this.context = context;
    }

    public Table source() {
        return source;
    }

    public GroupByRequest request() {
        return request;
    }

    public synchronized GroupIndexTable groupIndex() throws GroupByException {
        if (groupIndex == null) {
            groupIndex = request.materialize(source, new GroupIndexMaterializer(context));
        }
        return groupIndex;
    }

    public Table aggregate(Expr... expressions) throws GroupByException {
        return aggregate(Arrays.asList(expressions));
    }

    public Table aggregate(List<Expr> expressions) throws GroupByException {
        return new AggregationDispatcher(context).aggregate(source, groupIndex(), expressions);
    }

    public Table sum() throws GroupByException {
        return aggregate(Expr.all().sum());
    }

    public Table mean() throws GroupByException {
        return aggregate(Expr.all().mean());
    }

    public Table min() throws GroupByException {
        return aggregate(Expr.all().min());
    }

    public Table max() throws GroupByException {
        return aggregate(Expr.all().max());
    }

    public Table first() throws GroupByException {
        return aggregate(Expr.all().first());
    }

    public Table last() throws GroupByException {
        return aggregate(Expr.all().last());
    }

    /**
     * Number of rows per group, in a {@code count} column.
     */
    public Table count() throws GroupByException {
        return aggregate(Expr.len());
    }

    public Table nUnique() throws GroupByException {
        return aggregate(Expr.all().nUnique());
    }

    public Table median() throws GroupByException {
        return aggregate(Expr.all().median());
    }

    public Table quantile(double quantile) throws GroupByException {
        return quantile(quantile, QuantileMethod.NEAREST);
    }

    public Table quantile(double quantile, QuantileMethod method) throws GroupByException {
        return aggregate(Expr.all().quantile(quantile, method));
    }

    /**
     * Every non-label column collected into one list per group.
     */
    public Table all() throws GroupByException {
        return aggregate(Expr.all());
    }

    public Table head() throws GroupByException {
        return head(DEFAULT_ROWS);
    }

    public Table head(int n) throws GroupByException {
        return PositionalSelector.head(source, groupIndex(), n);
    }

    public Table tail() throws GroupByException {
        return tail(DEFAULT_ROWS);
    }

    public Table tail(int n) throws GroupByException {
        return PositionalSelector.tail(source, groupIndex(), n);
    }

    /**
     * Opened cursor over (key, sub-table) pairs in group order.
     */
    public GroupIterator iterate() throws GroupByException {
        return new GroupIterator(source, this::groupIndex).open();
    }

    /**
     * Replaces every group by the table {@code callback} returns for it and concatenates the
     * replacements in group order. Only available when grouping by plain column names.
     */
    public Table apply(GroupCallback callback) throws GroupByException {
        if (!request.supportsApply()) {
            throw new GroupByException(GroupByException.Kind.CALLBACK_SIGNATURE_ERROR,
                "apply requires a key grouping by column names, not " + request);
        }
        return GroupApplier.apply(source, groupIndex(), callback);
    }
}
