package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.window.CalendarDuration;
import io.kestra.plugin.groupby.window.ClosedWindow;
import io.kestra.plugin.groupby.window.StartBy;

import java.util.List;
import java.util.Objects;

/**
 * Entry point: binds a grouping request to a table after validating it.
 *
 * <pre>{@code
 * Table totals = GroupBy.keys(orders, "customer").aggregate(Expr.col("amount").sum());
 * }</pre>
 */
public final class GroupBy {
    private GroupBy() {
    }

    public static GroupHandle of(Table table, GroupByRequest request) throws GroupByException {
        return of(table, request, GroupByContext.defaults());
    }

    public static GroupHandle of(Table table, GroupByRequest request, GroupByContext context) throws GroupByException {
        Objects.requireNonNull(table, "table is required");
        Objects.requireNonNull(request, "request is required");
        request.validate(table, context);
        return new GroupHandle(table, request, context);
    }

    /**
     * Groups by column names, keeping first-occurrence order.
     */
    public static GroupHandle keys(Table table, String... columns) throws GroupByException {
        return of(table, KeyGroupBy.of(columns));
    }

    public static GroupHandle keys(Table table, List<Expr> keys, boolean maintainOrder) throws GroupByException {
        return of(table, KeyGroupBy.builder().keys(keys).maintainOrder(maintainOrder).build());
    }

    public static GroupHandle rolling(Table table,
                                      String indexColumn,
                                      CalendarDuration period,
                                      CalendarDuration offset,
                                      ClosedWindow closed,
                                      List<Expr> by) throws GroupByException {
        return of(table, RollingGroupBy.builder()
            .indexColumn(indexColumn)
            .period(period)
            .offset(offset)
            .closed(closed == null ? ClosedWindow.RIGHT : closed)
            .by(by)
            .build());
    }

    public static GroupHandle dynamic(Table table,
                                      String indexColumn,
                                      CalendarDuration every,
                                      CalendarDuration period,
                                      CalendarDuration offset,
                                      boolean truncate,
                                      boolean includeBoundaries,
                                      ClosedWindow closed,
                                      List<Expr> by,
                                      StartBy startBy) throws GroupByException {
        return of(table, DynamicGroupBy.builder()
            .indexColumn(indexColumn)
            .every(every)
            .period(period)
            .offset(offset)
            .truncate(truncate)
            .includeBoundaries(includeBoundaries)
            .closed(closed == null ? ClosedWindow.LEFT : closed)
            .by(by)
            .startBy(startBy == null ? StartBy.WINDOW : startBy)
            .build());
    }
}
