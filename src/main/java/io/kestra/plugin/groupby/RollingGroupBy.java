package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.engine.GroupIndexMaterializer;
import io.kestra.plugin.groupby.engine.GroupIndexTable;
import io.kestra.plugin.groupby.engine.KeyPartitioner;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.window.CalendarDuration;
import io.kestra.plugin.groupby.window.ClosedWindow;
import io.kestra.plugin.groupby.window.IndexColumn;
import io.kestra.plugin.groupby.window.RollingWindowComputer;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@SuperBuilder
@Jacksonized
@ToString
@EqualsAndHashCode(callSuper = false)
@Getter
@Schema(
    title = "Rolling group by",
    description = "One window per row of a sorted index column. The window anchored at value t is (t + offset, t + offset + period], boundaries included according to `closed`."
)
public class RollingGroupBy extends GroupByRequest {
    @Schema(title = "Index column", description = "INT, DATE or DATETIME column, sorted ascending within each `by` partition.")
    private final String indexColumn;

    @Schema(title = "Window length", description = "Duration string such as `3d`, `1mo` or `2i` for integer indexes.")
    private final CalendarDuration period;

    @Schema(title = "Window offset", description = "Shift of the window start from the anchor. Defaults to minus `period`.")
    private final CalendarDuration offset;

    @Builder.Default
    @Schema(title = "Inclusive boundaries")
    private final ClosedWindow closed = ClosedWindow.RIGHT;

    @Schema(title = "Additional grouping keys", description = "Windows never span two `by` partitions.")
    private final List<Expr> by;

    public CalendarDuration effectiveOffset() {
        return offset != null ? offset : period.negate();
    }

    @Override
    public void validate(Table table, GroupByContext context) throws GroupByException {
        if (indexColumn == null || indexColumn.isBlank()) {
            throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "indexColumn is required");
        }
        if (period == null) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION, "period is required");
        }
        computer().validate(IndexColumn.of(table.column(indexColumn)));
        if (by != null && !by.isEmpty()) {
            KeyPartitioner.checkKeys(context.evaluator(), table, by);
        }
    }

    @Override
    public GroupIndexTable materialize(Table table, GroupIndexMaterializer materializer) throws GroupByException {
        return materializer.rolling(table, indexColumn, computer(), by);
    }

    private RollingWindowComputer computer() {
        return new RollingWindowComputer(period, effectiveOffset(), closed == null ? ClosedWindow.RIGHT : closed);
    }
}
