package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.engine.GroupIndexMaterializer;
import io.kestra.plugin.groupby.engine.GroupIndexTable;
import io.kestra.plugin.groupby.engine.KeyPartitioner;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.window.CalendarDuration;
import io.kestra.plugin.groupby.window.ClosedWindow;
import io.kestra.plugin.groupby.window.DynamicWindowComputer;
import io.kestra.plugin.groupby.window.IndexColumn;
import io.kestra.plugin.groupby.window.StartBy;
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
    title = "Dynamic group by",
    description = "Fixed-cadence windows over a sorted index column: a window starts every `every` and spans `period`."
)
public class DynamicGroupBy extends GroupByRequest {
    @Schema(title = "Index column", description = "INT, DATE or DATETIME column, sorted ascending within each `by` partition.")
    private final String indexColumn;

    @Schema(title = "Window stride")
    private final CalendarDuration every;

    @Schema(title = "Window length", description = "Defaults to `every`.")
    private final CalendarDuration period;

    @Schema(title = "Window offset", description = "Shift applied to the first window start. Defaults to zero.")
    private final CalendarDuration offset;

    @Builder.Default
    @Schema(title = "Truncate", description = "Label each window with its start instead of its first index value.")
    private final boolean truncate = true;

    @Builder.Default
    @Schema(title = "Include boundaries", description = "Add `_lower_boundary` and `_upper_boundary` label columns.")
    private final boolean includeBoundaries = false;

    @Builder.Default
    @Schema(title = "Inclusive boundaries")
    private final ClosedWindow closed = ClosedWindow.LEFT;

    @Schema(title = "Additional grouping keys")
    private final List<Expr> by;

    @Builder.Default
    @Schema(title = "First window anchoring", description = "`window`, `datapoint` or a weekday such as `monday`.")
    private final StartBy startBy = StartBy.WINDOW;

    @Builder.Default
    @Schema(title = "Include empty windows", description = "Keep windows that contain no rows.")
    private final boolean includeEmptyWindows = true;

    @Override
    public void validate(Table table, GroupByContext context) throws GroupByException {
        if (indexColumn == null || indexColumn.isBlank()) {
            throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "indexColumn is required");
        }
        if (every == null) {
            throw new GroupByException(GroupByException.Kind.INVALID_DURATION, "every is required");
        }
        computer().validate(IndexColumn.of(table.column(indexColumn)));
        if (by != null && !by.isEmpty()) {
            KeyPartitioner.checkKeys(context.evaluator(), table, by);
        }
    }

    @Override
    public GroupIndexTable materialize(Table table, GroupIndexMaterializer materializer) throws GroupByException {
        return materializer.dynamic(table, indexColumn, computer(), by, truncate, includeBoundaries);
    }

    private DynamicWindowComputer computer() {
        return new DynamicWindowComputer(every, period, offset, closed, startBy, includeEmptyWindows);
    }
}
