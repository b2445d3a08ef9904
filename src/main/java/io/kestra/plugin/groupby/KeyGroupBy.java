package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.engine.GroupIndexMaterializer;
import io.kestra.plugin.groupby.engine.GroupIndexTable;
import io.kestra.plugin.groupby.engine.KeyPartitioner;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.ExprKind;
import io.kestra.plugin.groupby.table.Table;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.List;

@SuperBuilder
@Jacksonized
@ToString
@EqualsAndHashCode(callSuper = false)
@Getter
@Schema(
    title = "Group by keys",
    description = "Partition rows by equality of one or more key columns or expressions."
)
public class KeyGroupBy extends GroupByRequest {
    @Schema(
        title = "Grouping keys",
        description = "Column names or row-wise expressions."
    )
    private final List<Expr> keys;

    @Builder.Default
    @Schema(
        title = "Maintain order",
        description = "Emit groups in the order their key first appears. Otherwise the order is deterministic but unspecified."
    )
    private final boolean maintainOrder = false;

    public static KeyGroupBy of(String... columns) {
        return KeyGroupBy.builder()
            .keys(Arrays.stream(columns).map(Expr::col).toList())
            .maintainOrder(true)
            .build();
    }

    @Override
    public void validate(Table table, GroupByContext context) throws GroupByException {
        if (keys == null || keys.isEmpty()) {
            throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "keys is required");
        }
        KeyPartitioner.checkKeys(context.evaluator(), table, keys);
    }

    @Override
    public GroupIndexTable materialize(Table table, GroupIndexMaterializer materializer) throws GroupByException {
        return materializer.byKeys(table, keys, maintainOrder);
    }

    @Override
    public boolean supportsApply() {
        return keys != null && keys.stream().allMatch(key -> key.kind() == ExprKind.COLUMN);
    }
}
