package io.kestra.plugin.groupby;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.ExpressionParser;
import io.kestra.plugin.groupby.ion.IonTables;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative aggregation: a grouping request plus named aggregate expressions.
 *
 * <pre>
 * groupBy:
 *   type: keys
 *   keys: [customer_id, country]
 *   maintainOrder: true
 * aggregates:
 *   order_count: count()
 *   total_spent:
 *     expr: sum(total_spent)
 *     type: DECIMAL
 * </pre>
 */
@Builder
@Jacksonized
@ToString
@EqualsAndHashCode
@Getter
@Schema(
    title = "Aggregate records",
    description = "Group rows and compute named, optionally typed aggregates."
)
public class Aggregate {
    private static final Logger logger = LoggerFactory.getLogger(Aggregate.class);

    @Schema(
        title = "Grouping",
        description = "A `keys`, `rolling` or `dynamic` grouping request."
    )
    private final GroupByRequest groupBy;

    @Schema(
        title = "Aggregate definitions",
        description = "Output column name to aggregate expression, with an optional result type."
    )
    private final Map<String, AggregateDefinition> aggregates;

    @Builder.Default
    @Schema(
        title = "Output format",
        description = "TEXT or BINARY Ion when writing records."
    )
    private final OutputFormat outputFormat = OutputFormat.TEXT;

    public Table run(Table table) throws GroupByException {
        return run(table, GroupByContext.defaults());
    }

    public Table run(Table table, GroupByContext context) throws GroupByException {
        if (groupBy == null) {
            throw new GroupByException(GroupByException.Kind.INVALID_GROUPING_KEY, "groupBy is required");
        }
        List<Expr> expressions = expressions();
        Table result = GroupBy.of(table, groupBy, context).aggregate(expressions);
        logger.debug("Aggregated {} rows into {} groups", table.height(), result.height());
        return result;
    }

    /**
     * Reads Ion records, aggregates them and writes the result rows in {@link #outputFormat}.
     */
    public Output run(InputStream input, OutputStream output) throws GroupByException, IOException {
        Table table = IonTables.read(input);
        Table result = run(table);
        IonTables.write(result, output, outputFormat);
        return new Output(table.height(), result.height());
    }

    List<Expr> expressions() throws GroupByException {
        if (aggregates == null || aggregates.isEmpty()) {
            throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION, "aggregates is required");
        }
        ExpressionParser parser = ExpressionParser.standard();
        List<Expr> expressions = new ArrayList<>(aggregates.size());
        for (Map.Entry<String, AggregateDefinition> entry : aggregates.entrySet()) {
            AggregateDefinition definition = entry.getValue();
            if (definition == null || definition.getExpr() == null) {
                throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                    "Aggregate definition is required for '" + entry.getKey() + "'");
            }
            Expr expr = parser.parse(definition.getExpr());
            if (definition.getType() != null) {
                expr = expr.cast(definition.getType());
            }
            expressions.add(expr.alias(entry.getKey()));
        }
        return expressions;
    }

    public record Output(long processed, long groups) {
    }

    @Builder
    @Getter
    @ToString
    @EqualsAndHashCode
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AggregateDefinition {
        @Schema(title = "Expression")
        private String expr;

        @Schema(title = "Result type")
        private DataType type;

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static AggregateDefinition from(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof String stringValue) {
                return AggregateDefinition.builder().expr(stringValue).build();
            }
            if (value instanceof Map<?, ?> map) {
                Object exprValue = map.get("expr");
                Object typeValue = map.get("type");
                DataType type = null;
                if (typeValue instanceof DataType dataType) {
                    type = dataType;
                } else if (typeValue instanceof String typeString) {
                    type = DataType.valueOf(typeString.trim().toUpperCase(Locale.ROOT));
                }
                return AggregateDefinition.builder()
                    .expr(exprValue == null ? null : String.valueOf(exprValue))
                    .type(type)
                    .build();
            }
            throw new IllegalArgumentException("Unsupported aggregate definition: " + value);
        }
    }
}
