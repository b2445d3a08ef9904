package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.table.Values;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates {@link Expr} trees against tables. Two contexts exist:
 * <ul>
 *     <li>row context ({@link #evaluate}): one value per row, reductions are rejected;</li>
 *     <li>aggregation context ({@link #aggregate}): one value per group. A reducing expression
 *     yields a scalar, anything else is collected into a list of the group's row values.</li>
 * </ul>
 * Every node kind is handled here, in one switch per context.
 */
public final class ExpressionEvaluator {
    private static final ExpressionEvaluator DEFAULT = new ExpressionEvaluator(new ColumnCaster());
    private static final int DECIMAL_DIVISION_SCALE = 10;

    private final ColumnCaster caster;

    public ExpressionEvaluator(ColumnCaster caster) {
        this.caster = caster;
    }

    public static ExpressionEvaluator standard() {
        return DEFAULT;
    }

    /**
     * Whether the expression collapses a group to a single value.
     */
    public boolean isAggregating(Expr expr) {
        return switch (expr.kind()) {
            case REDUCE, LEN -> true;
            case COLUMN, LITERAL, WILDCARD -> false;
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                yield isAggregating(binary.left()) || isAggregating(binary.right());
            }
            case CAST -> isAggregating(((Expr.Cast) expr).input());
            case ALIAS -> isAggregating(((Expr.Alias) expr).input());
        };
    }

    public boolean containsWildcard(Expr expr) {
        return switch (expr.kind()) {
            case WILDCARD -> true;
            case COLUMN, LITERAL, LEN -> false;
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                yield containsWildcard(binary.left()) || containsWildcard(binary.right());
            }
            case REDUCE -> containsWildcard(((Expr.Reduce) expr).input());
            case CAST -> containsWildcard(((Expr.Cast) expr).input());
            case ALIAS -> containsWildcard(((Expr.Alias) expr).input());
        };
    }

    /**
     * Replaces every wildcard with each of {@code columns} in turn, producing one expression per
     * column. Expressions without a wildcard are returned unchanged.
     */
    public List<Expr> expandWildcard(Expr expr, List<String> columns) {
        if (!containsWildcard(expr)) {
            return List.of(expr);
        }
        List<Expr> expanded = new ArrayList<>(columns.size());
        for (String column : columns) {
            expanded.add(substitute(expr, column));
        }
        return expanded;
    }

    private Expr substitute(Expr expr, String column) {
        return switch (expr.kind()) {
            case WILDCARD -> Expr.col(column);
            case COLUMN, LITERAL, LEN -> expr;
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                yield new Expr.Binary(binary.operator(), substitute(binary.left(), column), substitute(binary.right(), column));
            }
            case REDUCE -> {
                Expr.Reduce reduce = (Expr.Reduce) expr;
                yield new Expr.Reduce(reduce.reduction(), substitute(reduce.input(), column), reduce.quantile(), reduce.method());
            }
            case CAST -> {
                Expr.Cast cast = (Expr.Cast) expr;
                yield new Expr.Cast(substitute(cast.input(), column), cast.type());
            }
            case ALIAS -> {
                Expr.Alias alias = (Expr.Alias) expr;
                yield new Expr.Alias(substitute(alias.input(), column), alias.name());
            }
        };
    }

    /**
     * Name of the column an expression produces: its alias, else its leftmost column,
     * {@code count} for a group length and {@code literal} for constants.
     */
    public String outputName(Expr expr) {
        String name = leftmostName(expr);
        return name == null ? "literal" : name;
    }

    private String leftmostName(Expr expr) {
        return switch (expr.kind()) {
            case COLUMN -> ((Expr.Column) expr).name();
            case ALIAS -> ((Expr.Alias) expr).name();
            case LEN -> "count";
            case LITERAL, WILDCARD -> null;
            case REDUCE -> leftmostName(((Expr.Reduce) expr).input());
            case CAST -> leftmostName(((Expr.Cast) expr).input());
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                String left = leftmostName(binary.left());
                yield left != null ? left : leftmostName(binary.right());
            }
        };
    }

    /**
     * Type of the values the expression yields in its natural context: per row for plain
     * expressions, per group for reducing ones.
     */
    public FieldType resolveType(Expr expr, Table table) throws GroupByException {
        return switch (expr.kind()) {
            case COLUMN -> table.column(((Expr.Column) expr).name()).fieldType();
            case LITERAL -> FieldType.of(((Expr.Literal) expr).type());
            case WILDCARD -> throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                "all() must be expanded against a table before evaluation");
            case LEN -> FieldType.of(DataType.INT);
            case ALIAS -> resolveType(((Expr.Alias) expr).input(), table);
            case CAST -> {
                Expr.Cast cast = (Expr.Cast) expr;
                FieldType source = resolveType(cast.input(), table);
                if (cast.type() == DataType.LIST) {
                    if (!source.isList()) {
                        throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                            "Cannot cast " + source + " to LIST");
                    }
                    yield source;
                }
                if (source.isList()) {
                    throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                        "Cannot cast " + source + " to " + cast.type());
                }
                yield FieldType.of(cast.type());
            }
            case BINARY -> binaryType((Expr.Binary) expr, table);
            case REDUCE -> reduceType((Expr.Reduce) expr, table);
        };
    }

    /**
     * Type of the column produced for this expression by {@link #aggregate}.
     */
    public FieldType aggregateType(Expr expr, Table table) throws GroupByException {
        FieldType type = resolveType(expr, table);
        return isAggregating(expr) ? type : FieldType.listOf(type.type());
    }

    /**
     * Row-context evaluation over the whole table.
     */
    public Column evaluate(Expr expr, Table table) throws GroupByException {
        if (isAggregating(expr)) {
            throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                "Aggregation is not allowed in row context: " + expr);
        }
        FieldType type = resolveType(expr, table);
        int[] rows = new int[table.height()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return new Column(outputName(expr), type, rowValues(expr, table, rows));
    }

    /**
     * Aggregation-context evaluation for one group, whose rows are {@code rows}.
     * Callers are expected to have validated the expression with {@link #aggregateType} first.
     */
    public Object aggregate(Expr expr, Table table, int[] rows) throws GroupByException {
        if (!isAggregating(expr)) {
            return Collections.unmodifiableList(Arrays.asList(rowValues(expr, table, rows)));
        }
        return groupValue(expr, table, rows);
    }

    private Object groupValue(Expr expr, Table table, int[] rows) throws GroupByException {
        return switch (expr.kind()) {
            case LEN -> (long) rows.length;
            case LITERAL -> ((Expr.Literal) expr).value();
            case ALIAS -> groupValue(((Expr.Alias) expr).input(), table, rows);
            case CAST -> caster.cast(groupValue(((Expr.Cast) expr).input(), table, rows), ((Expr.Cast) expr).type());
            case REDUCE -> {
                Expr.Reduce reduce = (Expr.Reduce) expr;
                FieldType inputType = resolveType(reduce.input(), table);
                yield reduce(reduce, inputType.type(), rowValues(reduce.input(), table, rows));
            }
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                FieldType resultType = resolveType(expr, table);
                yield applyBinary(binary.operator(), resultType.type(),
                    groupValue(binary.left(), table, rows), groupValue(binary.right(), table, rows));
            }
            case COLUMN, WILDCARD -> throw new GroupByException(GroupByException.Kind.AGGREGATION_TYPE_ERROR,
                "Cannot combine column '" + expr + "' with an aggregation without reducing it");
        };
    }

    private Object[] rowValues(Expr expr, Table table, int[] rows) throws GroupByException {
        Object[] values = new Object[rows.length];
        switch (expr.kind()) {
            case COLUMN -> {
                Column column = table.column(((Expr.Column) expr).name());
                for (int i = 0; i < rows.length; i++) {
                    values[i] = column.get(rows[i]);
                }
            }
            case LITERAL -> Arrays.fill(values, ((Expr.Literal) expr).value());
            case ALIAS -> values = rowValues(((Expr.Alias) expr).input(), table, rows);
            case CAST -> {
                Expr.Cast cast = (Expr.Cast) expr;
                Object[] input = rowValues(cast.input(), table, rows);
                for (int i = 0; i < input.length; i++) {
                    values[i] = caster.cast(input[i], cast.type());
                }
            }
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                DataType resultType = resolveType(expr, table).type();
                Object[] left = rowValues(binary.left(), table, rows);
                Object[] right = rowValues(binary.right(), table, rows);
                for (int i = 0; i < rows.length; i++) {
                    values[i] = applyBinary(binary.operator(), resultType, left[i], right[i]);
                }
            }
            case WILDCARD -> throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                "all() must be expanded against a table before evaluation");
            case REDUCE, LEN -> throw new GroupByException(GroupByException.Kind.AGGREGATION_TYPE_ERROR,
                "Nested aggregation is not supported: " + expr);
        }
        return values;
    }

    private FieldType binaryType(Expr.Binary binary, Table table) throws GroupByException {
        DataType left = resolveType(binary.left(), table).type();
        DataType right = resolveType(binary.right(), table).type();
        Operator operator = binary.operator();
        if (operator.isLogical()) {
            if (!isBooleanLike(left) || !isBooleanLike(right)) {
                throw operatorMismatch(operator, left, right);
            }
            return FieldType.of(DataType.BOOLEAN);
        }
        if (operator.isComparison()) {
            boolean comparable = left == DataType.NULL || right == DataType.NULL || left == right
                || (left.isNumeric() && right.isNumeric());
            boolean ordered = operator == Operator.EQ_EQ || operator == Operator.NOT_EQ
                || (left.isOrdered() && right.isOrdered());
            if (!comparable || !ordered) {
                throw operatorMismatch(operator, left, right);
            }
            return FieldType.of(DataType.BOOLEAN);
        }
        if (left == DataType.NULL || right == DataType.NULL) {
            DataType other = left == DataType.NULL ? right : left;
            if (other != DataType.NULL && !other.isNumeric() && !(other == DataType.STRING && operator == Operator.PLUS)) {
                throw operatorMismatch(operator, left, right);
            }
            if (operator == Operator.SLASH && other == DataType.INT) {
                return FieldType.of(DataType.FLOAT);
            }
            return FieldType.of(other);
        }
        if (left == DataType.STRING && right == DataType.STRING && operator == Operator.PLUS) {
            return FieldType.of(DataType.STRING);
        }
        if (!left.isNumeric() || !right.isNumeric()) {
            throw operatorMismatch(operator, left, right);
        }
        if (left == DataType.FLOAT || right == DataType.FLOAT) {
            return FieldType.of(DataType.FLOAT);
        }
        if (left == DataType.DECIMAL || right == DataType.DECIMAL) {
            return FieldType.of(DataType.DECIMAL);
        }
        return FieldType.of(operator == Operator.SLASH ? DataType.FLOAT : DataType.INT);
    }

    private FieldType reduceType(Expr.Reduce reduce, Table table) throws GroupByException {
        if (isAggregating(reduce.input())) {
            throw new GroupByException(GroupByException.Kind.AGGREGATION_TYPE_ERROR,
                "Nested aggregation is not supported: " + reduce);
        }
        FieldType input = resolveType(reduce.input(), table);
        DataType type = input.type();
        return switch (reduce.reduction()) {
            case SUM -> switch (type) {
                case INT, BOOLEAN, NULL -> FieldType.of(DataType.INT);
                case FLOAT, DECIMAL -> input;
                default -> throw reductionMismatch(reduce, input);
            };
            case MEAN -> switch (type) {
                case INT, FLOAT, BOOLEAN, NULL -> FieldType.of(DataType.FLOAT);
                case DECIMAL -> input;
                default -> throw reductionMismatch(reduce, input);
            };
            case MEDIAN, QUANTILE -> {
                if (reduce.reduction() == Reduction.QUANTILE) {
                    if (Double.isNaN(reduce.quantile()) || reduce.quantile() < 0.0d || reduce.quantile() > 1.0d) {
                        throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                            "Quantile must be between 0.0 and 1.0, got " + reduce.quantile());
                    }
                }
                if (!type.isNumeric() && type != DataType.BOOLEAN && type != DataType.NULL) {
                    throw reductionMismatch(reduce, input);
                }
                yield FieldType.of(DataType.FLOAT);
            }
            case MIN, MAX -> {
                if (!type.isOrdered()) {
                    throw reductionMismatch(reduce, input);
                }
                yield input;
            }
            case FIRST, LAST -> input;
            case COUNT, N_UNIQUE -> FieldType.of(DataType.INT);
            case LIST -> FieldType.listOf(type);
        };
    }

    private Object reduce(Expr.Reduce reduce, DataType type, Object[] values) {
        return switch (reduce.reduction()) {
            case SUM -> sum(type, values);
            case MEAN -> mean(type, values);
            case MEDIAN, QUANTILE -> quantile(values, reduce.quantile(),
                reduce.method() == null ? QuantileMethod.NEAREST : reduce.method());
            case MIN -> extreme(values, -1);
            case MAX -> extreme(values, 1);
            case FIRST -> values.length == 0 ? null : values[0];
            case LAST -> values.length == 0 ? null : values[values.length - 1];
            case COUNT -> {
                long count = 0;
                for (Object value : values) {
                    if (value != null) {
                        count++;
                    }
                }
                yield count;
            }
            case N_UNIQUE -> {
                Set<Object> distinct = new HashSet<>();
                for (Object value : values) {
                    distinct.add(Values.keyOf(value));
                }
                yield (long) distinct.size();
            }
            case LIST -> Collections.unmodifiableList(Arrays.asList(values));
        };
    }

    private Object sum(DataType type, Object[] values) {
        switch (type) {
            case FLOAT -> {
                double total = 0.0d;
                for (Object value : values) {
                    if (value != null) {
                        total += (Double) value;
                    }
                }
                return total;
            }
            case DECIMAL -> {
                BigDecimal total = BigDecimal.ZERO;
                for (Object value : values) {
                    if (value != null) {
                        total = total.add((BigDecimal) value);
                    }
                }
                return total;
            }
            default -> {
                long total = 0L;
                for (Object value : values) {
                    if (value instanceof Boolean bool) {
                        total += bool ? 1L : 0L;
                    } else if (value != null) {
                        total += (Long) value;
                    }
                }
                return total;
            }
        }
    }

    private Object mean(DataType type, Object[] values) {
        if (type == DataType.DECIMAL) {
            BigDecimal total = BigDecimal.ZERO;
            long count = 0;
            for (Object value : values) {
                if (value != null) {
                    total = total.add((BigDecimal) value);
                    count++;
                }
            }
            return count == 0 ? null : total.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
        }
        double total = 0.0d;
        long count = 0;
        for (Object value : values) {
            if (value != null) {
                total += asDouble(value);
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private Object quantile(Object[] values, double quantile, QuantileMethod method) {
        double[] sorted = Arrays.stream(values)
            .filter(Objects::nonNull)
            .mapToDouble(ExpressionEvaluator::asDouble)
            .sorted()
            .toArray();
        if (sorted.length == 0) {
            return null;
        }
        double position = (sorted.length - 1) * quantile;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return switch (method) {
            case NEAREST -> sorted[(int) Math.round(position)];
            case LOWER -> sorted[lower];
            case HIGHER -> sorted[upper];
            case MIDPOINT -> (sorted[lower] + sorted[upper]) / 2.0d;
            case LINEAR -> sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
        };
    }

    private Object extreme(Object[] values, int direction) {
        Object best = null;
        for (Object value : values) {
            if (value == null || (value instanceof Double doubleValue && doubleValue.isNaN())) {
                continue;
            }
            if (best == null || Values.compare(value, best) * direction > 0) {
                best = value;
            }
        }
        return best;
    }

    private Object applyBinary(Operator operator, DataType resultType, Object left, Object right) throws GroupByException {
        if (operator.isLogical()) {
            return logical(operator, (Boolean) left, (Boolean) right);
        }
        if (left == null || right == null) {
            return null;
        }
        if (operator.isComparison()) {
            return compare(operator, left, right);
        }
        return switch (resultType) {
            case STRING -> (String) left + right;
            case INT -> integerArithmetic(operator, (Long) left, (Long) right);
            case FLOAT -> floatArithmetic(operator, asDouble(left), asDouble(right));
            case DECIMAL -> decimalArithmetic(operator, Values.toDecimal((Number) left), Values.toDecimal((Number) right));
            default -> throw operatorMismatch(operator, DataType.NULL, resultType);
        };
    }

    private Boolean logical(Operator operator, Boolean left, Boolean right) {
        if (operator == Operator.AND_AND) {
            if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
                return false;
            }
            return left == null || right == null ? null : true;
        }
        if (Boolean.TRUE.equals(left) || Boolean.TRUE.equals(right)) {
            return true;
        }
        return left == null || right == null ? null : false;
    }

    private Boolean compare(Operator operator, Object left, Object right) {
        if (operator == Operator.EQ_EQ || operator == Operator.NOT_EQ) {
            boolean equal = left instanceof Number && right instanceof Number
                ? Values.compare(left, right) == 0
                : Objects.equals(Values.keyOf(left), Values.keyOf(right));
            return operator == Operator.EQ_EQ == equal;
        }
        int comparison = Values.compare(left, right);
        return switch (operator) {
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
            default -> throw new IllegalStateException("Not a comparison: " + operator);
        };
    }

    private Long integerArithmetic(Operator operator, long left, long right) {
        return switch (operator) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case STAR -> left * right;
            case PERCENT -> right == 0L ? null : Math.floorMod(left, right);
            default -> throw new IllegalStateException("Not an integer operator: " + operator);
        };
    }

    private Double floatArithmetic(Operator operator, double left, double right) {
        return switch (operator) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case STAR -> left * right;
            case SLASH -> left / right;
            case PERCENT -> left - right * Math.floor(left / right);
            default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
        };
    }

    private BigDecimal decimalArithmetic(Operator operator, BigDecimal left, BigDecimal right) {
        return switch (operator) {
            case PLUS -> left.add(right);
            case MINUS -> left.subtract(right);
            case STAR -> left.multiply(right);
            case SLASH -> right.signum() == 0 ? null : left.divide(right, DECIMAL_DIVISION_SCALE, RoundingMode.HALF_UP);
            case PERCENT -> right.signum() == 0 ? null : left.remainder(right);
            default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
        };
    }

    private static double asDouble(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? 1.0d : 0.0d;
        }
        return ((Number) value).doubleValue();
    }

    private static boolean isBooleanLike(DataType type) {
        return type == DataType.BOOLEAN || type == DataType.NULL;
    }

    private static GroupByException operatorMismatch(Operator operator, DataType left, DataType right) {
        return new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Operator " + operator.symbol() + " is not defined for " + left + " and " + right);
    }

    private static GroupByException reductionMismatch(Expr.Reduce reduce, FieldType input) {
        return new GroupByException(GroupByException.Kind.AGGREGATION_TYPE_ERROR,
            reduce.reduction().functionName() + " is not defined for " + input + " values: " + reduce);
    }
}
