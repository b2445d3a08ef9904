package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.Values;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Expression tree node. Nodes are plain data tagged by {@link #kind()}; all evaluation lives in
 * {@link ExpressionEvaluator}, which switches over the tag.
 */
public interface Expr {
    ExprKind kind();

    static Expr col(String name) {
        return new Column(name);
    }

    static Expr lit(Object value) {
        return new Literal(Values.normalize(value, inferType(value)), inferType(value));
    }

    /**
     * Every column of the table that is not a group label.
     */
    static Expr all() {
        return new Wildcard();
    }

    /**
     * Number of rows in the group, named {@code count}.
     */
    static Expr len() {
        return new Len();
    }

    default Expr sum() {
        return new Reduce(Reduction.SUM, this);
    }

    default Expr mean() {
        return new Reduce(Reduction.MEAN, this);
    }

    default Expr min() {
        return new Reduce(Reduction.MIN, this);
    }

    default Expr max() {
        return new Reduce(Reduction.MAX, this);
    }

    default Expr first() {
        return new Reduce(Reduction.FIRST, this);
    }

    default Expr last() {
        return new Reduce(Reduction.LAST, this);
    }

    default Expr count() {
        return new Reduce(Reduction.COUNT, this);
    }

    default Expr nUnique() {
        return new Reduce(Reduction.N_UNIQUE, this);
    }

    default Expr median() {
        return new Reduce(Reduction.MEDIAN, this, 0.5d, QuantileMethod.LINEAR);
    }

    default Expr quantile(double quantile, QuantileMethod method) {
        return new Reduce(Reduction.QUANTILE, this, quantile, method);
    }

    default Expr list() {
        return new Reduce(Reduction.LIST, this);
    }

    default Expr alias(String name) {
        return new Alias(this, name);
    }

    default Expr cast(DataType type) {
        return new Cast(this, type);
    }

    default Expr plus(Expr other) {
        return new Binary(Operator.PLUS, this, other);
    }

    default Expr minus(Expr other) {
        return new Binary(Operator.MINUS, this, other);
    }

    default Expr times(Expr other) {
        return new Binary(Operator.STAR, this, other);
    }

    default Expr divide(Expr other) {
        return new Binary(Operator.SLASH, this, other);
    }

    default Expr modulo(Expr other) {
        return new Binary(Operator.PERCENT, this, other);
    }

    default Expr eq(Expr other) {
        return new Binary(Operator.EQ_EQ, this, other);
    }

    default Expr gt(Expr other) {
        return new Binary(Operator.GT, this, other);
    }

    default Expr lt(Expr other) {
        return new Binary(Operator.LT, this, other);
    }

    private static DataType inferType(Object value) {
        if (value == null) {
            return DataType.NULL;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return DataType.INT;
        }
        if (value instanceof Double || value instanceof Float) {
            return DataType.FLOAT;
        }
        if (value instanceof BigDecimal) {
            return DataType.DECIMAL;
        }
        if (value instanceof Boolean) {
            return DataType.BOOLEAN;
        }
        if (value instanceof String) {
            return DataType.STRING;
        }
        if (value instanceof LocalDate) {
            return DataType.DATE;
        }
        if (value instanceof LocalDateTime) {
            return DataType.DATETIME;
        }
        throw new IllegalArgumentException("Unsupported literal: " + value.getClass().getName());
    }

    record Column(String name) implements Expr {
        public Column {
            Objects.requireNonNull(name, "column name is required");
        }

        @Override
        public ExprKind kind() {
            return ExprKind.COLUMN;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Literal(Object value, DataType type) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.LITERAL;
        }

        @Override
        public String toString() {
            return Values.render(value);
        }
    }

    record Wildcard() implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.WILDCARD;
        }

        @Override
        public String toString() {
            return "all()";
        }
    }

    record Binary(Operator operator, Expr left, Expr right) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.BINARY;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    record Reduce(Reduction reduction, Expr input, double quantile, QuantileMethod method) implements Expr {
        public Reduce(Reduction reduction, Expr input) {
            this(reduction, input, Double.NaN, null);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.REDUCE;
        }

        @Override
        public String toString() {
            if (reduction == Reduction.QUANTILE) {
                return "quantile(" + input + ", " + quantile + ", \"" + method.value() + "\")";
            }
            return reduction.functionName() + "(" + input + ")";
        }
    }

    record Len() implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.LEN;
        }

        @Override
        public String toString() {
            return "count()";
        }
    }

    record Cast(Expr input, DataType type) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.CAST;
        }

        @Override
        public String toString() {
            return "cast(" + input + ", \"" + type + "\")";
        }
    }

    record Alias(Expr input, String name) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.ALIAS;
        }

        @Override
        public String toString() {
            return "alias(" + input + ", \"" + name + "\")";
        }
    }
}
