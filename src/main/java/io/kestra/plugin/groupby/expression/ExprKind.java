package io.kestra.plugin.groupby.expression;

public enum ExprKind {
    COLUMN,
    LITERAL,
    WILDCARD,
    BINARY,
    REDUCE,
    LEN,
    CAST,
    ALIAS
}
