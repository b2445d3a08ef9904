package io.kestra.plugin.groupby.expression;

import java.util.Locale;

/**
 * Reductions collapsing one group's values into a single cell.
 */
public enum Reduction {
    SUM,
    MEAN,
    MIN,
    MAX,
    FIRST,
    LAST,
    COUNT,
    N_UNIQUE,
    MEDIAN,
    QUANTILE,
    LIST;

    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
