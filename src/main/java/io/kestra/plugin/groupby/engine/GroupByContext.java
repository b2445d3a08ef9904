package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.expression.ExpressionEvaluator;
import io.kestra.plugin.groupby.util.GroupByOptions;

/**
 * Collaborators shared by the engine components of one request.
 */
public record GroupByContext(GroupByOptions options, ExpressionEvaluator evaluator) {
    public static GroupByContext defaults() {
        return new GroupByContext(GroupByOptions.defaults(), ExpressionEvaluator.standard());
    }

    public static GroupByContext of(GroupByOptions options) {
        return new GroupByContext(options, ExpressionEvaluator.standard());
    }

    /**
     * Workers to use for {@code size} units of work.
     */
    public int workersFor(int size) {
        return options.runsParallel(size) ? options.parallelism() : 1;
    }
}
