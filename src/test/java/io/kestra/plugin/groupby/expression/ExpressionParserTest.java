package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.DataType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

class ExpressionParserTest {
    private final ExpressionParser parser = ExpressionParser.standard();

    @Test
    void parsesReductions() throws Exception {
        assertThat(parser.parse("sum(b)"), is(Expr.col("b").sum()));
        assertThat(parser.parse("avg(b)"), is(Expr.col("b").mean()));
        assertThat(parser.parse("n_unique(a)"), is(Expr.col("a").nUnique()));
        assertThat(parser.parse("median(b)"), is(Expr.col("b").median()));
        assertThat(parser.parse("implode(b)"), is(Expr.col("b").list()));
        assertThat(parser.parse("count(b)"), is(Expr.col("b").count()));
    }

    @Test
    void countWithoutArgumentsIsGroupLength() throws Exception {
        assertThat(parser.parse("count()"), is(Expr.len()));
        assertThat(parser.parse("len()"), is(Expr.len()));
        assertThat(parser.parse("all()"), is(Expr.all()));
    }

    @Test
    void quantileDefaultsToNearest() throws Exception {
        assertThat(parser.parse("quantile(b, 0.9)"), is(Expr.col("b").quantile(0.9, QuantileMethod.NEAREST)));
        assertThat(parser.parse("quantile(b, 0.25, \"linear\")"), is(Expr.col("b").quantile(0.25, QuantileMethod.LINEAR)));
    }

    @Test
    void parsesColumnsCastsAndAliases() throws Exception {
        assertThat(parser.parse("col(\"name with spaces\")"), is(Expr.col("name with spaces")));
        assertThat(parser.parse("cast(a, \"float\")"), is(Expr.col("a").cast(DataType.FLOAT)));
        assertThat(parser.parse("alias(sum(b), 'total')"), is(Expr.col("b").sum().alias("total")));
    }

    @Test
    void respectsOperatorPrecedence() throws Exception {
        Expr expected = Expr.col("a").plus(Expr.lit(2L).times(Expr.lit(3L)));

        assertThat(parser.parse("a + 2 * 3"), is(expected));
        assertThat(parser.parse("(a + 2) * 3"), is(Expr.col("a").plus(Expr.lit(2L)).times(Expr.lit(3L))));
        assertThat(parser.parse("a % 2 == 0"), is(Expr.col("a").modulo(Expr.lit(2L)).eq(Expr.lit(0L))));
    }

    @Test
    void parsesLiterals() throws Exception {
        assertThat(parser.parse("-3"), is(Expr.lit(-3L)));
        assertThat(parser.parse("1.5"), is(Expr.lit(1.5d)));
        assertThat(parser.parse("true"), is(Expr.lit(true)));
        assertThat(parser.parse("null"), is(Expr.lit(null)));
        assertThat(parser.parse("\"x\""), is(Expr.lit("x")));
    }

    @Test
    void cachesParsedExpressions() throws Exception {
        assertThat(parser.parse("sum(cached)"), sameInstance(parser.parse("sum(cached)")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "sum(", "sum(a, b)", "unknown(a)", "quantile(a, \"x\")", "cast(a, \"TEXT\")", "a +", "a b"})
    void rejectsInvalidExpressions(String expression) {
        GroupByException e = Assertions.assertThrows(GroupByException.class, () -> parser.parse(expression));
        assertThat(e.getKind(), is(GroupByException.Kind.INVALID_EXPRESSION));
    }
}
