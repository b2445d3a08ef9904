package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.Table;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class ColumnCasterTest {
    private final ColumnCaster caster = new ColumnCaster();

    @Test
    void castsScalars() throws Exception {
        assertThat(caster.cast("12", DataType.INT), is(12L));
        assertThat(caster.cast(2.0d, DataType.INT), is(2L));
        assertThat(caster.cast(true, DataType.INT), is(1L));
        assertThat(caster.cast(3L, DataType.FLOAT), is(3.0d));
        assertThat(caster.cast(new BigDecimal("1.50"), DataType.STRING), is("1.50"));
        assertThat(caster.cast("false", DataType.BOOLEAN), is(false));
        assertThat(caster.cast("2024-02-29", DataType.DATE), is(LocalDate.of(2024, 2, 29)));
        assertThat(caster.cast(null, DataType.INT), is(nullValue()));
    }

    @Test
    void castsColumns() throws Exception {
        Column cast = caster.cast(Column.strings("code", "1", "2", null), DataType.INT);

        assertThat(cast.type(), is(DataType.INT));
        assertThat(cast.name(), is("code"));
        assertThat(cast.get(0), is(1L));
        assertThat(cast.get(2), is(nullValue()));
    }

    @Test
    void rejectsLossyOrInvalidCasts() {
        Assertions.assertAll(
            () -> assertThat(Assertions.assertThrows(GroupByException.class, () -> caster.cast(2.5d, DataType.INT)).getKind(),
                is(GroupByException.Kind.TYPE_MISMATCH)),
            () -> assertThat(Assertions.assertThrows(GroupByException.class, () -> caster.cast("abc", DataType.FLOAT)).getKind(),
                is(GroupByException.Kind.TYPE_MISMATCH)),
            () -> assertThat(Assertions.assertThrows(GroupByException.class, () -> caster.cast("maybe", DataType.BOOLEAN)).getKind(),
                is(GroupByException.Kind.TYPE_MISMATCH)),
            () -> assertThat(Assertions.assertThrows(GroupByException.class, () -> caster.cast(1L, DataType.NULL)).getKind(),
                is(GroupByException.Kind.TYPE_MISMATCH))
        );
    }

    @Test
    void castsThroughExpressions() throws Exception {
        Column codes = ExpressionEvaluator.standard().evaluate(
            ExpressionParser.standard().parse("cast(code, \"INT\") % 10"),
            Table.of(Column.strings("code", "123", "45")));

        assertThat(codes.toList(), contains(3L, 5L));
    }
}
