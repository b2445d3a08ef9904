package io.kestra.plugin.groupby.table;

import io.kestra.plugin.groupby.GroupByException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class TableTest {
    private final Table table = Table.of(
        Column.strings("a", "x", "y", "x"),
        Column.ints("b", 1, 2, 3)
    );

    @Test
    void takesRowsInGivenOrder() {
        Table taken = table.take(new int[]{2, 0});

        assertThat(taken.height(), is(2));
        assertThat(taken.row(0), contains("x", 3L));
        assertThat(taken.row(1), contains("x", 1L));
    }

    @Test
    void slicesAndSelects() throws Exception {
        Table sliced = table.slice(1, 5);
        assertThat(sliced.height(), is(2));

        Table selected = table.select(List.of("b"));
        assertThat(selected.columnNames(), contains("b"));
        assertThat(selected.column("b").toList(), contains(1L, 2L, 3L));
    }

    @Test
    void unknownColumn() {
        GroupByException e = Assertions.assertThrows(GroupByException.class, () -> table.column("missing"));
        assertThat(e.getKind(), is(GroupByException.Kind.UNKNOWN_COLUMN));
    }

    @Test
    void rejectsRaggedAndDuplicatedColumns() {
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> Table.of(Column.ints("a", 1, 2), Column.ints("b", 1)));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> Table.of(Column.ints("a", 1), Column.ints("a", 2)));
    }

    @Test
    void rejectsValuesOfTheWrongType() {
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> Column.of("a", DataType.INT, "not a number"));
    }

    @Test
    void concatenatesMatchingSchemas() throws Exception {
        Table concatenated = Table.concat(List.of(table, table.take(new int[]{1})));

        assertThat(concatenated.height(), is(4));
        assertThat(concatenated.column("a").toList(), contains("x", "y", "x", "y"));
    }

    @Test
    void concatRejectsDifferentSchemas() {
        Table other = Table.of(Column.strings("a", "z"), Column.floats("b", 1.5));

        GroupByException e = Assertions.assertThrows(GroupByException.class, () -> Table.concat(List.of(table, other)));
        assertThat(e.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
    }

    @Test
    void explodesListColumns() throws Exception {
        Table lists = Table.of(
            Column.strings("k", "x", "y", "z"),
            Column.of("v", FieldType.listOf(DataType.INT), List.of(1L, 3L), List.of(2L), null)
        );

        Table exploded = lists.explode(List.of("v"));

        assertThat(exploded.column("k").toList(), contains("x", "x", "y", "z"));
        assertThat(exploded.column("v").toList(), is(Arrays.asList(1L, 3L, 2L, null)));
        assertThat(exploded.column("v").fieldType(), is(FieldType.of(DataType.INT)));
    }

    @Test
    void sortedness() {
        assertThat(Column.ints("a", 1, 1, 2).isSorted(), is(true));
        assertThat(Column.ints("a", 2, 1).isSorted(), is(false));
        assertThat(Column.of("a", DataType.INT, 1L, null).isSorted(), is(false));
    }

    @Test
    void normalizesKeysForEquality() {
        assertThat(Values.keyOf(-0.0d), is(Values.keyOf(0.0d)));
        assertThat(Values.keyOf(Double.NaN), is(Values.keyOf(0.0d / 0.0d)));
        assertThat(Values.keyOf(new BigDecimal("1.50")), is(Values.keyOf(new BigDecimal("1.5"))));
        assertThat(Values.keyOf(null), is(nullValue()));
    }
}
