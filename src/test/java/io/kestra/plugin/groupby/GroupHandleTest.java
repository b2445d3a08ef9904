package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.engine.GroupIterator;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.QuantileMethod;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.window.CalendarDuration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

class GroupHandleTest {
    private final Table table = Table.of(
        Column.strings("a", "x", "y", "x"),
        Column.ints("b", 1, 2, 3),
        Column.floats("f", 1.0, 2.0, 5.0)
    );

    @Test
    void aggregatesInFirstOccurrenceOrder() throws Exception {
        Table result = GroupBy.keys(table, "a").aggregate(Expr.col("b").sum());

        assertThat(result.columnNames(), contains("a", "b"));
        assertThat(result.column("a").toList(), contains("x", "y"));
        assertThat(result.column("b").toList(), contains(4L, 2L));
        assertThat(result.column("b").fieldType(), is(FieldType.of(DataType.INT)));
    }

    @Test
    void shorthands() throws Exception {
        GroupHandle handle = GroupBy.keys(table, "a");

        assertThat(handle.sum().column("f").toList(), contains(6.0d, 2.0d));
        assertThat(handle.mean().column("b").toList(), contains(2.0d, 2.0d));
        assertThat(handle.min().column("b").toList(), contains(1L, 2L));
        assertThat(handle.max().column("f").toList(), contains(5.0d, 2.0d));
        assertThat(handle.first().column("b").toList(), contains(1L, 2L));
        assertThat(handle.last().column("b").toList(), contains(3L, 2L));
        assertThat(handle.nUnique().column("b").toList(), contains(2L, 1L));
        assertThat(handle.median().column("b").toList(), contains(2.0d, 2.0d));
        assertThat(handle.quantile(1.0).column("b").toList(), contains(3.0d, 2.0d));
        assertThat(handle.quantile(0.0, QuantileMethod.LOWER).column("b").toList(), contains(1.0d, 2.0d));

        Table counts = handle.count();
        assertThat(counts.columnNames(), contains("a", "count"));
        assertThat(counts.column("count").toList(), contains(2L, 1L));

        Table lists = handle.all();
        assertThat(lists.columnNames(), contains("a", "b", "f"));
        assertThat(lists.column("b").get(0), is(List.of(1L, 3L)));
    }

    @Test
    void sharesOneGroupIndex() throws Exception {
        GroupHandle handle = GroupBy.keys(table, "a");

        assertThat(handle.groupIndex(), sameInstance(handle.groupIndex()));
    }

    @Test
    void rejectsDuplicateOutputNames() throws Exception {
        GroupHandle handle = GroupBy.keys(table, "a");

        GroupByException twice = Assertions.assertThrows(GroupByException.class,
            () -> handle.aggregate(Expr.col("b").sum(), Expr.col("b").mean()));
        GroupByException onLabel = Assertions.assertThrows(GroupByException.class,
            () -> handle.aggregate(Expr.col("b").sum().alias("a")));

        assertThat(twice.getKind(), is(GroupByException.Kind.DUPLICATE_COLUMN));
        assertThat(onLabel.getKind(), is(GroupByException.Kind.DUPLICATE_COLUMN));
        assertThat(handle.aggregate(Expr.col("b").sum(), Expr.col("b").mean().alias("b_mean")).width(), is(3));
    }

    @Test
    void listAggregationExplodesBackToGroupedRows() throws Exception {
        Table lists = GroupBy.keys(table, "a").aggregate(Expr.col("b"));

        Table exploded = lists.explode(List.of("b"));

        assertThat(exploded.column("a").toList(), contains("x", "x", "y"));
        assertThat(exploded.column("b").toList(), contains(1L, 3L, 2L));
    }

    @Test
    void headAndTail() throws Exception {
        Table source = Table.of(
            Column.strings("a", "x", "y", "x", "y", "x"),
            Column.ints("b", 1, 2, 3, 4, 5)
        );
        GroupHandle handle = GroupBy.keys(source, "a");

        assertThat(handle.head(2).column("b").toList(), contains(1L, 3L, 2L, 4L));
        assertThat(handle.tail(1).column("b").toList(), contains(5L, 4L));
        assertThat(handle.head().height(), is(5));
        assertThat(handle.head(0).height(), is(0));
        assertThat(handle.head(1).columnNames(), contains("a", "b"));
    }

    @Test
    void iteratesGroups() throws Exception {
        GroupIterator iterator = GroupBy.keys(table, "a").iterate();

        List<Object> keys = new ArrayList<>();
        while (iterator.hasNext()) {
            keys.add(iterator.next().key());
        }

        assertThat(keys, contains("x", "y"));
    }

    @Test
    void multiKeyIterationYieldsListKeys() throws Exception {
        GroupIterator iterator = GroupBy.keys(table, "a", "b").iterate();

        assertThat(iterator.next().key(), is(List.of("x", 1L)));
    }

    @Test
    void appliesCallbackPerGroup() throws Exception {
        Table result = GroupBy.keys(table, "a").apply(group -> group.slice(group.height() - 1, 1));

        assertThat(result.column("a").toList(), contains("x", "y"));
        assertThat(result.column("b").toList(), contains(3L, 2L));
    }

    @Test
    void applyNeedsColumnKeys() throws Exception {
        GroupHandle byExpression = GroupBy.keys(table, List.of(Expr.col("b").modulo(Expr.lit(2L))), true);
        GroupHandle rolling = GroupBy.rolling(table, "b", CalendarDuration.parse("2i"), null, null, null);

        GroupByException expression = Assertions.assertThrows(GroupByException.class,
            () -> byExpression.apply(group -> group));
        GroupByException window = Assertions.assertThrows(GroupByException.class,
            () -> rolling.apply(group -> group));

        assertThat(expression.getKind(), is(GroupByException.Kind.CALLBACK_SIGNATURE_ERROR));
        assertThat(window.getKind(), is(GroupByException.Kind.CALLBACK_SIGNATURE_ERROR));
    }

    @Test
    void wrapsCallbackFailures() throws Exception {
        GroupHandle handle = GroupBy.keys(table, "a");

        GroupByException thrown = Assertions.assertThrows(GroupByException.class,
            () -> handle.apply(group -> {
                throw new IllegalStateException("boom");
            }));
        GroupByException missing = Assertions.assertThrows(GroupByException.class,
            () -> handle.apply(group -> null));

        assertThat(thrown.getKind(), is(GroupByException.Kind.CALLBACK_FAILED));
        assertThat(thrown.getCause() instanceof IllegalStateException, is(true));
        assertThat(missing.getKind(), is(GroupByException.Kind.CALLBACK_FAILED));
    }

    @Test
    void rollingSums() throws Exception {
        Table source = Table.of(Column.ints("t", 1, 2, 3, 10), Column.ints("v", 1, 1, 1, 1));

        Table result = GroupBy.rolling(source, "t", CalendarDuration.parse("3i"), null, null, null)
            .aggregate(Expr.col("v").sum());

        assertThat(result.columnNames(), contains("t", "v"));
        assertThat(result.column("t").toList(), contains(1L, 2L, 3L, 10L));
        assertThat(result.column("v").toList(), contains(1L, 2L, 3L, 1L));
    }

    @Test
    void dynamicSumsWithBoundaries() throws Exception {
        Table source = Table.of(Column.ints("t", 0, 1, 2, 3, 4, 5, 6), Column.ints("v", 1, 2, 3, 4, 5, 6, 7));

        Table result = GroupBy.dynamic(source, "t", CalendarDuration.parse("3i"), null, null,
                true, true, null, null, null)
            .aggregate(Expr.col("v").sum());

        assertThat(result.columnNames(), contains("_lower_boundary", "_upper_boundary", "t", "v"));
        assertThat(result.column("t").toList(), contains(0L, 3L, 6L));
        assertThat(result.column("_upper_boundary").toList(), contains(3L, 6L, 9L));
        assertThat(result.column("v").toList(), contains(6L, 15L, 7L));
    }

    @Test
    void dynamicOverDatetimes() throws Exception {
        Table source = Table.of(
            Column.datetimes("ts",
                LocalDateTime.of(2024, 3, 1, 9, 15),
                LocalDateTime.of(2024, 3, 1, 9, 45),
                LocalDateTime.of(2024, 3, 1, 11, 5)),
            Column.ints("v", 1, 2, 3)
        );

        Table result = GroupBy.dynamic(source, "ts", CalendarDuration.parse("1h"), null, null,
                true, false, null, null, null)
            .aggregate(Expr.len());

        assertThat(result.column("ts").toList(), contains(
            LocalDateTime.of(2024, 3, 1, 9, 0),
            LocalDateTime.of(2024, 3, 1, 10, 0),
            LocalDateTime.of(2024, 3, 1, 11, 0)));
        assertThat(result.column("count").toList(), contains(2L, 0L, 1L));
    }

    @Test
    void dailyWindowsCoverTheIndexRange() throws Exception {
        Table source = Table.of(Column.datetimes("ts",
            LocalDateTime.of(2024, 1, 1, 0, 0),
            LocalDateTime.of(2024, 1, 2, 6, 0),
            LocalDateTime.of(2024, 1, 3, 12, 0)));

        GroupIterator iterator = GroupBy.dynamic(source, "ts", CalendarDuration.parse("1d"), CalendarDuration.parse("1d"),
                null, true, true, null, null, null)
            .iterate();

        assertThat(iterator.groupCount(), is(3));
        iterator.next();
        iterator.next();
        Object lastKey = iterator.next().key();
        assertThat(lastKey, is(List.of(
            LocalDateTime.of(2024, 1, 3, 0, 0),
            LocalDateTime.of(2024, 1, 4, 0, 0),
            LocalDateTime.of(2024, 1, 3, 0, 0))));
    }

    @Test
    void validatesEagerly() {
        GroupByException type = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.rolling(table, "a", CalendarDuration.parse("2i"), null, null, null));
        GroupByException units = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.rolling(table, "b", CalendarDuration.parse("2d"), null, null, null));
        GroupByException noKeys = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.keys(table, List.of(), true));

        assertThat(type.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
        assertThat(units.getKind(), is(GroupByException.Kind.INVALID_DURATION));
        assertThat(noKeys.getKind(), is(GroupByException.Kind.INVALID_GROUPING_KEY));
    }

    @Test
    void resolvesKeysBeforeAnyGroupIsBuilt() {
        GroupByException unknownKey = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.keys(table, "missing"));
        GroupByException unknownBy = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.rolling(table, "b", CalendarDuration.parse("2i"), null, null, List.of(Expr.col("nope"))));
        GroupByException listKey = Assertions.assertThrows(GroupByException.class,
            () -> GroupBy.keys(table, List.of(Expr.col("b").cast(DataType.LIST)), true));

        assertThat(unknownKey.getKind(), is(GroupByException.Kind.INVALID_GROUPING_KEY));
        assertThat(unknownBy.getKind(), is(GroupByException.Kind.INVALID_GROUPING_KEY));
        assertThat(listKey.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
    }
}
