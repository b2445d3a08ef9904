package io.kestra.plugin.groupby;

import io.kestra.plugin.groupby.ion.IonTables;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;
import io.kestra.plugin.groupby.util.RequestMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

class AggregateTest {
    private static final String ORDERS = """
        {customer_id: "c1", country: "FR", total_spent: 10.00}
        {customer_id: "c1", country: "FR", total_spent: 5.50}
        {customer_id: "c2", country: "US", total_spent: 7.00}
        """;

    @Test
    void aggregatesByGroup() throws Exception {
        Map<String, Aggregate.AggregateDefinition> aggregates = new LinkedHashMap<>();
        aggregates.put("order_count", Aggregate.AggregateDefinition.builder().expr("count()").type(DataType.INT).build());
        aggregates.put("total_spent", Aggregate.AggregateDefinition.builder().expr("sum(total_spent)").type(DataType.DECIMAL).build());

        Aggregate task = Aggregate.builder()
            .groupBy(KeyGroupBy.of("customer_id", "country"))
            .aggregates(aggregates)
            .build();

        Table result = task.run(IonTables.read(ORDERS));

        assertThat(result.columnNames(), contains("customer_id", "country", "order_count", "total_spent"));
        assertThat(result.column("customer_id").toList(), contains("c1", "c2"));
        assertThat(result.column("order_count").toList(), contains(2L, 1L));
        assertThat(result.column("total_spent").fieldType(), is(FieldType.of(DataType.DECIMAL)));
        assertThat(((BigDecimal) result.column("total_spent").get(0)).compareTo(new BigDecimal("15.5")), is(0));
    }

    @Test
    void readsDeclarativeDocument() throws Exception {
        Aggregate task = RequestMapper.readAggregate("""
            groupBy:
              type: keys
              keys: [a]
              maintainOrder: true
            aggregates:
              total: sum(b)
              average:
                expr: mean(b)
                type: decimal
              rows: count()
            outputFormat: binary
            """);
        Table table = Table.of(Column.strings("a", "x", "y", "x"), Column.ints("b", 1, 2, 3));

        Table result = task.run(table);

        assertThat(task.getOutputFormat(), is(OutputFormat.BINARY));
        assertThat(result.columnNames(), contains("a", "total", "average", "rows"));
        assertThat(result.column("total").toList(), contains(4L, 2L));
        assertThat(result.column("average").type(), is(DataType.DECIMAL));
        assertThat(((BigDecimal) result.column("average").get(0)).compareTo(BigDecimal.valueOf(2)), is(0));
        assertThat(result.column("rows").toList(), contains(2L, 1L));
    }

    @Test
    void streamsIonRecords() throws Exception {
        Aggregate task = RequestMapper.readAggregate(new ByteArrayInputStream("""
            groupBy:
              type: keys
              keys: [country]
              maintainOrder: true
            aggregates:
              spent: sum(total_spent)
            """.getBytes(StandardCharsets.UTF_8)));
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        Aggregate.Output summary = task.run(new ByteArrayInputStream(ORDERS.getBytes(StandardCharsets.UTF_8)), output);

        assertThat(summary.processed(), is(3L));
        assertThat(summary.groups(), is(2L));
        Table written = IonTables.read(output.toString(StandardCharsets.UTF_8));
        assertThat(written.column("country").toList(), contains("FR", "US"));
        assertThat(written.column("spent").toList(), contains(new BigDecimal("15.50"), new BigDecimal("7.00")));
    }

    @Test
    void rollingAggregation() throws Exception {
        Aggregate task = RequestMapper.readAggregate("""
            groupBy:
              type: rolling
              indexColumn: t
              period: 2i
            aggregates:
              window_sum: sum(v)
            """);
        Table table = Table.of(Column.ints("t", 1, 2, 3, 5), Column.ints("v", 1, 10, 100, 1000));

        Table result = task.run(table);

        assertThat(result.column("window_sum").toList(), contains(1L, 11L, 110L, 1000L));
    }

    @Test
    void rejectsIncompleteTasks() throws Exception {
        Table table = Table.of(Column.strings("a", "x"));
        Aggregate noAggregates = Aggregate.builder().groupBy(KeyGroupBy.of("a")).build();
        Aggregate noGrouping = Aggregate.builder()
            .aggregates(Map.of("n", Aggregate.AggregateDefinition.from("count()")))
            .build();

        GroupByException missingAggregates = Assertions.assertThrows(GroupByException.class, () -> noAggregates.run(table));
        GroupByException missingGrouping = Assertions.assertThrows(GroupByException.class, () -> noGrouping.run(table));
        GroupByException badType = Assertions.assertThrows(GroupByException.class, () -> RequestMapper.readAggregate("""
            groupBy: {type: keys, keys: [a]}
            aggregates:
              n: {expr: "count()", type: text}
            """));

        assertThat(missingAggregates.getKind(), is(GroupByException.Kind.INVALID_EXPRESSION));
        assertThat(missingGrouping.getKind(), is(GroupByException.Kind.INVALID_GROUPING_KEY));
        assertThat(badType.getKind(), is(GroupByException.Kind.INVALID_EXPRESSION));
    }
}
