package io.kestra.plugin.groupby.ion;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class IonTablesTest {
    @Test
    void readsTopLevelStructs() throws Exception {
        Table table = IonTables.read("""
            {customer: "c1", amount: 10.50, day: 2024-01-01}
            {customer: "c2", amount: 7.00, day: 2024-01-02, vip: true}
            {customer: "c1", amount: null, day: 2024-01-03}
            """);

        assertThat(table.columnNames(), contains("customer", "amount", "day", "vip"));
        assertThat(table.height(), is(3));
        assertThat(table.column("amount").fieldType(), is(FieldType.of(DataType.DECIMAL)));
        assertThat(table.column("amount").get(0), is(new BigDecimal("10.50")));
        assertThat(table.column("amount").get(2), is(nullValue()));
        assertThat(table.column("day").get(1), is(LocalDate.of(2024, 1, 2)));
        assertThat(table.column("vip").toList(), contains(null, true, null));
    }

    @Test
    void readsASingleListOfStructs() throws Exception {
        Table table = IonTables.read("[{a: 1, tags: []}, {a: 2, tags: [\"x\", null]}]");

        assertThat(table.column("a").toList(), contains(1L, 2L));
        assertThat(table.column("tags").fieldType(), is(FieldType.listOf(DataType.STRING)));
    }

    @Test
    void rejectsConflictingOrInvalidRecords() {
        GroupByException conflict = Assertions.assertThrows(GroupByException.class,
            () -> IonTables.read("{a: 1} {a: \"one\"}"));
        GroupByException scalar = Assertions.assertThrows(GroupByException.class,
            () -> IonTables.read("{a: 1} 2"));
        GroupByException malformed = Assertions.assertThrows(GroupByException.class,
            () -> IonTables.read("{a: "));

        assertThat(conflict.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
        assertThat(scalar.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
        assertThat(malformed.getKind(), is(GroupByException.Kind.TYPE_MISMATCH));
    }

    @Test
    void writesOneStructPerLine() throws Exception {
        Table table = Table.of(Column.strings("a", "x", "y"), Column.ints("n", 1, 2));
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        IonTables.write(table, output, OutputFormat.TEXT);

        String text = output.toString(StandardCharsets.UTF_8);
        assertThat(text.lines().count(), is(2L));
        assertThat(IonTables.read(text), is(table));
    }

    @Test
    void writesBinary() throws Exception {
        Table table = Table.of(Column.strings("a", "x", null), Column.floats("f", 1.5, 2.5));
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        IonTables.write(table, output, OutputFormat.BINARY);

        Table read = IonTables.read(new ByteArrayInputStream(output.toByteArray()));
        assertThat(read, is(table));
    }
}
