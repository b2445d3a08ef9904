package io.kestra.plugin.groupby.table;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

class ValuesTest {
    @Test
    void comparesEachOrderedType() {
        assertThat(Values.compare(2L, 10L), lessThan(0));
        assertThat(Values.compare(1.5d, -0.5d), greaterThan(0));
        assertThat(Values.compare(new BigDecimal("1.50"), new BigDecimal("1.5")), is(0));
        assertThat(Values.compare("apple", "banana"), lessThan(0));
        assertThat(Values.compare(true, false), greaterThan(0));
        assertThat(Values.compare(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)), greaterThan(0));
        assertThat(Values.compare(LocalDateTime.of(2024, 1, 1, 9, 0), LocalDateTime.of(2024, 1, 1, 10, 0)), lessThan(0));
    }

    @Test
    void mixedNumbersCompareByValue() {
        assertThat(Values.compare(2L, 1.5d), greaterThan(0));
        assertThat(Values.compare(new BigDecimal("3"), 3L), is(0));
    }

    @Test
    void nullsSortFirst() {
        assertThat(Values.compare(null, "a"), lessThan(0));
        assertThat(Values.compare("a", null), greaterThan(0));
        assertThat(Values.compare(null, null), is(0));
    }

    @Test
    void rejectsUnorderedOrMixedCells() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Values.compare("a", 1L));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> Values.compare(LocalDate.of(2024, 1, 1), LocalDateTime.of(2024, 1, 1, 0, 0)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Values.compare(List.of(1L), List.of(2L)));
    }
}
