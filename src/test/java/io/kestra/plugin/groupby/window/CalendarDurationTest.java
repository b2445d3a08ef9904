package io.kestra.plugin.groupby.window;

import io.kestra.plugin.groupby.GroupByException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

class CalendarDurationTest {
    @Test
    void parsesConcatenatedTerms() throws Exception {
        CalendarDuration duration = CalendarDuration.parse("1d12h");

        assertThat(duration.toString(), is("1d12h"));
        assertThat(duration.isPositive(), is(true));
        assertThat(duration.hasCalendarPart(), is(false));
    }

    @Test
    void parsesNegativeAndCalendarDurations() throws Exception {
        assertThat(CalendarDuration.parse("-2h").isNegative(), is(true));
        assertThat(CalendarDuration.parse("1q").toString(), is("3mo"));
        assertThat(CalendarDuration.parse("1y2mo").toString(), is("14mo"));
        assertThat(CalendarDuration.parse("3i").isIndexBased(), is(true));
        assertThat(CalendarDuration.parse("0i").isZero(), is(true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "d", "3x", "3", "2i3d", "-", "99999999999999999999d"})
    void rejectsInvalidText(String text) {
        GroupByException e = Assertions.assertThrows(GroupByException.class, () -> CalendarDuration.parse(text));
        assertThat(e.getKind(), is(GroupByException.Kind.INVALID_DURATION));
    }

    @Test
    void convertsJavaDurations() {
        assertThat(CalendarDuration.from(Duration.ofHours(-2)).toString(), is("-2h"));
        assertThat(CalendarDuration.from(Duration.ofMillis(1500)).toString(), is("1s500ms"));
        assertThat(CalendarDuration.ofIndex(-3).toString(), is("-3i"));
        assertThat(CalendarDuration.fromValue("2d").toString(), is("2d"));
    }

    @Test
    void jsonValueRejectsInvalidText() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CalendarDuration.fromValue("soon"));
    }

    @Test
    void addsMonthsWithDayClamping() throws Exception {
        long start = CalendarDuration.fromDateTime(LocalDateTime.of(2024, 1, 31, 8, 0));

        long shifted = CalendarDuration.parse("1mo").addTo(start, true);

        assertThat(CalendarDuration.toDateTime(shifted), is(LocalDateTime.of(2024, 2, 29, 8, 0)));
    }

    @Test
    void repeatedMonthsDoNotDrift() throws Exception {
        long start = CalendarDuration.fromDateTime(LocalDateTime.of(2024, 1, 31, 0, 0));

        long shifted = CalendarDuration.parse("1mo").addTo(start, 2, true);

        assertThat(CalendarDuration.toDateTime(shifted), is(LocalDateTime.of(2024, 3, 31, 0, 0)));
    }

    @Test
    void subtractsNegativeDurations() throws Exception {
        long start = CalendarDuration.fromDateTime(LocalDateTime.of(2024, 1, 1, 0, 0));

        long shifted = CalendarDuration.parse("-1d2h").addTo(start, true);

        assertThat(CalendarDuration.toDateTime(shifted), is(LocalDateTime.of(2023, 12, 30, 22, 0)));
    }

    @Test
    void truncatesToWindowBoundaries() throws Exception {
        long wednesday = CalendarDuration.fromDateTime(LocalDateTime.of(2024, 1, 3, 15, 30));

        assertThat(CalendarDuration.toDateTime(CalendarDuration.parse("1w").truncate(wednesday, true)),
            is(LocalDateTime.of(2024, 1, 1, 0, 0)));
        assertThat(CalendarDuration.toDateTime(CalendarDuration.parse("1d").truncate(wednesday, true)),
            is(LocalDateTime.of(2024, 1, 3, 0, 0)));
        assertThat(CalendarDuration.toDateTime(CalendarDuration.parse("1mo").truncate(wednesday, true)),
            is(LocalDateTime.of(2024, 1, 1, 0, 0)));
        assertThat(CalendarDuration.toDateTime(CalendarDuration.parse("1q").truncate(
                CalendarDuration.fromDateTime(LocalDateTime.of(2024, 5, 20, 0, 0)), true)),
            is(LocalDateTime.of(2024, 4, 1, 0, 0)));
        assertThat(CalendarDuration.parse("3i").truncate(7L, false), is(6L));
        assertThat(CalendarDuration.parse("3i").truncate(-1L, false), is(-3L));
    }

    @Test
    void negateFlipsSign() throws Exception {
        CalendarDuration duration = CalendarDuration.parse("3d");

        assertThat(duration.negate().toString(), is("-3d"));
        assertThat(duration.negate().negate(), is(duration));
    }
}
