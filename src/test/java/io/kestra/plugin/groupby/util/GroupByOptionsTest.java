package io.kestra.plugin.groupby.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;

class GroupByOptionsTest {
    @Test
    void parallelOnlyAboveThreshold() {
        GroupByOptions options = GroupByOptions.parallel(4, 100);

        assertThat(options.runsParallel(99), is(false));
        assertThat(options.runsParallel(100), is(true));
        assertThat(options.partitionCount(), is(4));
        assertThat(GroupByOptions.sequential().runsParallel(Integer.MAX_VALUE), is(false));
        assertThat(GroupByOptions.parallel(1, 1).runsParallel(10), is(false));
    }

    @Test
    void roundsPartitionsUpToPowersOfTwo() {
        assertThat(GroupByOptions.nextPowerOfTwo(0), is(1));
        assertThat(GroupByOptions.nextPowerOfTwo(3), is(4));
        assertThat(GroupByOptions.nextPowerOfTwo(8), is(8));
        assertThat(GroupByOptions.parallel(6, 1).partitionCount(), is(8));
    }

    @Test
    void readsSystemProperties() {
        System.setProperty(GroupByOptions.PARALLELISM_PROPERTY, "3");
        System.setProperty(GroupByOptions.THRESHOLD_PROPERTY, "50");
        try {
            GroupByOptions options = GroupByOptions.defaults();

            assertThat(options.parallelism(), is(3));
            assertThat(options.parallelThreshold(), is(50));
            assertThat(options.partitionCount(), is(4));
        } finally {
            System.clearProperty(GroupByOptions.PARALLELISM_PROPERTY);
            System.clearProperty(GroupByOptions.THRESHOLD_PROPERTY);
        }
        assertThat(GroupByOptions.defaults().parallelism(), greaterThanOrEqualTo(1));
    }

    @Test
    void rejectsInvalidSettings() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GroupByOptions(0, 1, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GroupByOptions(1, 0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GroupByOptions(1, 1, 3));

        System.setProperty(GroupByOptions.THRESHOLD_PROPERTY, "many");
        try {
            Assertions.assertThrows(IllegalArgumentException.class, GroupByOptions::defaults);
        } finally {
            System.clearProperty(GroupByOptions.THRESHOLD_PROPERTY);
        }
    }
}
