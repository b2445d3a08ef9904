package io.kestra.plugin.groupby.engine;

import java.util.Arrays;

/**
 * Growable list of primitive row positions.
 */
final class IntList {
    private int[] values;
    private int size;

    IntList() {
        this(4);
    }

    IntList(int capacity) {
        this.values = new int[Math.max(1, capacity)];
    }

    void add(int value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, size << 1);
        }
        values[size++] = value;
    }

    void addAll(IntList other) {
        if (size + other.size > values.length) {
            values = Arrays.copyOf(values, Math.max(size + other.size, size << 1));
        }
        System.arraycopy(other.values, 0, values, size, other.size);
        size += other.size;
    }

    int first() {
        return values[0];
    }

    int size() {
        return size;
    }

    int[] toArray() {
        return Arrays.copyOf(values, size);
    }
}
