package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Table;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-pass cursor over the groups of one grouping.
 *
 * <p>{@link #open()} materializes the complete {@link GroupIndexTable} before the first group is
 * produced. Each {@link #next()} gathers the rows of the group under the cursor into a sub-table
 * and advances. Once every group has been produced the iterator is exhausted; {@link #reset()}
 * returns it to the uninitialized state so that it can be opened again.</p>
 */
public final class GroupIterator implements Iterator<Group> {
    public enum State {
        UNINITIALIZED,
        READY,
        EXHAUSTED
    }

    @FunctionalInterface
    public interface GroupIndexSource {
        GroupIndexTable materialize() throws GroupByException;
    }

    private final Table source;
    private final GroupIndexSource groupIndexSource;
    private GroupIndexTable groups;
    private int cursor;
    private State state = State.UNINITIALIZED;

    public GroupIterator(Table source, GroupIndexSource groupIndexSource) {
        this.source = source;
        this.groupIndexSource = groupIndexSource;
    }

    public GroupIterator open() throws GroupByException {
        if (state != State.UNINITIALIZED) {
            throw new IllegalStateException("Iterator is already open, reset it first");
        }
        groups = groupIndexSource.materialize();
        cursor = 0;
        state = groups.size() == 0 ? State.EXHAUSTED : State.READY;
        return this;
    }

    public void reset() {
        groups = null;
        cursor = 0;
        state = State.UNINITIALIZED;
    }

    public State state() {
        return state;
    }

    /**
     * Number of groups, available once opened.
     */
    public int groupCount() {
        requireOpened();
        return groups.size();
    }

    @Override
    public boolean hasNext() {
        requireOpened();
        return state == State.READY;
    }

    @Override
    public Group next() {
        requireOpened();
        if (state == State.EXHAUSTED) {
            throw new NoSuchElementException("All " + groups.size() + " groups have been produced");
        }
        Group group = new Group(groups.key(cursor), source.take(groups.rows(cursor)));
        cursor++;
        if (cursor >= groups.size()) {
            state = State.EXHAUSTED;
        }
        return group;
    }

    private void requireOpened() {
        if (state == State.UNINITIALIZED) {
            throw new IllegalStateException("Iterator has not been opened");
        }
    }
}
