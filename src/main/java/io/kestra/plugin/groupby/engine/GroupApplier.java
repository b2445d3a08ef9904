package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands each group's sub-table to a {@link GroupCallback} and concatenates the returned tables in
 * group order. Callbacks run one at a time on the calling thread.
 */
public final class GroupApplier {
    private static final Logger logger = LoggerFactory.getLogger(GroupApplier.class);

    private GroupApplier() {
    }

    public static Table apply(Table source, GroupIndexTable groups, GroupCallback callback) throws GroupByException {
        List<Table> results = new ArrayList<>(groups.size());
        for (int g = 0; g < groups.size(); g++) {
            Table group = source.take(groups.rows(g));
            Table result;
            try {
                result = callback.apply(group);
            } catch (GroupByException e) {
                throw e;
            } catch (Exception e) {
                throw new GroupByException(GroupByException.Kind.CALLBACK_FAILED,
                    "Callback failed on group " + groups.key(g) + ": " + e.getMessage(), e);
            }
            if (result == null) {
                throw new GroupByException(GroupByException.Kind.CALLBACK_FAILED,
                    "Callback returned no table for group " + groups.key(g));
            }
            results.add(result);
        }
        logger.debug("Applied callback to {} groups", groups.size());
        return Table.concat(results);
    }
}
