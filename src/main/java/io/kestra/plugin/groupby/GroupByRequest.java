package io.kestra.plugin.groupby;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.kestra.plugin.groupby.engine.GroupByContext;
import io.kestra.plugin.groupby.engine.GroupIndexMaterializer;
import io.kestra.plugin.groupby.engine.GroupIndexTable;
import io.kestra.plugin.groupby.table.Table;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A grouping to evaluate against a table. Declarative documents select the mode with the
 * {@code type} property.
 */
@SuperBuilder
@ToString
@Getter
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = KeyGroupBy.class, name = "keys"),
    @JsonSubTypes.Type(value = RollingGroupBy.class, name = "rolling"),
    @JsonSubTypes.Type(value = DynamicGroupBy.class, name = "dynamic")
})
@Schema(
    title = "Grouping request",
    description = "Groups rows by keys (`keys`), by a window anchored at each row (`rolling`) or by fixed-cadence windows (`dynamic`)."
)
public abstract class GroupByRequest {
    /**
     * Checks everything that can be checked without partitioning: referenced columns, durations
     * and anchoring rules.
     */
    public abstract void validate(Table table, GroupByContext context) throws GroupByException;

    public abstract GroupIndexTable materialize(Table table, GroupIndexMaterializer materializer) throws GroupByException;

    /**
     * Whether group sub-tables can be handed to a callback, which requires keys that are plain
     * column names.
     */
    public boolean supportsApply() {
        return false;
    }
}
