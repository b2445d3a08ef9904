package io.kestra.plugin.groupby.table;

import java.util.Objects;

/**
 * A column's logical type; list columns also carry the type of their elements.
 */
public record FieldType(DataType type, DataType elementType) {
    public FieldType {
        Objects.requireNonNull(type, "type is required");
        if (type == DataType.LIST && elementType == null) {
            elementType = DataType.NULL;
        }
        if (type != DataType.LIST) {
            elementType = null;
        }
    }

    public static FieldType of(DataType type) {
        return new FieldType(type, null);
    }

    public static FieldType listOf(DataType elementType) {
        return new FieldType(DataType.LIST, elementType);
    }

    public boolean isList() {
        return type == DataType.LIST;
    }

    @Override
    public String toString() {
        return isList() ? "LIST<" + elementType + ">" : type.name();
    }
}
