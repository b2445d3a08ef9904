package io.kestra.plugin.groupby.table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Logical type of a column. Each type fixes the Java class its non-null cells hold.
 */
public enum DataType {
    INT(Long.class),
    FLOAT(Double.class),
    DECIMAL(BigDecimal.class),
    BOOLEAN(Boolean.class),
    STRING(String.class),
    DATE(LocalDate.class),
    DATETIME(LocalDateTime.class),
    LIST(List.class),
    NULL(Void.class);

    private final Class<?> javaType;

    DataType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /**
     * Whether values of this type have a total order usable by min/max and sortedness checks.
     */
    public boolean isOrdered() {
        return this != LIST;
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        if (this == NULL) {
            return false;
        }
        return javaType.isInstance(value);
    }
}
