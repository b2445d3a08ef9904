package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Values;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

public final class ColumnCaster {
    public Column cast(Column column, DataType targetType) throws GroupByException {
        if (column.type() == targetType) {
            return column;
        }
        Object[] values = new Object[column.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = cast(column.get(i), targetType);
        }
        return new Column(column.name(), FieldType.of(targetType), values);
    }

    public Object cast(Object value, DataType targetType) throws GroupByException {
        if (value == null) {
            return null;
        }

        return switch (targetType) {
            case STRING -> asString(value);
            case INT -> castInt(value);
            case FLOAT -> castFloat(value);
            case DECIMAL -> castDecimal(value);
            case BOOLEAN -> castBoolean(value);
            case DATE -> castDate(value);
            case DATETIME -> castDateTime(value);
            case LIST -> {
                if (!(value instanceof List<?>)) {
                    throw mismatch(value, targetType);
                }
                yield value;
            }
            case NULL -> throw mismatch(value, targetType);
        };
    }

    private String asString(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private Long castInt(Object value) throws GroupByException {
        if (value instanceof Long longValue) {
            return longValue;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        BigDecimal decimal = asDecimal(value, DataType.INT);
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                "Expected integer value, got " + decimal.toPlainString(), e);
        }
    }

    private Double castFloat(Object value) throws GroupByException {
        if (value instanceof Double doubleValue) {
            return doubleValue;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1.0d : 0.0d;
        }
        if (value instanceof String string) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid float: " + string, e);
            }
        }
        return asDecimal(value, DataType.FLOAT).doubleValue();
    }

    private BigDecimal castDecimal(Object value) throws GroupByException {
        if (value instanceof Boolean bool) {
            return bool ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return asDecimal(value, DataType.DECIMAL);
    }

    private Boolean castBoolean(Object value) throws GroupByException {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return Values.toDecimal(number).signum() != 0;
        }
        if (value instanceof String string) {
            if ("true".equalsIgnoreCase(string.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(string.trim())) {
                return false;
            }
        }
        throw mismatch(value, DataType.BOOLEAN);
    }

    private LocalDate castDate(Object value) throws GroupByException {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof String string) {
            try {
                return LocalDate.parse(string.trim());
            } catch (DateTimeParseException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid date: " + string, e);
            }
        }
        throw mismatch(value, DataType.DATE);
    }

    private LocalDateTime castDateTime(Object value) throws GroupByException {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (value instanceof String string) {
            String trimmed = string.trim();
            try {
                if (trimmed.length() == 10) {
                    return LocalDate.parse(trimmed).atStartOfDay();
                }
                return LocalDateTime.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid datetime: " + string, e);
            }
        }
        throw mismatch(value, DataType.DATETIME);
    }

    private BigDecimal asDecimal(Object value, DataType targetType) throws GroupByException {
        if (value instanceof Double doubleValue && (doubleValue.isNaN() || doubleValue.isInfinite())) {
            throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
                "Cannot cast " + doubleValue + " to " + targetType);
        }
        if (value instanceof Number number) {
            return Values.toDecimal(number);
        }
        if (value instanceof String string) {
            try {
                return new BigDecimal(string.trim());
            } catch (NumberFormatException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid decimal: " + string, e);
            }
        }
        throw mismatch(value, targetType);
    }

    private GroupByException mismatch(Object value, DataType targetType) {
        return new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Cannot cast " + value.getClass().getSimpleName() + " value '" + value + "' to " + targetType);
    }
}
