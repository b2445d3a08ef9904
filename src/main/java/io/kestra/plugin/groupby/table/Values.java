package io.kestra.plugin.groupby.table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cell-level helpers shared by columns, partitioning and reductions.
 */
public final class Values {
    private Values() {
    }

    /**
     * Coerces a Java value into the canonical class for {@code type}, or returns it unchanged
     * when no coercion applies. Validation happens afterwards against {@link DataType#accepts}.
     */
    public static Object normalize(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case INT -> value instanceof Integer || value instanceof Short || value instanceof Byte
                ? Long.valueOf(((Number) value).longValue())
                : value;
            case FLOAT -> value instanceof Float floatValue ? Double.valueOf(floatValue.doubleValue()) : value;
            case DECIMAL -> value instanceof BigInteger bigInteger ? new BigDecimal(bigInteger) : value;
            case LIST -> value instanceof List<?> list ? Collections.unmodifiableList(new ArrayList<>(list)) : value;
            default -> value;
        };
    }

    /**
     * Total order over non-null cells of one ordered type. Nulls sort first.
     */
    public static int compare(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left instanceof Long leftLong && right instanceof Long rightLong) {
            return Long.compare(leftLong, rightLong);
        }
        if (left instanceof Double leftDouble && right instanceof Double rightDouble) {
            return Double.compare(leftDouble, rightDouble);
        }
        if (left instanceof BigDecimal leftDecimal && right instanceof BigDecimal rightDecimal) {
            return leftDecimal.compareTo(rightDecimal);
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            return toDecimal(leftNumber).compareTo(toDecimal(rightNumber));
        }
        if (left instanceof String leftString && right instanceof String rightString) {
            return leftString.compareTo(rightString);
        }
        if (left instanceof Boolean leftBoolean && right instanceof Boolean rightBoolean) {
            return Boolean.compare(leftBoolean, rightBoolean);
        }
        if (left instanceof LocalDate leftDate && right instanceof LocalDate rightDate) {
            return leftDate.compareTo(rightDate);
        }
        if (left instanceof LocalDateTime leftDateTime && right instanceof LocalDateTime rightDateTime) {
            return leftDateTime.compareTo(rightDateTime);
        }
        throw new IllegalArgumentException("Values are not comparable: " + left.getClass().getSimpleName()
            + " and " + right.getClass().getSimpleName());
    }

    /**
     * Equality-normalized form of a cell, used when hashing group keys: {@code -0.0} and
     * {@code 0.0} collapse, all NaNs collapse and decimals compare by numeric value.
     */
    public static Object keyOf(Object value) {
        if (value instanceof Double doubleValue) {
            if (doubleValue.isNaN()) {
                return Double.NaN;
            }
            return doubleValue == 0.0d ? 0.0d : doubleValue;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object element : list) {
                normalized.add(keyOf(element));
            }
            return normalized;
        }
        return value;
    }

    public static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String string) {
            return "\"" + string + "\"";
        }
        if (value instanceof LocalDate || value instanceof LocalDateTime) {
            return value.toString();
        }
        return String.valueOf(value);
    }
}
