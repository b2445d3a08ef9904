package io.kestra.plugin.groupby.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonText;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import com.amazon.ion.system.IonSystemBuilder;
import io.kestra.plugin.groupby.GroupByException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Ion values and table cells. Dates are day-precision timestamps, date-times
 * are UTC timestamps.
 */
public final class IonValueUtils {
    private static final IonSystem SYSTEM = IonSystemBuilder.standard().build();
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private IonValueUtils() {
    }

    public static IonSystem system() {
        return SYSTEM;
    }

    public static boolean isNull(IonValue value) {
        return value == null || value.isNullValue();
    }

    public static IonValue nullValue() {
        return SYSTEM.newNull();
    }

    public static IonValue toIonValue(Object value) {
        if (value == null) {
            return nullValue();
        }
        if (value instanceof IonValue ionValue) {
            return ionValue;
        }
        if (value instanceof String stringValue) {
            return SYSTEM.newString(stringValue);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return SYSTEM.newInt(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return SYSTEM.newFloat(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return SYSTEM.newDecimal(decimal);
        }
        if (value instanceof Boolean bool) {
            return SYSTEM.newBool(bool);
        }
        if (value instanceof LocalDate date) {
            return SYSTEM.newTimestamp(Timestamp.forDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
        }
        if (value instanceof LocalDateTime dateTime) {
            return SYSTEM.newTimestamp(toTimestamp(dateTime));
        }
        if (value instanceof Map<?, ?> map) {
            IonStruct struct = SYSTEM.newEmptyStruct();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                struct.put(String.valueOf(entry.getKey()), toIonValue(entry.getValue()));
            }
            return struct;
        }
        if (value instanceof List<?> list) {
            IonList ionList = SYSTEM.newEmptyList();
            for (Object element : list) {
                ionList.add(toIonValue(element));
            }
            return ionList;
        }
        return SYSTEM.newString(String.valueOf(value));
    }

    /**
     * Cell value of an Ion scalar or list. Structs inside a cell are not representable and fail
     * with {@code TYPE_MISMATCH}.
     */
    public static Object toJavaValue(IonValue value) throws GroupByException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonList ionList) {
            List<Object> list = new ArrayList<>(ionList.size());
            for (IonValue child : ionList) {
                list.add(toJavaValue(child));
            }
            return list;
        }
        if (value instanceof IonText ionText) {
            return ionText.stringValue();
        }
        if (value instanceof IonInt ionInt) {
            try {
                return ionInt.bigIntegerValue().longValueExact();
            } catch (ArithmeticException e) {
                throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Integer out of range: " + ionInt, e);
            }
        }
        if (value instanceof IonFloat ionFloat) {
            return ionFloat.doubleValue();
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue();
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return fromTimestamp(ionTimestamp.timestampValue());
        }
        throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Unsupported Ion value of type " + value.getType() + " in a table cell");
    }

    /**
     * A struct as an insertion-ordered map of cell values.
     */
    public static Map<String, Object> toRecord(IonStruct struct) throws GroupByException {
        Map<String, Object> record = new LinkedHashMap<>();
        for (IonValue child : struct) {
            record.put(child.getFieldName(), toJavaValue(child));
        }
        return record;
    }

    static Timestamp toTimestamp(LocalDateTime dateTime) {
        BigDecimal seconds = BigDecimal.valueOf(dateTime.getSecond());
        if (dateTime.getNano() != 0) {
            seconds = seconds.add(BigDecimal.valueOf(dateTime.getNano(), 9));
        }
        return Timestamp.forSecond(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
            dateTime.getHour(), dateTime.getMinute(), seconds, 0);
    }

    static Object fromTimestamp(Timestamp timestamp) {
        Timestamp.Precision precision = timestamp.getPrecision();
        if (precision == Timestamp.Precision.YEAR
            || precision == Timestamp.Precision.MONTH
            || precision == Timestamp.Precision.DAY) {
            return LocalDate.of(timestamp.getYear(), timestamp.getMonth(), timestamp.getDay());
        }
        long epochNanos = timestamp.getDecimalMillis().movePointRight(6).longValue();
        return LocalDateTime.ofEpochSecond(
            Math.floorDiv(epochNanos, NANOS_PER_SECOND),
            (int) Math.floorMod(epochNanos, NANOS_PER_SECOND),
            ZoneOffset.UTC);
    }
}
