package io.kestra.plugin.groupby.ion;

import com.amazon.ion.IonDatagram;
import com.amazon.ion.IonException;
import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonBinaryWriterBuilder;
import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.DataType;
import io.kestra.plugin.groupby.table.FieldType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads tables from Ion records and writes them back, one struct per row.
 *
 * <p>Input is either a stream of top-level structs or a single list of structs. Column order
 * follows first appearance of each field; a field missing from a record is null. Column types
 * are inferred from non-null values and must agree across records.</p>
 */
public final class IonTables {
    private static final Logger logger = LoggerFactory.getLogger(IonTables.class);

    private IonTables() {
    }

    public static Table read(String ion) throws GroupByException {
        try {
            return read(IonValueUtils.system().getLoader().load(ion));
        } catch (IonException e) {
            throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid Ion input: " + e.getMessage(), e);
        }
    }

    public static Table read(InputStream inputStream) throws GroupByException, IOException {
        try {
            return read(IonValueUtils.system().getLoader().load(inputStream));
        } catch (IonException e) {
            throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH, "Invalid Ion input: " + e.getMessage(), e);
        }
    }

    public static Table read(IonValue value) throws GroupByException {
        List<IonStruct> structs = new ArrayList<>();
        collect(value, structs);

        List<Map<String, Object>> records = new ArrayList<>(structs.size());
        Map<String, FieldType> schema = new LinkedHashMap<>();
        for (IonStruct struct : structs) {
            Map<String, Object> record = IonValueUtils.toRecord(struct);
            for (Map.Entry<String, Object> entry : record.entrySet()) {
                FieldType inferred = infer(entry.getKey(), entry.getValue());
                FieldType known = schema.get(entry.getKey());
                schema.put(entry.getKey(), known == null ? inferred : merge(entry.getKey(), known, inferred));
            }
            records.add(record);
        }

        List<Column> columns = new ArrayList<>(schema.size());
        for (Map.Entry<String, FieldType> field : schema.entrySet()) {
            Object[] values = new Object[records.size()];
            for (int row = 0; row < values.length; row++) {
                values[row] = records.get(row).get(field.getKey());
            }
            columns.add(new Column(field.getKey(), field.getValue(), values));
        }
        logger.debug("Read {} Ion records into {} columns", records.size(), columns.size());
        return new Table(columns);
    }

    /**
     * Writes every row as a struct. The stream is flushed but left open.
     */
    public static void write(Table table, OutputStream outputStream, OutputFormat format) throws IOException {
        IonWriter writer = createWriter(outputStream, format);
        for (Map<String, Object> record : table.toRecords()) {
            IonValueUtils.toIonValue(record).writeTo(writer);
            if (format == OutputFormat.TEXT) {
                writer.flush();
                outputStream.write('\n');
            }
        }
        writer.finish();
        outputStream.flush();
    }

    static IonWriter createWriter(OutputStream outputStream, OutputFormat format) {
        if (format == OutputFormat.BINARY) {
            return IonBinaryWriterBuilder.standard().build(outputStream);
        }
        return IonValueUtils.system().newTextWriter(outputStream);
    }

    private static void collect(IonValue value, List<IonStruct> structs) throws GroupByException {
        if (IonValueUtils.isNull(value)) {
            return;
        }
        if (value instanceof IonDatagram datagram) {
            if (datagram.size() == 1 && datagram.get(0) instanceof IonList list) {
                collect(list, structs);
                return;
            }
            for (IonValue child : datagram) {
                structs.add(asStruct(child));
            }
            return;
        }
        if (value instanceof IonList list) {
            for (IonValue child : list) {
                structs.add(asStruct(child));
            }
            return;
        }
        structs.add(asStruct(value));
    }

    private static IonStruct asStruct(IonValue value) throws GroupByException {
        if (value instanceof IonStruct struct) {
            return struct;
        }
        throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Expected struct record, got " + (value == null ? "null" : value.getType()));
    }

    private static FieldType infer(String field, Object value) throws GroupByException {
        if (value instanceof List<?> list) {
            DataType element = DataType.NULL;
            for (Object item : list) {
                DataType itemType = scalarType(field, item);
                if (element == DataType.NULL) {
                    element = itemType;
                } else if (itemType != DataType.NULL && itemType != element) {
                    throw conflict(field, FieldType.listOf(element), FieldType.listOf(itemType));
                }
            }
            return FieldType.listOf(element);
        }
        return FieldType.of(scalarType(field, value));
    }

    private static DataType scalarType(String field, Object value) throws GroupByException {
        if (value == null) {
            return DataType.NULL;
        }
        if (value instanceof Long) {
            return DataType.INT;
        }
        if (value instanceof Double) {
            return DataType.FLOAT;
        }
        if (value instanceof BigDecimal) {
            return DataType.DECIMAL;
        }
        if (value instanceof Boolean) {
            return DataType.BOOLEAN;
        }
        if (value instanceof String) {
            return DataType.STRING;
        }
        if (value instanceof LocalDate) {
            return DataType.DATE;
        }
        if (value instanceof LocalDateTime) {
            return DataType.DATETIME;
        }
        throw new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Field '" + field + "' holds an unsupported nested value");
    }

    private static FieldType merge(String field, FieldType known, FieldType inferred) throws GroupByException {
        if (known.equals(inferred) || inferred.type() == DataType.NULL) {
            return known;
        }
        if (known.type() == DataType.NULL) {
            return inferred;
        }
        if (known.isList() && inferred.isList()) {
            if (inferred.elementType() == DataType.NULL) {
                return known;
            }
            if (known.elementType() == DataType.NULL) {
                return inferred;
            }
        }
        throw conflict(field, known, inferred);
    }

    private static GroupByException conflict(String field, FieldType known, FieldType inferred) {
        return new GroupByException(GroupByException.Kind.TYPE_MISMATCH,
            "Field '" + field + "' mixes " + known + " and " + inferred + " values");
    }
}
