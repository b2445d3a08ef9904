package io.kestra.plugin.groupby.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.kestra.plugin.groupby.Aggregate;
import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.GroupByRequest;
import io.kestra.plugin.groupby.expression.Expr;
import io.kestra.plugin.groupby.expression.ExprDeserializer;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads grouping requests and aggregate documents from JSON or YAML.
 */
public final class RequestMapper {
    private static final ObjectMapper JSON = configure(JsonMapper.builder());
    private static final ObjectMapper YAML = configure(YAMLMapper.builder());

    private RequestMapper() {
    }

    public static ObjectMapper json() {
        return JSON;
    }

    public static ObjectMapper yaml() {
        return YAML;
    }

    public static GroupByRequest readRequest(String yamlOrJson) throws GroupByException {
        return read(yamlOrJson, GroupByRequest.class);
    }

    public static Aggregate readAggregate(String yamlOrJson) throws GroupByException {
        return read(yamlOrJson, Aggregate.class);
    }

    public static Aggregate readAggregate(InputStream inputStream) throws GroupByException, IOException {
        try {
            return YAML.readValue(inputStream, Aggregate.class);
        } catch (JsonProcessingException e) {
            throw translate(e);
        }
    }

    /**
     * YAML is a superset of JSON, so one reader serves both.
     */
    private static <T> T read(String content, Class<T> type) throws GroupByException {
        try {
            return YAML.readValue(content, type);
        } catch (JsonProcessingException e) {
            throw translate(e);
        }
    }

    /**
     * Surfaces the engine error behind a mapping failure (a bad duration, anchoring rule or
     * expression), else reports the document itself as malformed.
     */
    static GroupByException translate(JsonProcessingException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof GroupByException groupByException) {
                return new GroupByException(groupByException.getKind(), groupByException.getMessage(), e);
            }
        }
        return new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
            "Invalid request document: " + e.getOriginalMessage(), e);
    }

    private static <M extends ObjectMapper, B extends MapperBuilder<M, B>> M configure(B builder) {
        SimpleModule module = new SimpleModule("groupby");
        module.addDeserializer(Expr.class, new ExprDeserializer());
        module.addSerializer(Expr.class, ToStringSerializer.instance);
        return builder
            .addModule(module)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    }
}
