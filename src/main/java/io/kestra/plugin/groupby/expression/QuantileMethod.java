package io.kestra.plugin.groupby.expression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuantileMethod {
    NEAREST,
    LOWER,
    HIGHER,
    MIDPOINT,
    LINEAR;

    @JsonCreator
    public static QuantileMethod from(String value) {
        return QuantileMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
