package io.kestra.plugin.groupby.expression;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.kestra.plugin.groupby.GroupByException;

import java.io.IOException;

/**
 * Reads an {@link Expr} written in the expression language. A bare name such as {@code amount}
 * is a column reference.
 */
public class ExprDeserializer extends StdDeserializer<Expr> {
    private final ExpressionParser parser;

    public ExprDeserializer() {
        this(ExpressionParser.standard());
    }

    public ExprDeserializer(ExpressionParser parser) {
        super(Expr.class);
        this.parser = parser;
    }

    @Override
    public Expr deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.currentToken().isScalarValue() || p.currentToken() == JsonToken.VALUE_NULL) {
            return (Expr) ctxt.handleUnexpectedToken(Expr.class, p);
        }
        String text = p.getValueAsString();
        try {
            return parser.parse(text);
        } catch (GroupByException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
