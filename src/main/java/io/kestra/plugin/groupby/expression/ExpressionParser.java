package io.kestra.plugin.groupby.expression;

import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses the textual expression language into {@link Expr} trees.
 *
 * <pre>
 *   sum(amount)                 quantile(price, 0.9, "linear")
 *   count()                     alias(sum(amount) / count(), "avg_amount")
 *   n_unique(customer)          cast(code, "INT") % 10
 * </pre>
 */
public final class ExpressionParser {
    private static final ExpressionParser DEFAULT = new ExpressionParser();

    private final Map<String, Expr> cache = new ConcurrentHashMap<>();

    public static ExpressionParser standard() {
        return DEFAULT;
    }

    public Expr parse(String expression) throws GroupByException {
        if (expression == null || expression.isBlank()) {
            throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION, "Expression is required");
        }
        try {
            return cache.computeIfAbsent(expression, this::compile);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GroupByException(GroupByException.Kind.INVALID_EXPRESSION,
                "Invalid expression: " + expression + " (" + cause.getMessage() + ")", cause);
        }
    }

    private Expr compile(String expression) {
        try {
            Tokenizer tokenizer = new Tokenizer(expression);
            Parser parser = new Parser(tokenizer);
            return parser.parseExpression();
        } catch (SyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static final class SyntaxException extends Exception {
        private SyntaxException(String message) {
            super(message);
        }

        private SyntaxException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private enum TokenType {
        IDENT,
        NUMBER,
        STRING,
        LPAREN,
        RPAREN,
        COMMA,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        AND_AND,
        OR_OR,
        EQ_EQ,
        NOT_EQ,
        GT,
        GTE,
        LT,
        LTE,
        BANG,
        EOF
    }

    private record Token(TokenType type, String text) {
    }

    private static final class Tokenizer {
        private final String input;
        private int index;

        private Tokenizer(String input) {
            this.input = input;
        }

        Token next() throws SyntaxException {
            skipWhitespace();
            if (index >= input.length()) {
                return new Token(TokenType.EOF, "");
            }
            char current = input.charAt(index);
            if (Character.isLetter(current) || current == '_') {
                return readIdentifier();
            }
            if (Character.isDigit(current)) {
                return readNumber();
            }
            if (current == '"' || current == '\'') {
                return readString(current);
            }
            if (current == '&' && peek('&')) {
                index += 2;
                return new Token(TokenType.AND_AND, "&&");
            }
            if (current == '|' && peek('|')) {
                index += 2;
                return new Token(TokenType.OR_OR, "||");
            }
            if (current == '=' && peek('=')) {
                index += 2;
                return new Token(TokenType.EQ_EQ, "==");
            }
            if (current == '!' && peek('=')) {
                index += 2;
                return new Token(TokenType.NOT_EQ, "!=");
            }
            if (current == '>' && peek('=')) {
                index += 2;
                return new Token(TokenType.GTE, ">=");
            }
            if (current == '<' && peek('=')) {
                index += 2;
                return new Token(TokenType.LTE, "<=");
            }
            index++;
            return switch (current) {
                case '(' -> new Token(TokenType.LPAREN, "(");
                case ')' -> new Token(TokenType.RPAREN, ")");
                case ',' -> new Token(TokenType.COMMA, ",");
                case '+' -> new Token(TokenType.PLUS, "+");
                case '-' -> new Token(TokenType.MINUS, "-");
                case '*' -> new Token(TokenType.STAR, "*");
                case '/' -> new Token(TokenType.SLASH, "/");
                case '%' -> new Token(TokenType.PERCENT, "%");
                case '>' -> new Token(TokenType.GT, ">");
                case '<' -> new Token(TokenType.LT, "<");
                case '!' -> new Token(TokenType.BANG, "!");
                default -> throw new SyntaxException("Unexpected character: " + current);
            };
        }

        private Token readIdentifier() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (!Character.isLetterOrDigit(current) && current != '_') {
                    break;
                }
                index++;
            }
            return new Token(TokenType.IDENT, input.substring(start, index));
        }

        private Token readNumber() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (Character.isDigit(current) || current == '.') {
                    index++;
                    continue;
                }
                if (current == 'e' || current == 'E') {
                    index++;
                    if (index < input.length()) {
                        char sign = input.charAt(index);
                        if (sign == '+' || sign == '-') {
                            index++;
                        }
                    }
                    continue;
                }
                break;
            }
            return new Token(TokenType.NUMBER, input.substring(start, index));
        }

        private Token readString(char quote) throws SyntaxException {
            index++; // opening quote
            StringBuilder builder = new StringBuilder();
            while (index < input.length()) {
                char current = input.charAt(index);
                if (current == quote) {
                    index++;
                    return new Token(TokenType.STRING, builder.toString());
                }
                if (current == '\\') {
                    index++;
                    if (index >= input.length()) {
                        throw new SyntaxException("Unterminated string literal");
                    }
                    char escaped = input.charAt(index);
                    builder.append(switch (escaped) {
                        case '"', '\'', '\\', '/' -> escaped;
                        case 'n' -> '\n';
                        case 'r' -> '\r';
                        case 't' -> '\t';
                        default -> throw new SyntaxException("Invalid escape sequence: \\" + escaped);
                    });
                    index++;
                    continue;
                }
                builder.append(current);
                index++;
            }
            throw new SyntaxException("Unterminated string literal");
        }

        private boolean peek(char expected) {
            return index + 1 < input.length() && input.charAt(index + 1) == expected;
        }

        private void skipWhitespace() {
            while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
                index++;
            }
        }
    }

    private static final class Parser {
        private final Tokenizer tokenizer;
        private Token current;
        private Token previous;

        private Parser(Tokenizer tokenizer) throws SyntaxException {
            this.tokenizer = tokenizer;
            this.current = tokenizer.next();
        }

        Expr parseExpression() throws SyntaxException {
            Expr expr = parseOr();
            if (current.type() != TokenType.EOF) {
                throw new SyntaxException("Unexpected token: " + current.text());
            }
            return expr;
        }

        private Expr parseOr() throws SyntaxException {
            Expr expr = parseAnd();
            while (match(TokenType.OR_OR)) {
                expr = new Expr.Binary(Operator.OR_OR, expr, parseAnd());
            }
            return expr;
        }

        private Expr parseAnd() throws SyntaxException {
            Expr expr = parseEquality();
            while (match(TokenType.AND_AND)) {
                expr = new Expr.Binary(Operator.AND_AND, expr, parseEquality());
            }
            return expr;
        }

        private Expr parseEquality() throws SyntaxException {
            Expr expr = parseComparison();
            while (true) {
                if (match(TokenType.EQ_EQ)) {
                    expr = new Expr.Binary(Operator.EQ_EQ, expr, parseComparison());
                } else if (match(TokenType.NOT_EQ)) {
                    expr = new Expr.Binary(Operator.NOT_EQ, expr, parseComparison());
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseComparison() throws SyntaxException {
            Expr expr = parseTerm();
            while (true) {
                if (match(TokenType.GT)) {
                    expr = new Expr.Binary(Operator.GT, expr, parseTerm());
                } else if (match(TokenType.GTE)) {
                    expr = new Expr.Binary(Operator.GTE, expr, parseTerm());
                } else if (match(TokenType.LT)) {
                    expr = new Expr.Binary(Operator.LT, expr, parseTerm());
                } else if (match(TokenType.LTE)) {
                    expr = new Expr.Binary(Operator.LTE, expr, parseTerm());
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseTerm() throws SyntaxException {
            Expr expr = parseFactor();
            while (true) {
                if (match(TokenType.PLUS)) {
                    expr = new Expr.Binary(Operator.PLUS, expr, parseFactor());
                } else if (match(TokenType.MINUS)) {
                    expr = new Expr.Binary(Operator.MINUS, expr, parseFactor());
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseFactor() throws SyntaxException {
            Expr expr = parseUnary();
            while (true) {
                if (match(TokenType.STAR)) {
                    expr = new Expr.Binary(Operator.STAR, expr, parseUnary());
                } else if (match(TokenType.SLASH)) {
                    expr = new Expr.Binary(Operator.SLASH, expr, parseUnary());
                } else if (match(TokenType.PERCENT)) {
                    expr = new Expr.Binary(Operator.PERCENT, expr, parseUnary());
                } else {
                    break;
                }
            }
            return expr;
        }

        private Expr parseUnary() throws SyntaxException {
            if (match(TokenType.BANG)) {
                return new Expr.Binary(Operator.EQ_EQ, parseUnary(), Expr.lit(false));
            }
            if (match(TokenType.MINUS)) {
                Expr operand = parseUnary();
                if (operand instanceof Expr.Literal literal && literal.value() instanceof Long longValue) {
                    return Expr.lit(-longValue);
                }
                if (operand instanceof Expr.Literal literal && literal.value() instanceof Double doubleValue) {
                    return Expr.lit(-doubleValue);
                }
                return new Expr.Binary(Operator.MINUS, Expr.lit(0L), operand);
            }
            return parsePrimary();
        }

        private Expr parsePrimary() throws SyntaxException {
            if (match(TokenType.NUMBER)) {
                return parseNumber(previous.text());
            }
            if (match(TokenType.STRING)) {
                return Expr.lit(previous.text());
            }
            if (match(TokenType.IDENT)) {
                String ident = previous.text();
                if ("true".equalsIgnoreCase(ident)) {
                    return Expr.lit(true);
                }
                if ("false".equalsIgnoreCase(ident)) {
                    return Expr.lit(false);
                }
                if ("null".equalsIgnoreCase(ident)) {
                    return Expr.lit(null);
                }
                if (match(TokenType.LPAREN)) {
                    List<Expr> args = new ArrayList<>();
                    if (!check(TokenType.RPAREN)) {
                        do {
                            args.add(parseOr());
                        } while (match(TokenType.COMMA));
                    }
                    consume(TokenType.RPAREN, "Expected ')'");
                    return function(ident, args);
                }
                return Expr.col(ident);
            }
            if (match(TokenType.LPAREN)) {
                Expr expr = parseOr();
                consume(TokenType.RPAREN, "Expected ')'");
                return expr;
            }
            throw new SyntaxException("Unexpected token: " + (current.type() == TokenType.EOF ? "end of input" : current.text()));
        }

        private Expr function(String name, List<Expr> args) throws SyntaxException {
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "col" -> Expr.col(stringArgument(name, args, 0, 1));
                case "all" -> {
                    requireArgCount(name, args, 0);
                    yield Expr.all();
                }
                case "len" -> {
                    requireArgCount(name, args, 0);
                    yield Expr.len();
                }
                case "count" -> {
                    if (args.isEmpty()) {
                        yield Expr.len();
                    }
                    requireArgCount(name, args, 1);
                    yield args.get(0).count();
                }
                case "sum" -> single(name, args).sum();
                case "mean", "avg" -> single(name, args).mean();
                case "min" -> single(name, args).min();
                case "max" -> single(name, args).max();
                case "first" -> single(name, args).first();
                case "last" -> single(name, args).last();
                case "n_unique", "nunique" -> single(name, args).nUnique();
                case "median" -> single(name, args).median();
                case "list", "implode" -> single(name, args).list();
                case "quantile" -> quantile(args);
                case "cast" -> {
                    requireArgCount(name, args, 2);
                    String type = stringArgument(name, args, 1, 2);
                    try {
                        yield args.get(0).cast(DataType.valueOf(type.trim().toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new SyntaxException("Unknown type: " + type, e);
                    }
                }
                case "alias" -> {
                    requireArgCount(name, args, 2);
                    yield args.get(0).alias(stringArgument(name, args, 1, 2));
                }
                default -> throw new SyntaxException("Unknown function: " + name);
            };
        }

        private Expr quantile(List<Expr> args) throws SyntaxException {
            if (args.size() != 2 && args.size() != 3) {
                throw new SyntaxException("quantile expects 2 or 3 arguments, got " + args.size());
            }
            if (!(args.get(1) instanceof Expr.Literal literal) || !(literal.value() instanceof Number number)) {
                throw new SyntaxException("quantile expects a numeric quantile");
            }
            QuantileMethod method = QuantileMethod.NEAREST;
            if (args.size() == 3) {
                String raw = stringArgument("quantile", args, 2, 3);
                try {
                    method = QuantileMethod.from(raw);
                } catch (IllegalArgumentException e) {
                    throw new SyntaxException("Unknown interpolation: " + raw, e);
                }
            }
            return args.get(0).quantile(number.doubleValue(), method);
        }

        private Expr single(String name, List<Expr> args) throws SyntaxException {
            requireArgCount(name, args, 1);
            return args.get(0);
        }

        private String stringArgument(String name, List<Expr> args, int position, int expectedCount) throws SyntaxException {
            requireArgCount(name, args, expectedCount);
            if (args.get(position) instanceof Expr.Literal literal && literal.value() instanceof String text) {
                return text;
            }
            throw new SyntaxException(name + " expects a string literal at position " + (position + 1));
        }

        private void requireArgCount(String name, List<Expr> args, int expected) throws SyntaxException {
            if (args.size() != expected) {
                throw new SyntaxException(name + " expects " + expected + " arguments, got " + args.size());
            }
        }

        private Expr parseNumber(String raw) throws SyntaxException {
            try {
                if (raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
                    return Expr.lit(Long.parseLong(raw));
                }
                return Expr.lit(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new SyntaxException("Invalid number literal: " + raw, e);
            }
        }

        private boolean match(TokenType type) throws SyntaxException {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean check(TokenType type) {
            return current.type() == type;
        }

        private void advance() throws SyntaxException {
            previous = current;
            current = tokenizer.next();
        }

        private void consume(TokenType type, String message) throws SyntaxException {
            if (!match(type)) {
                throw new SyntaxException(message);
            }
        }
    }
}
