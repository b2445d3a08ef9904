package io.kestra.plugin.groupby;

public class GroupByException extends Exception {
    private final Kind kind;

    public GroupByException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GroupByException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        INVALID_GROUPING_KEY,
        TYPE_MISMATCH,
        UNSORTED_INDEX,
        INVALID_DURATION,
        INVALID_START_BY,
        UNKNOWN_COLUMN,
        AGGREGATION_TYPE_ERROR,
        CALLBACK_SIGNATURE_ERROR,
        CALLBACK_FAILED,
        INVALID_EXPRESSION,
        DUPLICATE_COLUMN
    }
}
