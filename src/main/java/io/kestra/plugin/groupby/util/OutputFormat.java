package io.kestra.plugin.groupby.util;

/**
 * Ion encoding used when writing tables.
 */
public enum OutputFormat {
    TEXT,
    BINARY
}
