package com.enterprise.querybuilder.sql.core;

/**
 * Per-dialect formatting rules used by the query builder.
 * Implementations live in {@link Dialects}.
 */
public interface SqlDialect {

    /** Wraps an identifier in the dialect's quote characters. */
    String quoteIdentifier(String identifier);

    /** Formats a date/time literal. No validation of the literal itself. */
    String dateTimeLiteral(String value);

    /**
     * Optimizer hint emitted right after {@code SELECT }, or an empty string
     * when the dialect places index hints after the table name.
     */
    String selectHint(String tableName, String indexName);

    /**
     * Index hint emitted right after the table name, or an empty string
     * when the dialect uses an inline optimizer hint.
     */
    String tableHint(String indexName);

    /**
     * Pagination suffix including its leading space, or an empty string.
     * A negative limit means no pagination.
     */
    String pagination(int limit, int offset);
}
