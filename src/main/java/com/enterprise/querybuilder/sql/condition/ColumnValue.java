package com.enterprise.querybuilder.sql.condition;

import com.enterprise.querybuilder.sql.core.ReservedKeywords;
import com.enterprise.querybuilder.sql.core.SqlDialect;

import java.util.Objects;

/**
 * An equality predicate {@code column = value}. The value is literal SQL text
 * (a quoted string, a number, a function call or a placeholder token) and is
 * never escaped.
 */
public record ColumnValue(String column, String value) {

    public ColumnValue {
        Objects.requireNonNull(column, "Column must not be null");
        Objects.requireNonNull(value, "Value for " + column + " is null");
    }

    /** Renders the fragment with the value used verbatim. */
    public String toSql(SqlDialect dialect) {
        return ReservedKeywords.escape(column, dialect) + " = " + value;
    }

    /** Renders the fragment with the value formatted as a date/time literal. */
    public String toDateTimeSql(SqlDialect dialect) {
        return ReservedKeywords.escape(column, dialect) + " = " + dialect.dateTimeLiteral(value);
    }
}
