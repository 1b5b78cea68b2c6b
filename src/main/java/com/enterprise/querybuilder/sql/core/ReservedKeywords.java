package com.enterprise.querybuilder.sql.core;

import java.util.Set;

/**
 * Identifiers that collide with SQL grammar and must be quoted when used as
 * column names. Matching is exact and case-sensitive: {@code "date"} and
 * {@code "ORDER_ID"} pass through unquoted.
 */
public final class ReservedKeywords {

    private ReservedKeywords() {}

    private static final Set<String> KEYWORDS = Set.of("DATE", "USER", "ORDER", "GROUP", "INDEX");

    public static boolean isReserved(String identifier) {
        return identifier != null && KEYWORDS.contains(identifier);
    }

    /** Quotes the identifier with the dialect's quote characters if it is reserved. */
    public static String escape(String identifier, SqlDialect dialect) {
        return isReserved(identifier) ? dialect.quoteIdentifier(identifier) : identifier;
    }

    public static Set<String> all() {
        return KEYWORDS;
    }
}
