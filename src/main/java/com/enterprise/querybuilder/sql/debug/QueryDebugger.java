package com.enterprise.querybuilder.sql.debug;

import com.enterprise.querybuilder.sql.builder.QueryBuilder;

import java.util.Map;

/**
 * Debug utility: formats a {@link QueryBuilder} showing its dialect, the SQL with
 * placeholders unresolved, the SQL as built, and every placeholder value.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(QueryBuilder builder) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("Dialect: ").append(builder.databaseType()).append("\n");

        String template = builder.buildTemplate();
        sb.append("SQL (template):\n  ").append(template).append("\n");
        sb.append("SQL (built):\n  ").append(builder.build()).append("\n");

        Map<String, String> values = builder.placeholderValues();
        sb.append("Placeholders (").append(values.size()).append("):\n");
        for (Map.Entry<String, String> e : values.entrySet()) {
            sb.append("  ").append(e.getKey()).append(" = ").append(e.getValue());
            if (!template.contains(e.getKey())) {
                sb.append(" (unused)");
            }
            sb.append("\n");
        }
        sb.append("======================");
        return sb.toString();
    }
}
