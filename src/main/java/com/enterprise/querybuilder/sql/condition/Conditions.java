package com.enterprise.querybuilder.sql.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static factory for {@link ColumnValue} pairs. Designed to be imported statically.
 *
 * <pre>{@code
 * import static com.enterprise.querybuilder.sql.condition.Conditions.*;
 *
 * builder.where(eq("status", "'ACTIVE'"), eq("region", "'EU'"))
 *        .whereWithPlaceholder(eq("join_date", "?jd"))
 *        .setValue("?jd", "SYSDATE");
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    public static ColumnValue eq(String column, String value) {
        return new ColumnValue(column, value);
    }

    /** Converts a map into pairs in the map's iteration order. Use a LinkedHashMap to keep a defined order. */
    public static List<ColumnValue> fromMap(Map<String, String> columnValues) {
        List<ColumnValue> pairs = new ArrayList<>(columnValues.size());
        for (Map.Entry<String, String> e : columnValues.entrySet()) {
            pairs.add(eq(e.getKey(), e.getValue()));
        }
        return pairs;
    }
}
