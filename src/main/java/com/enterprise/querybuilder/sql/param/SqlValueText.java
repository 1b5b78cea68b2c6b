package com.enterprise.querybuilder.sql.param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Canonical text for values substituted into placeholder tokens.
 * The text is inserted into the SQL verbatim: strings are NOT quoted,
 * so {@code "SYSDATE"} stays a function call and {@code "'ACTIVE'"} a literal.
 *
 * <p>Types without a canonical form are rejected; pass an explicit converter to
 * {@link com.enterprise.querybuilder.sql.builder.QueryBuilder#setValue(String, Object, java.util.function.Function)}
 * instead.
 */
public final class SqlValueText {

    private SqlValueText() {}

    // Same layout as the Oracle mask YYYY-MM-DD HH24:MI:SS
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Converts a value to its canonical SQL text.
     *
     * @throws NullPointerException     if value is null
     * @throws IllegalArgumentException if the type is not supported
     */
    public static String toText(Object value) {
        Objects.requireNonNull(value, "placeholder value must not be null");

        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof LocalDateTime ldt) {
            return DATE_TIME.format(ldt);
        }
        if (value instanceof LocalDate ld) {
            return ld.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }

        throw new IllegalArgumentException(
                "Unsupported value type: " + value.getClass().getName());
    }
}
