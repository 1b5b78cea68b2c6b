package com.enterprise.querybuilder.sql.param;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values for caller-chosen placeholder tokens, resolved by plain text replacement.
 *
 * <p>Each token replaces only its FIRST occurrence in the text, and tokens are
 * applied in the order they were first set. A token that is a substring of other
 * text (a column name, another token) is replaced there as well: pick tokens that
 * cannot occur elsewhere, e.g. {@code ?join_date} rather than {@code date}.
 */
public class PlaceholderValues {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderValues.class);

    private final Map<String, String> values = new LinkedHashMap<>();

    /** Stores the text for a token, overwriting any earlier value. */
    public void put(String token, String text) {
        values.put(token, text);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Replaces the first occurrence of every token in {@code text}. */
    public String substitute(String text) {
        String result = text;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String token = entry.getKey();
            int pos = result.indexOf(token);
            if (pos < 0) {
                log.debug("Placeholder {} not found in: {}", token, result);
                continue;
            }
            result = result.substring(0, pos) + entry.getValue() + result.substring(pos + token.length());
        }
        return result;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
