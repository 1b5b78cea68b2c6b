package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.builder.QueryBuilder;
import com.enterprise.querybuilder.sql.core.DatabaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Hands out {@link QueryBuilder} instances for the configured default dialect.
 *
 * <p>Every call returns a NEW builder. Builders accumulate state and are not
 * thread-safe, so never cache or share one.
 */
public class QueryBuilderFactory {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilderFactory.class);

    private final DatabaseType defaultDialect;

    public QueryBuilderFactory(DatabaseType defaultDialect) {
        this.defaultDialect = Objects.requireNonNull(defaultDialect, "defaultDialect must not be null");
        log.info("Query builder default dialect: {}", defaultDialect);
    }

    /**
     * Creates a factory from a dialect name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name matches no {@link DatabaseType}
     */
    public static QueryBuilderFactory forDialectName(String name) {
        for (DatabaseType type : DatabaseType.values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return new QueryBuilderFactory(type);
            }
        }
        throw new IllegalArgumentException("Unknown dialect: " + name
                + ", expected one of " + Arrays.toString(DatabaseType.values()));
    }

    public DatabaseType defaultDialect() {
        return defaultDialect;
    }

    public QueryBuilder create() {
        return new QueryBuilder(defaultDialect);
    }

    public QueryBuilder create(DatabaseType databaseType) {
        return new QueryBuilder(databaseType);
    }
}
