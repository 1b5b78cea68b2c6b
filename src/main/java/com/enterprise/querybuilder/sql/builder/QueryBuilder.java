package com.enterprise.querybuilder.sql.builder;

import com.enterprise.querybuilder.sql.condition.ColumnValue;
import com.enterprise.querybuilder.sql.core.*;
import com.enterprise.querybuilder.sql.param.PlaceholderValues;
import com.enterprise.querybuilder.sql.param.SqlValueText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent builder for {@code SELECT} statements rendered for a fixed {@link DatabaseType}.
 *
 * <p>Clause fragments are rendered as soon as they are added; only placeholder
 * substitution is deferred to {@link #build()}. Nothing is validated: a missing
 * table renders as {@code FROM } and unresolved placeholders stay in the text.
 *
 * <p>Dialect differences:
 * <ul>
 *   <li>Reserved column names ({@link ReservedKeywords}) are quoted with back-ticks
 *       on MariaDB and double quotes on Oracle</li>
 *   <li>{@link #useIndex(String)} renders {@code FORCE INDEX(..)} after the table on
 *       MariaDB and an inline optimizer hint right after {@code SELECT} on Oracle</li>
 *   <li>Date/time values render as quoted strings on MariaDB and
 *       {@code TO_TIMESTAMP(..)} on Oracle</li>
 *   <li>Pagination renders {@code LIMIT/OFFSET} on MariaDB and
 *       {@code FETCH FIRST n ROWS ONLY} on Oracle, which never emits an offset</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * import static com.enterprise.querybuilder.sql.condition.Conditions.*;
 *
 * String sql = QueryBuilder.forDialect(DatabaseType.MARIADB)
 *     .select("id", "name", "DATE")
 *     .distinct()
 *     .from("users")
 *     .useIndex("idx_users_name")
 *     .whereWithPlaceholder(eq("join_date", "?joindate"))
 *     .setValue("?joindate", "SYSDATE")
 *     .innerJoin("orders", "users.id = orders.user_id")
 *     .orderBy("name")
 *     .limit(10)
 *     .offset(5)
 *     .build();
 * }</pre>
 *
 * <p>Not thread-safe. Use one instance per query.
 */
public class QueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    private final DatabaseType databaseType;
    private final SqlDialect dialect;

    // SELECT
    private final List<String> selectedColumns = new ArrayList<>();
    private boolean distinct;

    // FROM
    private String tableName = "";
    private boolean tableSet;

    // JOINs
    private final List<String> joinClauses = new ArrayList<>();

    // WHERE
    private final List<String> whereClauses = new ArrayList<>();
    private final PlaceholderValues placeholderValues = new PlaceholderValues();

    // ORDER BY / index hint, last call wins
    private String orderByClause;
    private String indexHint;

    // Negative limit means no pagination; offset is emitted only when > 0
    private int limitValue = -1;
    private int offsetValue = -1;

    public QueryBuilder(DatabaseType databaseType) {
        this.databaseType = Objects.requireNonNull(databaseType, "databaseType must not be null");
        this.dialect = databaseType.dialect();
    }

    public static QueryBuilder forDialect(DatabaseType databaseType) {
        return new QueryBuilder(databaseType);
    }

    public DatabaseType databaseType() {
        return databaseType;
    }

    // ==================== SELECT ====================

    /** Appends columns; repeated calls accumulate. Reserved names are quoted. */
    public QueryBuilder select(String... columns) {
        return select(Arrays.asList(columns));
    }

    public QueryBuilder select(List<String> columns) {
        for (String column : columns) {
            selectedColumns.add(ReservedKeywords.escape(column, dialect));
        }
        return this;
    }

    public QueryBuilder distinct() {
        this.distinct = true;
        return this;
    }

    // ==================== FROM ====================

    /** Sets the table name verbatim, replacing any earlier one. */
    public QueryBuilder from(String tableName) {
        this.tableName = tableName;
        this.tableSet = true;
        return this;
    }

    /** Sets the index hint verbatim, replacing any earlier one. */
    public QueryBuilder useIndex(String indexName) {
        this.indexHint = indexName;
        return this;
    }

    // ==================== JOIN ====================

    /** Both arguments are used verbatim. */
    public QueryBuilder innerJoin(String table, String onCondition) {
        joinClauses.add("INNER JOIN " + table + " ON " + onCondition);
        return this;
    }

    // ==================== WHERE ====================

    public QueryBuilder where(ColumnValue... conditions) {
        return where(Arrays.asList(conditions), false);
    }

    public QueryBuilder where(List<ColumnValue> conditions) {
        return where(conditions, false);
    }

    /**
     * Adds {@code column = value} conditions, combined with AND.
     * With {@code dateTime} set, values are rendered as dialect date/time literals.
     */
    public QueryBuilder where(List<ColumnValue> conditions, boolean dateTime) {
        for (ColumnValue condition : conditions) {
            whereClauses.add(dateTime ? condition.toDateTimeSql(dialect) : condition.toSql(dialect));
        }
        return this;
    }

    public QueryBuilder whereDateTime(ColumnValue... conditions) {
        return where(Arrays.asList(conditions), true);
    }

    /**
     * Adds conditions whose value is a placeholder token, resolved at build time
     * from {@link #setValue(String, Object)}.
     */
    public QueryBuilder whereWithPlaceholder(ColumnValue... conditions) {
        return whereWithPlaceholder(Arrays.asList(conditions));
    }

    public QueryBuilder whereWithPlaceholder(List<ColumnValue> conditions) {
        for (ColumnValue condition : conditions) {
            whereClauses.add(condition.toSql(dialect));
        }
        return this;
    }

    /**
     * Sets the text for a placeholder token. Converted by {@link SqlValueText}.
     *
     * @throws IllegalArgumentException if the value type has no canonical text
     */
    public QueryBuilder setValue(String placeholder, Object value) {
        return setValue(placeholder, value, SqlValueText::toText);
    }

    /** Sets the text for a placeholder token using an explicit converter. */
    public <T> QueryBuilder setValue(String placeholder, T value, Function<? super T, String> toText) {
        Objects.requireNonNull(placeholder, "placeholder must not be null");
        placeholderValues.put(placeholder,
                Objects.requireNonNull(toText.apply(value), "converted text for " + placeholder + " is null"));
        return this;
    }

    /** Snapshot of the placeholder values set so far. */
    public Map<String, String> placeholderValues() {
        return placeholderValues.asMap();
    }

    // ==================== ORDER BY ====================

    public QueryBuilder orderBy(String column) {
        return orderBy(column, SortDirection.ASC);
    }

    public QueryBuilder orderBy(String column, boolean ascending) {
        return orderBy(column, SortDirection.of(ascending));
    }

    /** Replaces any earlier ORDER BY; only a single column is supported. */
    public QueryBuilder orderBy(String column, SortDirection dir) {
        this.orderByClause = ReservedKeywords.escape(column, dialect) + " " + dir.name();
        return this;
    }

    // ==================== LIMIT / OFFSET ====================

    public QueryBuilder limit(int count) {
        this.limitValue = count;
        return this;
    }

    public QueryBuilder offset(int skip) {
        this.offsetValue = skip;
        return this;
    }

    // ==================== BUILD ====================

    /**
     * Renders the statement. Does not modify the builder, so repeated calls
     * return the same text.
     */
    public String build() {
        if (!tableSet) {
            log.warn("Rendering {} query without a table name", databaseType);
        }
        String sql = render(true);
        log.debug("Built {} query: {}", databaseType, sql);
        return sql;
    }

    /** Renders the statement with placeholder tokens left unresolved. */
    public String buildTemplate() {
        return render(false);
    }

    private String render(boolean substitute) {
        StringBuilder sql = new StringBuilder("SELECT ");

        if (indexHint != null && !indexHint.isEmpty()) {
            sql.append(dialect.selectHint(tableName, indexHint));
        }

        if (selectedColumns.isEmpty()) {
            sql.append("*");
        } else {
            // Two trailing spaces after DISTINCT are part of the output format
            if (distinct) sql.append(" DISTINCT  ");
            sql.append(String.join(", ", selectedColumns));
        }

        sql.append(" FROM ").append(tableName);

        if (indexHint != null && !indexHint.isEmpty()) {
            sql.append(dialect.tableHint(indexHint));
        }

        for (String join : joinClauses) {
            sql.append(" ").append(join);
        }

        if (!whereClauses.isEmpty()) {
            String whereClause = String.join(" AND ", whereClauses);
            if (substitute) {
                whereClause = placeholderValues.substitute(whereClause);
            }
            sql.append(" WHERE ").append(whereClause);
        }

        if (orderByClause != null) {
            sql.append(" ORDER BY ").append(orderByClause);
        }

        sql.append(dialect.pagination(limitValue, offsetValue));

        return sql.toString();
    }

    @Override
    public String toString() {
        return build();
    }
}
