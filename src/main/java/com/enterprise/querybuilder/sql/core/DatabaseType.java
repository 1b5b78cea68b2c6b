package com.enterprise.querybuilder.sql.core;

/**
 * The database flavors a query can be rendered for.
 * Each constant is bound to its {@link SqlDialect} rules.
 */
public enum DatabaseType {
    MARIADB(Dialects.MARIADB),
    ORACLE(Dialects.ORACLE);

    private final SqlDialect dialect;

    DatabaseType(SqlDialect dialect) { this.dialect = dialect; }

    public SqlDialect dialect() { return dialect; }
}
