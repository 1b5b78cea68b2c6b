package com.enterprise.querybuilder.sql.core;

public final class Dialects {

    private Dialects() {}

    public static final SqlDialect MARIADB = new SqlDialect() {
        @Override public String quoteIdentifier(String identifier) {
            return "`" + identifier + "`";
        }
        @Override public String dateTimeLiteral(String value) {
            return "'" + value + "'";
        }
        @Override public String selectHint(String tableName, String indexName) {
            return "";
        }
        @Override public String tableHint(String indexName) {
            return " FORCE INDEX(" + indexName + ") ";
        }
        @Override public String pagination(int limit, int offset) {
            if (limit < 0) {
                return "";
            }
            String sql = " LIMIT " + limit;
            if (offset > 0) {
                sql += " OFFSET " + offset;
            }
            return sql;
        }
    };

    // Oracle 12c+ row limiting; offset is not emitted for this dialect
    public static final SqlDialect ORACLE = new SqlDialect() {
        @Override public String quoteIdentifier(String identifier) {
            return "\"" + identifier + "\"";
        }
        @Override public String dateTimeLiteral(String value) {
            return "TO_TIMESTAMP('" + value + "', 'YYYY-MM-DD HH24:MI:SS')";
        }
        @Override public String selectHint(String tableName, String indexName) {
            return " /*+ INDEX(" + tableName + ", " + indexName + ") */ ";
        }
        @Override public String tableHint(String indexName) {
            return "";
        }
        @Override public String pagination(int limit, int offset) {
            return limit < 0 ? "" : " FETCH FIRST " + limit + " ROWS ONLY";
        }
    };
}
