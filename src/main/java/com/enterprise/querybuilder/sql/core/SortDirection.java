package com.enterprise.querybuilder.sql.core;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection of(boolean ascending) {
        return ascending ? ASC : DESC;
    }
}
