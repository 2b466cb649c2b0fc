package com.baskettecase.sqlgate.db;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps pooled connections alive when a user query fails for reasons that say nothing about
 * the connection itself: unsupported features, syntax or access errors and constraint violations.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }

        // 0A feature not supported, 22 data exception, 23 constraint violation, 42 syntax or access rule
        if (sqlState.startsWith("0A") || sqlState.startsWith("22")
            || sqlState.startsWith("23") || sqlState.startsWith("42")) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
