package com.baskettecase.sqlgate.db;

import lombok.Getter;

import java.util.Locale;

/**
 * Backend technologies a target server may run.
 *
 * Each technology knows its JDBC driver, how to build a JDBC URL for one database and how to list
 * the user databases of a server.
 */
@Getter
public enum Technology {

    MSSQL(
        "com.microsoft.sqlserver.jdbc.SQLServerDriver",
        1433,
        "master",
        "SELECT name FROM sys.databases WHERE database_id > 4 ORDER BY name"
    ) {
        @Override
        public String jdbcUrl(String host, int port, String database) {
            return String.format("jdbc:sqlserver://%s:%d;databaseName=%s;trustServerCertificate=true",
                host, port, database);
        }
    },

    POSTGRESQL(
        "org.postgresql.Driver",
        5432,
        "postgres",
        "SELECT datname FROM pg_database WHERE NOT datistemplate ORDER BY datname"
    ) {
        @Override
        public String jdbcUrl(String host, int port, String database) {
            return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
        }
    },

    MYSQL(
        "com.mysql.cj.jdbc.Driver",
        3306,
        "",
        "SELECT schema_name FROM information_schema.schemata "
            + "WHERE schema_name NOT IN ('mysql', 'information_schema', 'performance_schema', 'sys') "
            + "ORDER BY schema_name"
    ) {
        @Override
        public String jdbcUrl(String host, int port, String database) {
            return String.format("jdbc:mysql://%s:%d/%s", host, port, database);
        }
    };

    private final String driverClassName;
    private final int defaultPort;
    private final String catalogDatabase;
    private final String catalogQuery;

    Technology(String driverClassName, int defaultPort, String catalogDatabase, String catalogQuery) {
        this.driverClassName = driverClassName;
        this.defaultPort = defaultPort;
        this.catalogDatabase = catalogDatabase;
        this.catalogQuery = catalogQuery;
    }

    /**
     * Build the JDBC URL for one database on a server
     */
    public abstract String jdbcUrl(String host, int port, String database);

    /**
     * Lenient lookup accepting the names used in the record store ("mssql", "sqlserver", "postgres", ...)
     */
    public static Technology fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Technology name is required");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "mssql":
            case "sqlserver":
            case "sql_server":
                return MSSQL;
            case "postgres":
            case "postgresql":
                return POSTGRESQL;
            case "mysql":
                return MYSQL;
            default:
                throw new IllegalArgumentException("Unsupported technology: " + name);
        }
    }
}
