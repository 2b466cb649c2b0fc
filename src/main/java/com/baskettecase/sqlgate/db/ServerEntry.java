package com.baskettecase.sqlgate.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One target server in a registry snapshot. Immutable.
 */
public record ServerEntry(
    String name,
    Technology technology,
    String host,
    int port,
    List<String> databases,
    Map<String, String> properties
) {

    public ServerEntry {
        databases = List.copyOf(databases);
        properties = Map.copyOf(properties);
    }

    /**
     * Canonical spelling of a database on this server, matched case-insensitively
     */
    public Optional<String> findDatabase(String database) {
        if (database == null) {
            return Optional.empty();
        }
        return databases.stream()
            .filter(name -> name.equalsIgnoreCase(database.trim()))
            .findFirst();
    }

    public String jdbcUrl(String database) {
        return technology.jdbcUrl(host, port, database);
    }

    public ServerEntry withDatabases(List<String> newDatabases) {
        return new ServerEntry(name, technology, host, port, newDatabases, properties);
    }
}
