package com.baskettecase.sqlgate.db;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.config.GatewayProperties.ServerDefinition;
import com.baskettecase.sqlgate.error.ServerNotConfiguredException;
import com.baskettecase.sqlgate.store.DatabaseCatalogRepository;
import com.baskettecase.sqlgate.store.RegisteredDatabase;
import com.baskettecase.sqlgate.util.FuzzyMatcher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Server Registry
 *
 * Maps server names to their reachable databases and backend technology. The mapping is built from
 * the configured servers, an optional catalog lookup per server and the databases administrators
 * registered in the record store. Lookups read an immutable snapshot; {@link #refresh()} and
 * {@link #addDatabase} swap in a new one.
 */
@Slf4j
@Service
@DependsOn("schemaInitializer")
@RequiredArgsConstructor
public class ServerRegistry {

    private final GatewayProperties properties;
    private final DatabaseCatalogRepository catalogRepository;
    private final CatalogDiscovery catalogDiscovery;

    private volatile Map<String, ServerEntry> snapshot = Map.of();

    @PostConstruct
    public void load() {
        refresh();
    }

    /**
     * Rebuild the snapshot from configuration, catalog discovery and the record store
     */
    public synchronized void refresh() {
        Map<String, ServerBuilder> builders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        for (ServerDefinition definition : properties.getServers()) {
            if (definition.getName() == null || definition.getTechnology() == null) {
                log.warn("⚠️ Skipping server definition without name or technology: {}", definition.getName());
                continue;
            }
            ServerBuilder builder = builders.computeIfAbsent(definition.getName(),
                name -> new ServerBuilder(definition));
            builder.databases.addAll(definition.getDatabases());

            if (definition.hasDiscoveryAccount()) {
                try {
                    builder.databases.addAll(catalogDiscovery.discover(definition));
                } catch (DataAccessException e) {
                    log.warn("⚠️ Catalog discovery failed for server '{}': {}", definition.getName(), e.getMessage());
                }
            }
        }

        for (RegisteredDatabase registered : catalogRepository.findAll()) {
            ServerBuilder builder = builders.computeIfAbsent(registered.serverName(),
                name -> new ServerBuilder(name, registered.technology()));
            builder.databases.add(registered.databaseName());
        }

        Map<String, ServerEntry> next = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builders.forEach((name, builder) -> next.put(name, builder.build()));
        snapshot = Collections.unmodifiableMap(next);

        log.info("📋 Server registry loaded: {} servers, {} databases",
            next.size(), next.values().stream().mapToInt(entry -> entry.databases().size()).sum());
    }

    public List<ServerEntry> listServers() {
        return List.copyOf(snapshot.values());
    }

    /**
     * Validate a server/database pair and return the server's technology
     *
     * @throws ServerNotConfiguredException when either name is unknown
     */
    public Technology resolve(String server, String database) {
        ServerEntry entry = server(server);
        if (entry.findDatabase(database).isEmpty()) {
            throw new ServerNotConfiguredException(
                String.format("Database '%s' is not configured on server '%s'", database, entry.name()),
                FuzzyMatcher.findClosestMatches(database, entry.databases()));
        }
        return entry.technology();
    }

    /**
     * Look up a server by name (case-insensitive)
     *
     * @throws ServerNotConfiguredException when the server is unknown
     */
    public ServerEntry server(String server) {
        Map<String, ServerEntry> current = snapshot;
        ServerEntry entry = server == null ? null : current.get(server.trim());
        if (entry == null) {
            throw new ServerNotConfiguredException(
                String.format("Server '%s' is not configured", server),
                FuzzyMatcher.findClosestMatches(server, current.keySet()));
        }
        return entry;
    }

    /**
     * Register a database for a server and reload the snapshot
     *
     * @throws IllegalArgumentException when the database is already registered
     */
    public synchronized ServerEntry addDatabase(String server, String database, Technology technology) {
        if (server == null || server.isBlank() || database == null || database.isBlank()) {
            throw new IllegalArgumentException("Server and database names are required");
        }
        ServerEntry existing = snapshot.get(server.trim());
        if (existing != null && existing.findDatabase(database).isPresent()) {
            throw new IllegalArgumentException(
                String.format("Database '%s' is already registered on server '%s'", database, existing.name()));
        }
        if (existing != null && existing.technology() != technology) {
            throw new IllegalArgumentException(
                String.format("Server '%s' runs %s, not %s", existing.name(), existing.technology(), technology));
        }
        if (catalogRepository.exists(server.trim(), database.trim())) {
            throw new IllegalArgumentException(
                String.format("Database '%s' is already registered on server '%s'", database, server));
        }

        catalogRepository.save(new RegisteredDatabase(null, server.trim(), database.trim(), technology, Instant.now()));
        log.info("✅ Registered database '{}' on server '{}' ({})", database, server, technology);

        refresh();
        return server(server);
    }

    private static final class ServerBuilder {
        private final String name;
        private final Technology technology;
        private final String host;
        private final int port;
        private final Map<String, String> driverProperties;
        private final Set<String> databases = new LinkedHashSet<>();

        ServerBuilder(ServerDefinition definition) {
            this.name = definition.getName();
            this.technology = definition.getTechnology();
            this.host = definition.resolvedHost();
            this.port = definition.resolvedPort();
            this.driverProperties = definition.getProperties();
        }

        ServerBuilder(String name, Technology technology) {
            this.name = name;
            this.technology = technology;
            this.host = name;
            this.port = technology.getDefaultPort();
            this.driverProperties = Map.of();
        }

        ServerEntry build() {
            return new ServerEntry(name, technology, host, port, new ArrayList<>(databases), driverProperties);
        }
    }
}
