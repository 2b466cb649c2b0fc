package com.baskettecase.sqlgate.db;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates one small HikariCP pool per connection identity, using the caller's own credentials.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HikariConnectionHandleFactory implements ConnectionHandleFactory {

    private final GatewayProperties properties;
    private final ServerRegistry serverRegistry;

    @Override
    public ConnectionHandle open(ConnectionIdentity identity, String poolName) {
        ServerEntry server = serverRegistry.server(identity.server());
        GatewayProperties.Pool pool = properties.getPool();

        HikariConfig config = new HikariConfig();

        // Credentials come from the caller, never from application.yml
        config.setJdbcUrl(server.jdbcUrl(identity.database()));
        config.setDriverClassName(identity.driver());
        config.setUsername(identity.username());
        config.setPassword(identity.password());
        config.setPoolName(poolName);

        config.setMaximumPoolSize(pool.getHandlePoolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(pool.getConnectionTimeout().toMillis());
        config.setIdleTimeout(pool.getHandleIdleTimeout().toMillis());
        config.setMaxLifetime(pool.getMaxLifetime().toMillis());
        config.setValidationTimeout(pool.getValidationTimeout().toMillis());
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());

        server.properties().forEach(config::addDataSourceProperty);

        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("📊 Pool '{}': max={}, timeout={}ms (user: {})",
                poolName, config.getMaximumPoolSize(), config.getConnectionTimeout(), identity.username());
            return new HikariConnectionHandle(dataSource);
        } catch (HikariPool.PoolInitializationException e) {
            log.error("❌ Failed to connect to {}/{} as {}: {}",
                identity.server(), identity.database(), identity.username(), e.getMessage());
            throw new QueryExecutionException(
                String.format("Could not connect to %s/%s: %s", identity.server(), identity.database(),
                    rootMessage(e)), e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
