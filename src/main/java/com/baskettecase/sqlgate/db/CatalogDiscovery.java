package com.baskettecase.sqlgate.db;

import com.baskettecase.sqlgate.config.GatewayProperties.ServerDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lists the user databases of a configured server through its discovery account.
 * Runs once per server when the registry loads.
 */
@Slf4j
@Component
public class CatalogDiscovery {

    private static final int DISCOVERY_TIMEOUT_SECONDS = 15;

    public List<String> discover(ServerDefinition server) {
        Technology technology = server.getTechnology();
        String url = technology.jdbcUrl(server.resolvedHost(), server.resolvedPort(), technology.getCatalogDatabase());

        DriverManagerDataSource dataSource = new DriverManagerDataSource(url,
            server.getDiscoveryUsername(), server.getDiscoveryPassword());
        dataSource.setDriverClassName(technology.getDriverClassName());

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(DISCOVERY_TIMEOUT_SECONDS);

        List<String> databases = jdbcTemplate.queryForList(technology.getCatalogQuery(), String.class);
        log.info("🔎 Discovered {} databases on server '{}'", databases.size(), server.getName());
        return databases;
    }
}
