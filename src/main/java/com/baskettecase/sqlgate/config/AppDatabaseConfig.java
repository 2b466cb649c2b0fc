package com.baskettecase.sqlgate.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Record store connection.
 *
 * Users, workspaces, the execution log and registered databases live in one writable database,
 * separate from the target servers users query.
 */
@Slf4j
@Configuration
public class AppDatabaseConfig {

    @Value("${spring.datasource.url}")
    private String jdbcUrl;

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Value("${sqlgate.app-store.maximum-pool-size:5}")
    private int maximumPoolSize;

    @Bean(name = "appDataSource")
    @Primary
    public DataSource appDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setPoolName("sqlgate-app-store");

        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setValidationTimeout(5000);
        config.setReadOnly(false);

        config.addDataSourceProperty("ApplicationName", "sql-gate-server");

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("✅ Created record store connection pool");
        return dataSource;
    }

    @Bean(name = "appJdbcTemplate")
    public JdbcTemplate appJdbcTemplate(@Qualifier("appDataSource") DataSource appDataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(appDataSource);
        jdbcTemplate.setQueryTimeout(30);
        return jdbcTemplate;
    }

    @Bean(name = "appTransactionManager")
    @Primary
    public PlatformTransactionManager appTransactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Bean(name = "appTransactionTemplate")
    public TransactionTemplate appTransactionTemplate(
            @Qualifier("appTransactionManager") PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
