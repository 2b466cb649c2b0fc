package com.baskettecase.sqlgate;

import com.baskettecase.sqlgate.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;

/**
 * SQL Gate Server Application
 *
 * Runs user queries against a fleet of database servers with each user's own credentials.
 * Risky queries are parked in the user's workspace until an administrator approves them.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class SqlGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlGateApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 SQL Gate Server is ready!");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
