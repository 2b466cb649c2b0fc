package com.baskettecase.sqlgate.config;

import com.baskettecase.sqlgate.db.Technology;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration
 *
 * Bound from the {@code sqlgate.*} namespace in application.yml. Groups the connection pool,
 * credential cache, execution limits, notification and target server settings.
 */
@Data
@ConfigurationProperties(prefix = "sqlgate")
public class GatewayProperties {

    private Pool pool = new Pool();
    private Credentials credentials = new Credentials();
    private Execution execution = new Execution();
    private Notification notification = new Notification();
    private List<ServerDefinition> servers = new ArrayList<>();

    /**
     * Connection handle cache settings
     */
    @Data
    public static class Pool {
        private int maxEntries = 100;
        private Duration idleTtl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        // Per-handle HikariCP settings
        private int handlePoolSize = 2;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration handleIdleTimeout = Duration.ofMinutes(10);
        private Duration maxLifetime = Duration.ofHours(1);
        private Duration validationTimeout = Duration.ofSeconds(5);
    }

    /**
     * Cached database credential settings
     */
    @Data
    public static class Credentials {
        private int sessionTimeoutMinutes = 120;
        private Duration idleTimeout = Duration.ofMinutes(60);
        private Duration purgeInterval = Duration.ofMinutes(5);
    }

    /**
     * Query execution limits
     */
    @Data
    public static class Execution {
        private int maxRows = 1000;
        private int previewMaxRows = 1000;
        private int rowWarningThreshold = 10000;
        private int queryTimeoutSeconds = 60;
        private int maxBatchSize = 10;
    }

    /**
     * Approval notification settings
     */
    @Data
    public static class Notification {
        private String slackWebhookUrl;
        private Duration timeout = Duration.ofSeconds(8);
        private int maxQueryChars = 2900;
    }

    /**
     * A target server users may connect to
     */
    @Data
    public static class ServerDefinition {
        private String name;
        private Technology technology;
        private String host;
        private Integer port;
        private List<String> databases = new ArrayList<>();

        // Optional service account used once at startup to list the server's databases
        private String discoveryUsername;
        private String discoveryPassword;

        // Extra JDBC driver properties (e.g. encrypt, sslmode)
        private Map<String, String> properties = new HashMap<>();

        public String resolvedHost() {
            return host != null && !host.isBlank() ? host : name;
        }

        public int resolvedPort() {
            return port != null ? port : technology.getDefaultPort();
        }

        public boolean hasDiscoveryAccount() {
            return discoveryUsername != null && !discoveryUsername.isBlank();
        }
    }
}
