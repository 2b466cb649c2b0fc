package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.config.GatewayProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Credential Cache
 *
 * Holds each logged-in user's database password, encrypted, for a bounded time so queries can
 * reconnect as that user without asking for the password again. Entries expire a fixed time after
 * login and after a period without use; expired entries are purged on lookup and by a periodic task.
 */
@Slf4j
@Service
public class CredentialCache {

    private final CredentialCipher cipher;
    private final Clock clock;
    private final Duration sessionTimeout;
    private final Duration idleTimeout;
    private final Duration purgeInterval;

    private final Map<Long, CredentialEntry> entries = new ConcurrentHashMap<>();
    private ScheduledExecutorService purger;

    @Autowired
    public CredentialCache(CredentialCipher cipher, GatewayProperties properties, Clock clock,
                           MeterRegistry meterRegistry) {
        this(cipher, clock,
            Duration.ofMinutes(properties.getCredentials().getSessionTimeoutMinutes()),
            properties.getCredentials().getIdleTimeout(),
            properties.getCredentials().getPurgeInterval());
        Gauge.builder("sqlgate.credentials.cached", entries, Map::size)
            .description("Cached user credentials")
            .register(meterRegistry);
    }

    public CredentialCache(CredentialCipher cipher, Clock clock, Duration sessionTimeout, Duration idleTimeout,
                           Duration purgeInterval) {
        this.cipher = cipher;
        this.clock = clock;
        this.sessionTimeout = sessionTimeout;
        this.idleTimeout = idleTimeout;
        this.purgeInterval = purgeInterval;
    }

    @PostConstruct
    public void startPurge() {
        purger = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sqlgate-credential-purge");
            thread.setDaemon(true);
            return thread;
        });
        long millis = purgeInterval.toMillis();
        purger.scheduleWithFixedDelay(this::runPurge, millis, millis, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stopPurge() {
        if (purger != null) {
            purger.shutdownNow();
            purger = null;
        }
        entries.clear();
    }

    /**
     * Cache the password for a user, replacing any previous entry
     */
    public void store(long userId, String plaintextPassword) {
        Instant now = clock.instant();
        entries.put(userId, new CredentialEntry(cipher.encrypt(plaintextPassword), now, now));
        log.debug("Cached credential for user {}", userId);
    }

    /**
     * Decrypt the user's password. Expired entries are purged and reported as {@link CredentialLookup.Status#EXPIRED}.
     */
    public CredentialLookup fetch(long userId) {
        Instant now = clock.instant();
        CredentialEntry entry = entries.get(userId);
        if (entry == null) {
            return CredentialLookup.notFound();
        }
        if (isExpired(entry, now)) {
            entries.remove(userId, entry);
            log.info("⏰ Credential for user {} expired", userId);
            return CredentialLookup.expired();
        }
        entries.computeIfPresent(userId, (id, current) -> current == entry ? current.touched(now) : current);
        return CredentialLookup.found(cipher.decrypt(entry.encryptedPassword()));
    }

    /**
     * True while the entry is younger than {@code ttlMinutes}; an older entry is purged
     */
    public boolean isValid(long userId, long ttlMinutes) {
        CredentialEntry entry = entries.get(userId);
        if (entry == null) {
            return false;
        }
        Duration age = Duration.between(entry.addedAt(), clock.instant());
        if (age.compareTo(Duration.ofMinutes(ttlMinutes)) >= 0) {
            entries.remove(userId, entry);
            return false;
        }
        return true;
    }

    public boolean isValid(long userId) {
        return isValid(userId, sessionTimeout.toMinutes());
    }

    public void remove(long userId) {
        if (entries.remove(userId) != null) {
            log.debug("Removed credential for user {}", userId);
        }
    }

    /**
     * @return number of entries purged
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.info("🧹 Purged {} expired credentials", purged);
        }
        return purged;
    }

    public int size() {
        return entries.size();
    }

    private void runPurge() {
        try {
            purgeExpired();
        } catch (RuntimeException e) {
            log.error("❌ Credential purge failed", e);
        }
    }

    private boolean isExpired(CredentialEntry entry, Instant now) {
        return !entry.addedAt().plus(sessionTimeout).isAfter(now)
            || !entry.lastAccessedAt().plus(idleTimeout).isAfter(now);
    }

    private record CredentialEntry(byte[] encryptedPassword, Instant addedAt, Instant lastAccessedAt) {

        CredentialEntry touched(Instant now) {
            return new CredentialEntry(encryptedPassword, addedAt, now);
        }
    }
}
