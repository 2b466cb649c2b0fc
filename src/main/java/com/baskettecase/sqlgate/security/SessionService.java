package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.db.ConnectionPool;
import com.baskettecase.sqlgate.store.AppUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Database sessions: the password a user supplies at login is cached for later queries and
 * dropped at logout together with the user's idle connection handles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final CredentialCache credentialCache;
    private final ConnectionPool connectionPool;

    public void login(AppUser user, String databasePassword) {
        if (databasePassword == null || databasePassword.isEmpty()) {
            throw new IllegalArgumentException("Database password is required");
        }
        credentialCache.store(user.id(), databasePassword);
        log.info("🔐 Database session opened for {}", user.username());
    }

    /**
     * Handles still running a query stay open until the sweep finds them idle
     */
    public void logout(AppUser user) {
        int closed = connectionPool.evictOwner(user.id());
        credentialCache.remove(user.id());
        log.info("👋 Database session closed for {} ({} connection handles released)", user.username(), closed);
    }

    public boolean isActive(AppUser user) {
        return credentialCache.isValid(user.id());
    }
}
