package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.db.ConnectionPool;
import com.baskettecase.sqlgate.store.AppUser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionService
 */
@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final AppUser ALICE = new AppUser(7L, "alice", "alice@example.com", false, true, Instant.EPOCH);

    @Mock
    private CredentialCache credentialCache;

    @Mock
    private ConnectionPool connectionPool;

    @InjectMocks
    private SessionService sessionService;

    @Test
    void testLoginCachesPassword() {
        sessionService.login(ALICE, "pw");

        verify(credentialCache).store(7L, "pw");
    }

    @Test
    void testLoginRequiresPassword() {
        assertThrows(IllegalArgumentException.class, () -> sessionService.login(ALICE, ""));
        assertThrows(IllegalArgumentException.class, () -> sessionService.login(ALICE, null));
        verify(credentialCache, never()).store(anyLong(), anyString());
    }

    @Test
    void testLogoutReleasesHandlesThenCredential() {
        when(connectionPool.evictOwner(7L)).thenReturn(2);

        sessionService.logout(ALICE);

        InOrder order = inOrder(connectionPool, credentialCache);
        order.verify(connectionPool).evictOwner(7L);
        order.verify(credentialCache).remove(7L);
    }

    @Test
    void testIsActiveDelegatesToCache() {
        when(credentialCache.isValid(7L)).thenReturn(true);

        assertTrue(sessionService.isActive(ALICE));
    }
}
