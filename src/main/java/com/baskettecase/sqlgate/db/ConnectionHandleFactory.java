package com.baskettecase.sqlgate.db;

/**
 * Opens connection handles. Opening performs the network handshake and may block.
 */
public interface ConnectionHandleFactory {

    ConnectionHandle open(ConnectionIdentity identity, String poolName);
}
