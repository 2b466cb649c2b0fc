package com.baskettecase.sqlgate.notify;

/**
 * Delivers approval requests to administrators. Best effort.
 */
public interface NotificationSink {

    /**
     * @return true when the request was delivered
     */
    boolean notify(ApprovalRequest request);
}
