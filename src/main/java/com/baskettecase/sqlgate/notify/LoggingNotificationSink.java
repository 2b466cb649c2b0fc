package com.baskettecase.sqlgate.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes approval requests to the log. Used when no webhook is configured.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public boolean notify(ApprovalRequest request) {
        log.info("📣 Approval needed for workspace {}: {} on {}/{} ({})",
            request.workspaceId(), request.username(), request.server(), request.database(),
            request.riskLabel());
        return true;
    }
}
