package com.baskettecase.sqlgate.notify;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends approval requests in the background. Delivery failures are logged and counted,
 * never returned to the submitter.
 */
@Slf4j
@Component
public class ApprovalNotifier {

    private final NotificationSink sink;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public ApprovalNotifier(NotificationSink sink, @Qualifier("notificationExecutor") Executor executor,
                            MeterRegistry meterRegistry) {
        this.sink = sink;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public void notifyAsync(ApprovalRequest request) {
        try {
            executor.execute(() -> deliver(request));
        } catch (RejectedExecutionException e) {
            record(false);
            log.error("❌ Could not queue approval notification for workspace {}: {}",
                request.workspaceId(), e.getMessage());
        }
    }

    void deliver(ApprovalRequest request) {
        try {
            boolean delivered = sink.notify(request);
            record(delivered);
            if (!delivered) {
                log.warn("⚠️ Approval notification for workspace {} was not accepted", request.workspaceId());
            }
        } catch (RuntimeException e) {
            record(false);
            log.error("❌ Approval notification for workspace {} failed: {}", request.workspaceId(), e.getMessage());
        }
    }

    private void record(boolean delivered) {
        meterRegistry.counter("sqlgate.notifications", "outcome", delivered ? "sent" : "failed").increment();
    }
}
