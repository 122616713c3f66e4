package com.baton.core.concurrency;

import com.baton.core.config.BatonProperties;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.metrics.BatonMetrics;
import com.baton.core.model.WorkItem;
import com.baton.core.store.StaleRevisionException;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Read-compute-conditional-write loop for per-work-item mutations.
 * <p>
 * Each attempt reads the latest projection and hands it to the caller, who performs
 * conditional writes against {@link WorkItem#revision()}. A stale write is retried on a
 * fresh read; it is never forced over the newer revision. There is no backoff timer:
 * retries are bounded by count only.
 */
@Component
public class OptimisticUpdater {

    private static final Logger log = LoggerFactory.getLogger(OptimisticUpdater.class);

    private final WorkItemRepository repository;
    private final BatonMetrics metrics;
    private final int maxAttempts;

    public OptimisticUpdater(WorkItemRepository repository, BatonMetrics metrics, BatonProperties properties) {
        this.repository = repository;
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, properties.getStore().getMaxWriteAttempts());
    }

    public <T> T update(String workItemId, Function<WorkItem, T> attempt) {
        StaleRevisionException last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            WorkItem item = repository.get(workItemId);
            try {
                return attempt.apply(item);
            } catch (StaleRevisionException e) {
                last = e;
                metrics.recordWriteRetry();
                log.debug("Write to {} lost a race (attempt {}/{}): {}", workItemId, i, maxAttempts, e.getMessage());
            }
        }
        throw new CoordinationException(RuleViolation.CONCURRENT_UPDATE, workItemId,
                "Work item " + workItemId + " kept changing during " + maxAttempts + " write attempts: "
                        + (last != null ? last.getMessage() : "unknown"));
    }
}
