package com.baton.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for the coordination engine.
 */
@Service
public class BatonMetrics {

    private final MeterRegistry registry;

    public BatonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to) {
        Counter.builder("baton.transitions.total")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordRejection(String rule) {
        Counter.builder("baton.rejections.total")
                .description("Requests rejected by a structural or data-integrity rule")
                .tag("rule", rule)
                .register(registry)
                .increment();
    }

    public void recordScopeConflict() {
        Counter.builder("baton.scope.conflicts")
                .description("Scope conflict notifications written")
                .register(registry)
                .increment();
    }

    public void recordViolation(String kind, String level) {
        Counter.builder("baton.violations.total")
                .tag("kind", kind)
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordCheckpointValidation(boolean valid) {
        Counter.builder("baton.checkpoint.validations")
                .tag("result", valid ? "valid" : "incomplete")
                .register(registry)
                .increment();
    }

    /**
     * Records a conditional write that lost a race and was retried after re-reading.
     */
    public void recordWriteRetry() {
        Counter.builder("baton.store.write_retries")
                .description("Conditional ticket-store writes retried after a stale revision")
                .register(registry)
                .increment();
    }

    public void recordReviewCycle(int cycle) {
        DistributionSummary.builder("baton.review.cycle")
                .description("Review cycle number reached on entering review")
                .register(registry)
                .record(cycle);
    }

    public void incrementEscalations(String reason) {
        Counter.builder("baton.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
