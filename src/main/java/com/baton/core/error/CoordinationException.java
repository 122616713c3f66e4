package com.baton.core.error;

/**
 * Thrown when a coordination request breaks a protocol rule. The request is not applied;
 * the initiating actor must correct and resubmit.
 */
public class CoordinationException extends RuntimeException {

    private final RuleViolation rule;
    private final String workItemId;

    public CoordinationException(RuleViolation rule, String workItemId, String message) {
        super(message);
        this.rule = rule;
        this.workItemId = workItemId;
    }

    public RuleViolation getRule() {
        return rule;
    }

    public String getWorkItemId() {
        return workItemId;
    }

    public RuleViolation.Category getCategory() {
        return rule.category();
    }
}
