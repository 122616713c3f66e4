package com.baton.core.model;

/**
 * Where a work item stands in its review-cycle escalation policy.
 *
 * @param cycle       number of times the item has entered review
 * @param requirement what the current cycle needs before demotion may continue
 * @param satisfied   whether that requirement has been met
 */
public record ReviewCycleStatus(int cycle, Requirement requirement, boolean satisfied) {

    public enum Requirement {
        NONE,
        PATTERN_NOTE,
        ESCALATION
    }

    public boolean allowsDemotion() {
        return requirement == Requirement.NONE || satisfied;
    }
}
