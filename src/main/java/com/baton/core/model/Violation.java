package com.baton.core.model;

import java.io.Serializable;

/**
 * Current standing of one (actor, kind, work item) triple.
 */
public record Violation(
    String actor,
    String workItemId,
    ViolationKind kind,
    int occurrences,
    EnforcementLevel level
) implements Serializable {

    public boolean isBlocking() {
        return level == EnforcementLevel.BLOCK;
    }
}
