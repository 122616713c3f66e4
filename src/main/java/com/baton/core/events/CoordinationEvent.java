package com.baton.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the coordination engine after it changed or observed protocol state.
 *
 * @param eventType  e.g. "phase.transitioned", "scope.conflict", "violation.recorded"
 * @param workItemId the work item concerned
 * @param epicId     its epic, or null
 * @param actor      the actor whose request or comment caused the event
 * @param payload    event-specific data
 * @param timestamp  when the event occurred
 */
public record CoordinationEvent(
    String eventType,
    String workItemId,
    String epicId,
    String actor,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PHASE_TRANSITIONED = "phase.transitioned";
    public static final String TRANSITION_REJECTED = "phase.rejected";
    public static final String SCOPE_DECLARED = "scope.declared";
    public static final String SCOPE_CONFLICT = "scope.conflict";
    public static final String SCOPE_RESOLVED = "scope.resolved";
    public static final String VIOLATION_RECORDED = "violation.recorded";
    public static final String VIOLATION_CLEARED = "violation.cleared";
    public static final String CHECKPOINT_VALIDATED = "checkpoint.validated";
    public static final String ESCALATION_REQUIRED = "review.escalation_required";
}
