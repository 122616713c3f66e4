package com.baton.core.model;

import java.util.List;

/**
 * Outcome of a committed phase transition.
 *
 * @param workItemId the item that moved
 * @param from       phase before
 * @param to         phase after
 * @param actor      initiating actor
 * @param violations soft violations recorded as a side effect (the transition still stands)
 */
public record TransitionResult(
    String workItemId,
    Phase from,
    Phase to,
    String actor,
    List<Violation> violations
) {
    public TransitionResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}
