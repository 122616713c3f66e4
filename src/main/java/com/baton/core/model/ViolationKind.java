package com.baton.core.model;

/**
 * Protocol rule violations tracked by the enforcement ladder.
 * Each kind maps to one externally visible {@code violation:*} label.
 */
public enum ViolationKind {
    MISSING_SCOPE_DECLARATION("violation:scope"),
    WRONG_ORDER_CLAIM("violation:wave-order"),
    VERDICT_OUTSIDE_REVIEW("violation:phase"),
    TEST_SCOPE_EXCEEDED("violation:phase"),
    INVALID_DEMOTION("violation:phase"),
    SELF_APPROVAL("violation:self-approval"),
    MISSING_CHECKPOINT("violation:checkpoint"),
    INCOMPLETE_INIT("violation:phase"),
    UNRESOLVED_SCOPE_CONFLICT("violation:scope");

    private final String label;

    ViolationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
