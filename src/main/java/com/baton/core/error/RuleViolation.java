package com.baton.core.error;

/**
 * Rules whose breach rejects an operation outright.
 */
public enum RuleViolation {
    // Structural: always rejected, never coerced
    ILLEGAL_TRANSITION(Category.STRUCTURAL),
    INVALID_DEMOTION_DIRECTION(Category.STRUCTURAL),
    WAVE_NOT_ELIGIBLE(Category.STRUCTURAL),
    THREAD_STILL_OPEN(Category.STRUCTURAL),
    ALREADY_CLAIMED(Category.STRUCTURAL),
    STALE_STATE(Category.STRUCTURAL),
    WORK_ITEM_COMPLETED(Category.STRUCTURAL),
    UNRECOVERABLE_STATE(Category.STRUCTURAL),
    VIOLATION_BLOCKED(Category.STRUCTURAL),
    PATTERN_NOTE_REQUIRED(Category.STRUCTURAL),
    ESCALATION_REQUIRED(Category.STRUCTURAL),
    CONCURRENT_UPDATE(Category.STRUCTURAL),

    // Data integrity: the write is malformed and must be resubmitted
    INCOMPLETE_CHECKPOINT(Category.DATA_INTEGRITY),
    SCOPE_ALREADY_DECLARED(Category.DATA_INTEGRITY),
    MALFORMED_SCOPE_DECLARATION(Category.DATA_INTEGRITY),
    CORRECTION_REQUIRED(Category.DATA_INTEGRITY);

    public enum Category { STRUCTURAL, DATA_INTEGRITY }

    private final Category category;

    RuleViolation(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
