package com.baton.core.model;

/**
 * Enforcement ladder: first occurrence reminds, second warns, third and later block.
 */
public enum EnforcementLevel {
    NONE,
    REMINDER,
    WARNING,
    BLOCK;

    public static EnforcementLevel forOccurrences(int occurrences) {
        if (occurrences <= 0) return NONE;
        if (occurrences == 1) return REMINDER;
        if (occurrences == 2) return WARNING;
        return BLOCK;
    }

    public boolean atLeast(EnforcementLevel other) {
        return compareTo(other) >= 0;
    }
}
