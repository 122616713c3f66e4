package com.baton.core.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Status labels visible on work items.
 */
public enum StatusLabel {
    READY("ready"),
    IN_PROGRESS("in-progress"),
    NEEDS_INPUT("needs-input"),
    REVIEW_NEEDED("review-needed"),
    COMPLETED("completed");

    private final String label;

    StatusLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Set<String> all() {
        return Arrays.stream(values()).map(StatusLabel::label).collect(Collectors.toUnmodifiableSet());
    }
}
