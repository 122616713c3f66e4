package com.baton.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Type of a PhaseThread, the typed sub-conversation within a work item.
 */
public enum ThreadType {
    DEV,
    TEST,
    REVIEW;

    public static final String LABEL_PREFIX = "phase:";

    /** Phase label, e.g. {@code phase:dev}. */
    public String label() {
        return LABEL_PREFIX + name().toLowerCase(Locale.ROOT);
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ThreadType> fromLabel(String label) {
        if (label == null || !label.startsWith(LABEL_PREFIX)) return Optional.empty();
        return fromTag(label.substring(LABEL_PREFIX.length()));
    }

    public static Optional<ThreadType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.tag().equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
