package com.baton.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle phase of a work item.
 * <p>
 * {@code READY → CLAIMED → DEV_OPEN → DEV_CLOSED → TEST_OPEN → TEST_CLOSED → REVIEW_OPEN → {COMPLETED | REVIEW_FAILED}},
 * with {@code REVIEW_FAILED → DEV_OPEN} and the demotion {@code REVIEW_OPEN → DEV_OPEN}.
 */
public enum Phase {
    READY(null, StatusLabel.READY),
    CLAIMED(null, StatusLabel.IN_PROGRESS),
    DEV_OPEN(ThreadType.DEV, StatusLabel.IN_PROGRESS),
    DEV_CLOSED(null, StatusLabel.IN_PROGRESS),
    TEST_OPEN(ThreadType.TEST, StatusLabel.IN_PROGRESS),
    TEST_CLOSED(null, StatusLabel.IN_PROGRESS),
    REVIEW_OPEN(ThreadType.REVIEW, StatusLabel.REVIEW_NEEDED),
    COMPLETED(null, StatusLabel.COMPLETED),
    REVIEW_FAILED(null, StatusLabel.NEEDS_INPUT);

    public static final String STATE_LABEL_PREFIX = "state:";

    private final ThreadType openThread;
    private final StatusLabel statusLabel;

    Phase(ThreadType openThread, StatusLabel statusLabel) {
        this.openThread = openThread;
        this.statusLabel = statusLabel;
    }

    /** Thread that is open while in this phase. */
    public Optional<ThreadType> openThread() {
        return Optional.ofNullable(openThread);
    }

    public StatusLabel statusLabel() {
        return statusLabel;
    }

    /** Engine-owned label holding the exact phase, e.g. {@code state:dev_open}. */
    public String stateLabel() {
        return STATE_LABEL_PREFIX + tag();
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Claimed and not yet completed: the phases whose scope declarations are live. */
    public boolean isInProgress() {
        return this != READY && this != COMPLETED;
    }

    public static Optional<Phase> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(p -> p.tag().equalsIgnoreCase(normalized))
                .findFirst();
    }

    public static Optional<Phase> fromStateLabel(String label) {
        if (label == null || !label.startsWith(STATE_LABEL_PREFIX)) return Optional.empty();
        return fromTag(label.substring(STATE_LABEL_PREFIX.length()));
    }
}
