package com.baton.core.marker;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structured block types recognised inside comment bodies.
 * <p>
 * Actor-authored: scope, preamble, checkpoint, verdict, resolution, correction,
 * pattern, escalation. Engine-authored: transition, conflict, violation.
 */
public enum MarkerType {
    SCOPE("scope"),
    PREAMBLE("preamble"),
    CHECKPOINT("checkpoint"),
    VERDICT("verdict"),
    RESOLUTION("resolution"),
    CORRECTION("correction"),
    PATTERN("pattern"),
    ESCALATION("escalation"),
    TRANSITION("transition"),
    CONFLICT("conflict"),
    VIOLATION("violation");

    private final String tag;

    MarkerType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isEngineAuthored() {
        return this == TRANSITION || this == CONFLICT || this == VIOLATION;
    }

    public static Optional<MarkerType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag))
                .findFirst();
    }
}
