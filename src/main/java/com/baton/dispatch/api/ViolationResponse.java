package com.baton.dispatch.api;

import com.baton.core.model.Violation;

public record ViolationResponse(String actor, String kind, String label, int occurrences, String level) {

    public static ViolationResponse from(Violation violation) {
        return new ViolationResponse(violation.actor(), violation.kind().name(), violation.kind().label(),
                violation.occurrences(), violation.level().name());
    }
}
