package com.baton.dispatch.api;

import com.baton.core.model.TransitionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TransitionResponse(
    @JsonProperty("work_item_id") String workItemId,
    String from,
    String to,
    String actor,
    List<ViolationResponse> violations
) {
    public static TransitionResponse from(TransitionResult result) {
        return new TransitionResponse(result.workItemId(), result.from().tag(), result.to().tag(), result.actor(),
                result.violations().stream().map(ViolationResponse::from).toList());
    }
}
