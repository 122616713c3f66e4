package com.baton.dispatch.api;

import com.baton.core.model.ScopeConflict;
import com.baton.core.model.ScopeDeclarationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScopeResponse(
    @JsonProperty("work_item_id") String workItemId,
    List<String> claimed,
    List<String> excluded,
    String sequence,
    String actor,
    List<ConflictResponse> conflicts
) {
    public record ConflictResponse(String counterpart, List<String> resources) {
        static ConflictResponse from(ScopeConflict conflict) {
            return new ConflictResponse(conflict.counterpartId(), List.copyOf(conflict.resources()));
        }
    }

    public static ScopeResponse from(ScopeDeclarationResult result) {
        var declaration = result.declaration();
        return new ScopeResponse(declaration.workItemId(), declaration.claimed(), declaration.excluded(),
                declaration.sequence(), declaration.actor(),
                result.conflicts().stream().map(ConflictResponse::from).toList());
    }
}
