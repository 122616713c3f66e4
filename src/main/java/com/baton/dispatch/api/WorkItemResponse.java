package com.baton.dispatch.api;

import com.baton.core.model.ScopeDeclaration;
import com.baton.core.model.ThreadType;
import com.baton.core.model.WorkItem;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outbound JSON for a work item.
 */
public record WorkItemResponse(
    String id,
    String title,
    String phase,
    @JsonProperty("status_label") String statusLabel,
    @JsonProperty("open_thread") String openThread,
    List<String> labels,
    String assignee,
    @JsonProperty("epic_id") String epicId,
    String wave,
    String state,
    long revision,
    List<String> claimed,
    List<String> excluded,
    @JsonProperty("event_count") int eventCount
) {
    public static WorkItemResponse from(WorkItem item) {
        var scope = ScopeDeclaration.of(item);
        return new WorkItemResponse(
                item.id(),
                item.title(),
                item.phase().tag(),
                item.phase().statusLabel().label(),
                item.phase().openThread().map(ThreadType::tag).orElse(null),
                item.labels().stream().sorted().toList(),
                item.assignee(),
                item.epicId(),
                item.wave() != null ? item.wave().toString() : null,
                item.state().name(),
                item.revision(),
                scope.map(ScopeDeclaration::claimed).orElse(List.of()),
                scope.map(ScopeDeclaration::excluded).orElse(List.of()),
                item.events().size());
    }
}
