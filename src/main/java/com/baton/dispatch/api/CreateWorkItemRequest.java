package com.baton.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/work-items.
 *
 * @param title  issue title
 * @param body   issue body; nullable
 * @param epicId parent epic; nullable for standalone work
 * @param wave   wave tag ("1", "2", "eval", "fix"); nullable
 * @param labels extra labels; nullable
 * @param epic   create an epic instead of a work item
 */
public record CreateWorkItemRequest(
    String title,
    String body,
    @JsonProperty("epic_id") String epicId,
    String wave,
    List<String> labels,
    boolean epic
) {}
