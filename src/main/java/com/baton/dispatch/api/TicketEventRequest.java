package com.baton.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Webhook body for POST /api/v1/events.
 *
 * @param type      ISSUE_OPENED, ISSUE_LABELED, ISSUE_ASSIGNED or COMMENT_CREATED
 * @param issueId   the issue the event happened on
 * @param actor     who caused it
 * @param commentId new comment id; COMMENT_CREATED only
 * @param label     added label; ISSUE_LABELED only
 */
public record TicketEventRequest(
    String type,
    @JsonProperty("issue_id") String issueId,
    String actor,
    @JsonProperty("comment_id") String commentId,
    String label
) {}
