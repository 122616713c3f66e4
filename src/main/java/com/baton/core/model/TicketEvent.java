package com.baton.core.model;

import java.io.Serializable;

/**
 * A change notification from the ticket store.
 *
 * @param type      what happened
 * @param issueId   the issue it happened on
 * @param actor     who caused it
 * @param commentId the new comment, for {@link TicketEventType#COMMENT_CREATED}
 * @param label     the added label, for {@link TicketEventType#ISSUE_LABELED}
 */
public record TicketEvent(
    TicketEventType type,
    String issueId,
    String actor,
    String commentId,
    String label
) implements Serializable {

    public static TicketEvent commentCreated(String issueId, String actor, String commentId) {
        return new TicketEvent(TicketEventType.COMMENT_CREATED, issueId, actor, commentId, null);
    }

    public static TicketEvent issueOpened(String issueId, String actor) {
        return new TicketEvent(TicketEventType.ISSUE_OPENED, issueId, actor, null, null);
    }

    public static TicketEvent issueLabeled(String issueId, String actor, String label) {
        return new TicketEvent(TicketEventType.ISSUE_LABELED, issueId, actor, null, label);
    }

    public static TicketEvent issueAssigned(String issueId, String actor) {
        return new TicketEvent(TicketEventType.ISSUE_ASSIGNED, issueId, actor, null, null);
    }
}
