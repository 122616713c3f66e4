package com.baton.core.model;

/**
 * Ticket-store automation triggers the engine reacts to.
 */
public enum TicketEventType {
    ISSUE_OPENED,
    ISSUE_LABELED,
    ISSUE_ASSIGNED,
    COMMENT_CREATED
}
