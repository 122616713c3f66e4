package com.baton.core.store;

/**
 * Open/closed state of an issue in the external ticket store.
 */
public enum IssueState {
    OPEN,
    CLOSED
}
