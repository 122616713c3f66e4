package com.baton.core.error;

/**
 * Thrown when a referenced work item or epic does not exist in the ticket store.
 */
public class WorkItemNotFoundException extends RuntimeException {

    private final String workItemId;

    public WorkItemNotFoundException(String workItemId) {
        super("Work item not found: " + workItemId);
        this.workItemId = workItemId;
    }

    public String getWorkItemId() {
        return workItemId;
    }
}
