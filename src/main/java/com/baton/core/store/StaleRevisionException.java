package com.baton.core.store;

/**
 * Thrown by a conditional write when the issue changed since it was read.
 * Callers re-read and retry; the write is never applied over the newer revision.
 */
public class StaleRevisionException extends TicketStoreException {

    private final String issueId;
    private final long expectedRevision;
    private final long actualRevision;

    public StaleRevisionException(String issueId, long expectedRevision, long actualRevision) {
        super("Issue " + issueId + " is at revision " + actualRevision + ", expected " + expectedRevision);
        this.issueId = issueId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public String getIssueId() {
        return issueId;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
