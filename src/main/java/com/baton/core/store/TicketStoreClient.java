package com.baton.core.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Narrow client over the external ticket store (issues, labels, comments, assignees).
 * <p>
 * Every write that takes an {@code expectedRevision} is conditional: it fails with
 * {@link StaleRevisionException} when the issue's current revision differs. The store
 * offers no multi-issue transactions; cross-issue consistency is the caller's concern.
 */
public interface TicketStoreClient {

    Issue createIssue(NewIssue request);

    Optional<Issue> findIssue(String issueId);

    List<Issue> listIssues(IssueQuery query);

    /**
     * Adds and removes labels in one conditional write.
     */
    Issue updateLabels(String issueId, long expectedRevision, Set<String> add, Set<String> remove);

    /**
     * Appends a comment unconditionally.
     */
    Comment postComment(String issueId, String author, String body);

    /**
     * Appends a comment only if the issue is still at {@code expectedRevision}.
     */
    Comment postComment(String issueId, long expectedRevision, String author, String body);

    List<Comment> listComments(String issueId);

    /**
     * Sets the assignee; {@code null} clears it.
     */
    Issue assign(String issueId, long expectedRevision, String assignee);

    Issue close(String issueId, long expectedRevision);

    Issue reopen(String issueId, long expectedRevision);
}
