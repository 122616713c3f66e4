package com.baton.core.store;

import java.util.Set;

/**
 * Filter for listing issues. Null fields do not filter.
 *
 * @param parentId only children of this issue
 * @param labels   issues carrying all of these labels
 * @param state    only issues in this state
 */
public record IssueQuery(String parentId, Set<String> labels, IssueState state) {

    public IssueQuery {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
    }

    public static IssueQuery all() {
        return new IssueQuery(null, Set.of(), null);
    }

    public static IssueQuery childrenOf(String parentId) {
        return new IssueQuery(parentId, Set.of(), null);
    }

    public static IssueQuery withLabel(String label) {
        return new IssueQuery(null, Set.of(label), null);
    }

    public boolean matches(Issue issue) {
        if (parentId != null && !parentId.equals(issue.parentId())) return false;
        if (state != null && state != issue.state()) return false;
        return issue.labels().containsAll(labels);
    }
}
