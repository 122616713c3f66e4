package com.baton.core.store;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of an issue as read from the ticket store.
 *
 * @param id        issue identifier (e.g. "42")
 * @param title     issue title
 * @param body      free-text body
 * @param labels    labels attached at the time of the read
 * @param assignee  assigned actor, or null
 * @param parentId  id of the parent (epic) issue, or null
 * @param state     open or closed
 * @param revision  monotonically increasing revision marker, bumped by every write
 * @param updatedAt time of the last write
 */
public record Issue(
    String id,
    String title,
    String body,
    Set<String> labels,
    String assignee,
    String parentId,
    IssueState state,
    long revision,
    Instant updatedAt
) implements Serializable {

    public Issue {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }
}
