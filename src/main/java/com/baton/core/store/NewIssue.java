package com.baton.core.store;

import java.util.Set;

/**
 * Request to create an issue.
 *
 * @param id       requested id, or null to let the store allocate one
 * @param title    issue title
 * @param body     issue body
 * @param labels   initial labels
 * @param parentId parent (epic) issue id, or null
 */
public record NewIssue(
    String id,
    String title,
    String body,
    Set<String> labels,
    String parentId
) {
    public NewIssue {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
    }
}
