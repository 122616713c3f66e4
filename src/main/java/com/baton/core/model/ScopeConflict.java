package com.baton.core.model;

import java.io.Serializable;
import java.util.Set;
import java.util.TreeSet;

/**
 * Advisory notice that two in-progress work items of one epic claim overlapping resources.
 *
 * @param workItemId    the item being notified
 * @param counterpartId the other item
 * @param resources     overlapping resources
 */
public record ScopeConflict(String workItemId, String counterpartId, Set<String> resources) implements Serializable {

    public ScopeConflict {
        resources = resources == null ? Set.of() : java.util.Collections.unmodifiableSet(new TreeSet<>(resources));
    }

    public ScopeConflict mirror() {
        return new ScopeConflict(counterpartId, workItemId, resources);
    }
}
