package com.baton.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * A work item grouping child work items into ordered waves.
 */
public record Epic(String id, String title, List<WorkItem> children) implements Serializable {

    public Epic {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Waves that have at least one child, in order. */
    public List<Wave> waves() {
        var waves = new TreeSet<Wave>();
        for (WorkItem child : children) {
            if (child.wave() != null) waves.add(child.wave());
        }
        return List.copyOf(waves);
    }

    public List<WorkItem> itemsIn(Wave wave) {
        return children.stream().filter(c -> wave.equals(c.wave())).toList();
    }

    /** Lowest wave that still holds a non-completed child. */
    public Optional<Wave> activeWave() {
        return waves().stream()
                .filter(w -> itemsIn(w).stream().anyMatch(c -> c.phase() != Phase.COMPLETED))
                .findFirst();
    }

    public Optional<Integer> highestNumberedWave() {
        return waves().stream().filter(Wave::isNumbered).map(Wave::number).max(Integer::compare);
    }
}
