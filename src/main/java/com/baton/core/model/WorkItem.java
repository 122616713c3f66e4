package com.baton.core.model;

import com.baton.core.marker.MarkerType;
import com.baton.core.store.IssueState;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A unit of trackable work, projected from a ticket-store issue and its comments.
 *
 * @param id        issue id
 * @param title     issue title
 * @param body      issue body
 * @param phase     current phase (from the engine-owned {@code state:} label)
 * @param labels    all labels on the issue
 * @param assignee  assigned actor, or null
 * @param epicId    parent epic id, or null
 * @param wave      wave within the epic, or null when untagged
 * @param events    comments in posting order
 * @param state     open/closed state in the store
 * @param revision  store revision the projection was read at
 */
public record WorkItem(
    String id,
    String title,
    String body,
    Phase phase,
    Set<String> labels,
    String assignee,
    String epicId,
    Wave wave,
    List<StatusEvent> events,
    IssueState state,
    long revision
) implements Serializable {

    public static final String UNRECOVERABLE_LABEL = "unrecoverable-state";

    public WorkItem {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }

    public boolean isUnrecoverable() {
        return labels.contains(UNRECOVERABLE_LABEL);
    }

    /** Thread types whose {@code phase:*} label is currently present. */
    public List<ThreadType> phaseLabels() {
        return labels.stream()
                .map(ThreadType::fromLabel)
                .flatMap(Optional::stream)
                .sorted()
                .toList();
    }

    /** Every block of the given type, in posting order. */
    public List<MarkedEvent> marked(MarkerType type) {
        var result = new ArrayList<MarkedEvent>();
        for (int i = 0; i < events.size(); i++) {
            StatusEvent event = events.get(i);
            int index = i;
            event.blocks().stream()
                    .filter(b -> b.type() == type)
                    .forEach(b -> result.add(new MarkedEvent(event, b, index)));
        }
        return result;
    }

    public Optional<MarkedEvent> latest(MarkerType type) {
        List<MarkedEvent> all = marked(type);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public Optional<StatusEvent> event(String eventId) {
        return events.stream().filter(e -> e.id().equals(eventId)).findFirst();
    }

    public int indexOf(String eventId) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).id().equals(eventId)) return i;
        }
        return -1;
    }

    /** Transitions recorded on this item, oldest first. */
    public List<TransitionRecord> transitions() {
        return marked(MarkerType.TRANSITION).stream()
                .map(TransitionRecord::from)
                .flatMap(Optional::stream)
                .toList();
    }
}
