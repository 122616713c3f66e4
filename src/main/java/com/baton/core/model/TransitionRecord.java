package com.baton.core.model;

import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;

import java.util.Optional;

/**
 * An engine-authored record of a committed phase transition.
 *
 * @param eventId id of the comment holding the record
 * @param index   position of that comment on the work item
 */
public record TransitionRecord(Phase from, Phase to, String actor, String eventId, int index) {

    public static Optional<TransitionRecord> from(MarkedEvent marked) {
        if (marked.block().type() != MarkerType.TRANSITION) return Optional.empty();
        MarkerBlock block = marked.block();
        Optional<Phase> from = Phase.fromTag(block.text("from"));
        Optional<Phase> to = Phase.fromTag(block.text("to"));
        if (from.isEmpty() || to.isEmpty()) return Optional.empty();
        return Optional.of(new TransitionRecord(from.get(), to.get(), block.text("actor"),
                marked.event().id(), marked.index()));
    }

    public Optional<ThreadType> openedThread() {
        return to.openThread();
    }
}
