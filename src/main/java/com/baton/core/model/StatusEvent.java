package com.baton.core.model;

import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.store.Comment;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A comment on a work item, viewed as a protocol event.
 * <p>
 * Engine-authored blocks only count when the comment was posted by the engine actor;
 * the same blocks in anyone else's comment are invisible.
 */
public record StatusEvent(
    String id,
    String author,
    String body,
    Instant createdAt,
    boolean fromEngine
) implements Serializable {

    public static StatusEvent of(Comment comment, String engineActor) {
        return new StatusEvent(comment.id(), comment.author(), comment.body(), comment.createdAt(),
                engineActor != null && engineActor.equals(comment.author()));
    }

    public List<MarkerBlock> blocks() {
        return Markers.parse(body).stream()
                .filter(this::trusted)
                .toList();
    }

    public Optional<MarkerBlock> block(MarkerType type) {
        if (type.isEngineAuthored() && !fromEngine) return Optional.empty();
        return Markers.find(body, type);
    }

    public boolean has(MarkerType type) {
        return block(type).isPresent();
    }

    private boolean trusted(MarkerBlock block) {
        return fromEngine || !block.type().isEngineAuthored();
    }
}
