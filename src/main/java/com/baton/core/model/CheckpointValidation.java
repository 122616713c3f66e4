package com.baton.core.model;

import java.util.List;

/**
 * Result of validating a checkpoint-bearing status event.
 *
 * @param eventId  the validated event
 * @param valid    true when every required section is present and the next action is concrete
 * @param missing  names of missing or unusable sections
 * @param reason   human-readable summary
 */
public record CheckpointValidation(String eventId, boolean valid, List<String> missing, String reason) {

    public CheckpointValidation {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static CheckpointValidation ok(String eventId) {
        return new CheckpointValidation(eventId, true, List.of(), "Checkpoint complete");
    }

    public static CheckpointValidation incomplete(String eventId, List<String> missing) {
        return new CheckpointValidation(eventId, false, missing,
                "Checkpoint incomplete: " + String.join(", ", missing));
    }
}
