package com.baton.core.checkpoint;

import com.baton.core.concurrency.OptimisticUpdater;
import com.baton.core.config.BatonProperties;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.metrics.BatonMetrics;
import com.baton.core.model.Checkpoint;
import com.baton.core.model.CheckpointValidation;
import com.baton.core.model.MarkedEvent;
import com.baton.core.model.Phase;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.ViolationKind;
import com.baton.core.model.WorkItem;
import com.baton.core.store.Comment;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.violation.ViolationEngine;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Records and validates checkpoints, the structured snapshots that let another actor
 * resume a work item.
 * <p>
 * An incomplete checkpoint marks the item {@code unrecoverable-state}, which blocks phase
 * transitions until a later valid checkpoint removes the label.
 */
@Service
public class CheckpointValidator {

    private static final Logger log = LoggerFactory.getLogger(CheckpointValidator.class);

    private static final List<String> LIST_SECTIONS = List.of(
            Checkpoint.COMPLETED, Checkpoint.IN_PROGRESS, Checkpoint.PENDING, Checkpoint.CHANGED, Checkpoint.COMMITS);

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final ViolationEngine violationEngine;
    private final EventBus eventBus;
    private final BatonMetrics metrics;
    private final Set<String> placeholderActions;
    private final String engineActor;

    public CheckpointValidator(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                               ViolationEngine violationEngine, EventBus eventBus, BatonMetrics metrics,
                               BatonProperties properties) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.violationEngine = violationEngine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.engineActor = properties.getEngineActor();
        this.placeholderActions = properties.getCheckpoint().getPlaceholderActions().stream()
                .map(CheckpointValidator::normalizeAction)
                .collect(Collectors.toSet());
    }

    /**
     * Checks that the event carries a checkpoint block with every section and a concrete
     * next action. Has no side effects.
     */
    public CheckpointValidation validateCheckpoint(StatusEvent event) {
        Optional<MarkerBlock> block = event.block(MarkerType.CHECKPOINT);
        CheckpointValidation result;
        if (block.isEmpty()) {
            result = CheckpointValidation.incomplete(event.id(), List.of("checkpoint"));
        } else {
            List<String> missing = missingSections(block.get());
            result = missing.isEmpty()
                    ? CheckpointValidation.ok(event.id())
                    : CheckpointValidation.incomplete(event.id(), missing);
        }
        metrics.recordCheckpointValidation(result.valid());
        return result;
    }

    /** Like {@link #validateCheckpoint} but throws {@link RuleViolation#INCOMPLETE_CHECKPOINT}. */
    public CheckpointValidation requireValid(String workItemId, StatusEvent event) {
        CheckpointValidation result = validateCheckpoint(event);
        if (!result.valid()) {
            throw new CoordinationException(RuleViolation.INCOMPLETE_CHECKPOINT, workItemId, result.reason());
        }
        return result;
    }

    public Optional<MarkedEvent> latestCheckpoint(WorkItem item) {
        return item.latest(MarkerType.CHECKPOINT);
    }

    /**
     * Validates the item's most recent checkpoint and keeps the {@code unrecoverable-state}
     * label in line with the result. An item that never posted a checkpoint is reported
     * incomplete but not flagged.
     */
    public CheckpointValidation validateLatest(String workItemId) {
        WorkItem item = repository.get(workItemId);
        Optional<MarkedEvent> latest = latestCheckpoint(item);
        if (latest.isEmpty()) {
            return CheckpointValidation.incomplete(null, List.of("checkpoint"));
        }
        CheckpointValidation result = validateCheckpoint(latest.get().event());
        if (item.phase() != Phase.COMPLETED) {
            setUnrecoverable(item.id(), !result.valid());
        }
        return result;
    }

    /**
     * Reaction to a checkpoint-bearing comment: validates it, flags or recovers the item,
     * records {@code MISSING_CHECKPOINT} against the author of an incomplete one, and checks
     * that checkpoints inside a test thread do not author changes.
     */
    public CheckpointValidation onStatusComment(String workItemId, StatusEvent event) {
        CheckpointValidation result = validateCheckpoint(event);
        WorkItem item = repository.get(workItemId);
        if (item.phase() == Phase.COMPLETED) {
            return result;
        }

        setUnrecoverable(item.id(), !result.valid());
        if (!result.valid()) {
            log.warn("Incomplete checkpoint {} on {} by {}: missing {}", event.id(), item.id(), event.author(),
                    result.missing());
            violationEngine.recordViolation(event.author(), item.id(), ViolationKind.MISSING_CHECKPOINT,
                    "Checkpoint " + event.id() + " is missing " + String.join(", ", result.missing()));
        } else {
            log.info("Checkpoint {} on {} is complete", event.id(), item.id());
        }

        if (item.phase() == Phase.TEST_OPEN) {
            event.block(MarkerType.CHECKPOINT).map(Checkpoint::from).ifPresent(checkpoint -> {
                if (!checkpoint.changed().isEmpty() || !checkpoint.commits().isEmpty()) {
                    violationEngine.recordViolation(event.author(), item.id(), ViolationKind.TEST_SCOPE_EXCEEDED,
                            "Test-thread checkpoint " + event.id() + " lists changes " + checkpoint.changed()
                                    + " and commits " + checkpoint.commits());
                }
            });
        }

        eventBus.publish(new CoordinationEvent(CoordinationEvent.CHECKPOINT_VALIDATED, item.id(), item.epicId(),
                event.author(), Map.of("eventId", event.id(), "valid", result.valid(), "missing", result.missing()),
                Instant.now()));
        return result;
    }

    /** Posts a checkpoint on behalf of {@code actor} and validates it. */
    public CheckpointValidation recordCheckpoint(String workItemId, String actor, Checkpoint checkpoint) {
        WorkItem item = repository.get(workItemId);
        if (item.phase() == Phase.COMPLETED) {
            throw new CoordinationException(RuleViolation.WORK_ITEM_COMPLETED, item.id(),
                    "Work item " + item.id() + " is completed; no further checkpoints are accepted");
        }
        Comment comment = store.postComment(item.id(), actor,
                Markers.render("Checkpoint by @" + actor + ".", checkpoint.toBlock()));
        return onStatusComment(item.id(), StatusEvent.of(comment, engineActor));
    }

    /**
     * Closure gate: the latest checkpoint must be complete and state the terminal outcome.
     */
    public Checkpoint requireFinalCheckpoint(WorkItem item) {
        MarkedEvent latest = latestCheckpoint(item).orElseThrow(() ->
                new CoordinationException(RuleViolation.INCOMPLETE_CHECKPOINT, item.id(),
                        "Work item " + item.id() + " has no checkpoint; post a final checkpoint with the outcome"));
        requireValid(item.id(), latest.event());
        Checkpoint checkpoint = Checkpoint.from(latest.block());
        if (checkpoint.outcome() == null || checkpoint.outcome().isBlank()) {
            throw new CoordinationException(RuleViolation.INCOMPLETE_CHECKPOINT, item.id(),
                    "Final checkpoint " + latest.event().id() + " on " + item.id() + " does not state the outcome");
        }
        return checkpoint;
    }

    List<String> missingSections(MarkerBlock block) {
        var missing = new ArrayList<String>();
        if (block.text(Checkpoint.WORK_LOG).isEmpty()) missing.add(Checkpoint.WORK_LOG);
        for (String section : LIST_SECTIONS) {
            if (!block.has(section)) missing.add(section);
        }
        if (block.text(Checkpoint.BRANCH).isEmpty()) missing.add(Checkpoint.BRANCH);
        String next = block.text(Checkpoint.NEXT_ACTION);
        if (next.isEmpty() || placeholderActions.contains(normalizeAction(next))) {
            missing.add(Checkpoint.NEXT_ACTION);
        }
        return missing;
    }

    private void setUnrecoverable(String workItemId, boolean flagged) {
        boolean changed = updater.update(workItemId, item -> {
            if (item.isUnrecoverable() == flagged) return false;
            Set<String> label = Set.of(WorkItem.UNRECOVERABLE_LABEL);
            store.updateLabels(item.id(), item.revision(), flagged ? label : Set.of(), flagged ? Set.of() : label);
            return true;
        });
        if (changed) {
            log.info("{} {} on {}", flagged ? "Set" : "Removed", WorkItem.UNRECOVERABLE_LABEL, workItemId);
        }
    }

    private static String normalizeAction(String action) {
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        while (normalized.length() > 1 && (normalized.endsWith(".") || normalized.endsWith("!"))) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized;
    }
}
