package com.baton.core.violation;

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
import com.baton.core.model.EnforcementAction;
import com.baton.core.model.EnforcementLevel;
import com.baton.core.model.MarkedEvent;
import com.baton.core.model.Phase;
import com.baton.core.model.Violation;
import com.baton.core.model.ViolationKind;
import com.baton.core.model.WorkItem;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Progressive enforcement of protocol violations.
 * <p>
 * Each occurrence is appended to the work item as a violation record, so the counter for an
 * (actor, kind, work item) triple is the number of records since the last clear of that kind.
 * Levels follow {@link EnforcementLevel#forOccurrences}: a reminder, then a warning that adds the
 * durable {@code violation:*} label, then a block that refuses merge, close and wave-advance
 * until a correction referencing the violation is posted. Counters never decay with time.
 */
@Service
public class ViolationEngine {

    private static final Logger log = LoggerFactory.getLogger(ViolationEngine.class);

    static final String STATUS = "status";
    static final String RECORDED = "recorded";
    static final String CLEARED = "cleared";

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final EventBus eventBus;
    private final BatonMetrics metrics;
    private final String engineActor;

    public ViolationEngine(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                           EventBus eventBus, BatonMetrics metrics, BatonProperties properties) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.engineActor = properties.getEngineActor();
    }

    /**
     * Records one occurrence of {@code kind} by {@code actor} on the work item and applies
     * the resulting enforcement level.
     *
     * @param detail short description of what triggered the violation
     * @return the triple's standing after this occurrence
     */
    public Violation recordViolation(String actor, String workItemId, ViolationKind kind, String detail) {
        Violation violation = updater.update(workItemId, item -> {
            // An unresolved conflict is charged against the closure itself, after it commits.
            if (item.phase() == Phase.COMPLETED && kind != ViolationKind.UNRESOLVED_SCOPE_CONFLICT) {
                throw new CoordinationException(RuleViolation.WORK_ITEM_COMPLETED, item.id(),
                        "Work item " + item.id() + " is completed; no further records are accepted");
            }
            int occurrences = occurrences(item, actor, kind) + 1;
            var recorded = new Violation(actor, item.id(), kind, occurrences,
                    EnforcementLevel.forOccurrences(occurrences));
            store.postComment(item.id(), item.revision(), engineActor, render(recorded, detail));
            return recorded;
        });

        if (violation.level().atLeast(EnforcementLevel.WARNING)) {
            addLabel(workItemId, kind.label());
        }

        log.info("Violation {} by {} on {}: occurrence {} -> {}", kind, actor, workItemId,
                violation.occurrences(), violation.level());
        metrics.recordViolation(kind.name(), violation.level().name());
        WorkItem item = repository.get(workItemId);
        eventBus.publish(new CoordinationEvent(CoordinationEvent.VIOLATION_RECORDED, violation.workItemId(),
                item.epicId(), actor,
                Map.of("kind", kind.name(), "level", violation.level().name(),
                        "occurrences", violation.occurrences(), "detail", detail != null ? detail : ""),
                Instant.now()));
        return violation;
    }

    /**
     * Resets the counter for {@code kind} on the work item to zero for every actor.
     * <p>
     * Only valid when {@code correctionEventId} is a correction block on this work item that
     * references an active violation record of that kind.
     *
     * @return number of occurrences cleared
     */
    public int clearViolation(String workItemId, ViolationKind kind, String actor, String correctionEventId) {
        int cleared = updater.update(workItemId, item -> {
            MarkerBlock correction = item.event(correctionEventId)
                    .flatMap(e -> e.block(MarkerType.CORRECTION))
                    .orElseThrow(() -> new CoordinationException(RuleViolation.CORRECTION_REQUIRED, item.id(),
                            "Event " + correctionEventId + " is not a correction posted on " + item.id()));

            String referenced = correction.text("violation");
            List<MarkedEvent> active = activeRecords(item, kind);
            boolean referencesActive = active.stream().anyMatch(m -> m.event().id().equals(referenced));
            if (!referencesActive) {
                throw new CoordinationException(RuleViolation.CORRECTION_REQUIRED, item.id(),
                        "Correction " + correctionEventId + " does not reference an active " + kind
                                + " violation on " + item.id());
            }
            if (item.indexOf(correctionEventId) < item.indexOf(referenced)) {
                throw new CoordinationException(RuleViolation.CORRECTION_REQUIRED, item.id(),
                        "Correction " + correctionEventId + " predates violation " + referenced);
            }

            var block = MarkerBlock.builder(MarkerType.VIOLATION)
                    .field(STATUS, CLEARED)
                    .field("kind", kind.name())
                    .field("correction", correctionEventId)
                    .field("cleared-by", actor)
                    .build();
            store.postComment(item.id(), item.revision(), engineActor,
                    Markers.render("Cleared " + kind + " violations after correction " + correctionEventId + ".", block));
            return active.size();
        });

        WorkItem item = repository.get(workItemId);
        boolean labelStillNeeded = currentViolations(item).stream()
                .anyMatch(v -> v.kind().label().equals(kind.label()) && v.level().atLeast(EnforcementLevel.WARNING));
        if (!labelStillNeeded && item.hasLabel(kind.label())) {
            removeLabel(workItemId, kind.label());
        }

        log.info("Cleared {} {} occurrence(s) on {} via correction {}", cleared, kind, workItemId, correctionEventId);
        eventBus.publish(new CoordinationEvent(CoordinationEvent.VIOLATION_CLEARED, item.id(), item.epicId(), actor,
                Map.of("kind", kind.name(), "cleared", cleared, "correction", correctionEventId), Instant.now()));
        return cleared;
    }

    /** Active (non-zero) standings on the work item, one per (actor, kind). */
    public List<Violation> currentViolations(WorkItem item) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, ViolationKind> kinds = new HashMap<>();
        Map<String, String> actors = new HashMap<>();
        for (MarkedEvent marked : item.marked(MarkerType.VIOLATION)) {
            MarkerBlock block = marked.block();
            Optional<ViolationKind> kind = parseKind(block.text("kind"));
            if (kind.isEmpty()) continue;
            if (CLEARED.equals(block.text(STATUS))) {
                counts.keySet().removeIf(key -> kinds.get(key) == kind.get());
                continue;
            }
            String actor = block.text("actor");
            String key = actor + "|" + kind.get();
            counts.merge(key, 1, Integer::sum);
            kinds.put(key, kind.get());
            actors.put(key, actor);
        }
        var result = new ArrayList<Violation>();
        counts.forEach((key, count) -> result.add(new Violation(actors.get(key), item.id(), kinds.get(key), count,
                EnforcementLevel.forOccurrences(count))));
        return result;
    }

    public EnforcementLevel level(WorkItem item, String actor, ViolationKind kind) {
        return EnforcementLevel.forOccurrences(occurrences(item, actor, kind));
    }

    public List<Violation> blockingViolations(WorkItem item) {
        return currentViolations(item).stream().filter(Violation::isBlocking).toList();
    }

    /**
     * Refuses a dependent action while any violation on the item is at block level.
     */
    public void assertAllowed(WorkItem item, EnforcementAction action) {
        if (isAllowed(item, action)) return;
        List<Violation> blocking = blockingViolations(item);
        String kinds = String.join(", ", blocking.stream().map(v -> v.kind() + " (" + v.actor() + ")").toList());
        throw new CoordinationException(RuleViolation.VIOLATION_BLOCKED, item.id(),
                action + " refused on " + item.id() + ": blocking violations " + kinds
                        + " must be cleared by a correction first");
    }

    public boolean isAllowed(WorkItem item, EnforcementAction action) {
        return !refusedActions(item).contains(action);
    }

    /** A block-level violation refuses every dependent action at once. */
    public Set<EnforcementAction> refusedActions(WorkItem item) {
        return blockingViolations(item).isEmpty()
                ? EnumSet.noneOf(EnforcementAction.class)
                : EnumSet.allOf(EnforcementAction.class);
    }

    public int occurrences(WorkItem item, String actor, ViolationKind kind) {
        return (int) activeRecords(item, kind).stream()
                .filter(m -> Objects.equals(actor, m.block().text("actor")))
                .count();
    }

    /** Violation records of {@code kind} posted after the latest clear of that kind. */
    private List<MarkedEvent> activeRecords(WorkItem item, ViolationKind kind) {
        var active = new ArrayList<MarkedEvent>();
        for (MarkedEvent marked : item.marked(MarkerType.VIOLATION)) {
            if (parseKind(marked.block().text("kind")).orElse(null) != kind) continue;
            if (CLEARED.equals(marked.block().text(STATUS))) {
                active.clear();
            } else {
                active.add(marked);
            }
        }
        return active;
    }

    private void addLabel(String workItemId, String label) {
        updater.update(workItemId, item -> {
            if (item.hasLabel(label)) return false;
            store.updateLabels(item.id(), item.revision(), Set.of(label), Set.of());
            return true;
        });
    }

    private void removeLabel(String workItemId, String label) {
        updater.update(workItemId, item -> {
            if (!item.hasLabel(label)) return false;
            store.updateLabels(item.id(), item.revision(), Set.of(), Set.of(label));
            return true;
        });
    }

    private String render(Violation violation, String detail) {
        String who = "@" + violation.actor();
        String summary = switch (violation.level()) {
            case REMINDER -> "Reminder for " + who + ": " + describe(violation.kind()) + ".";
            case WARNING -> "Warning for " + who + ": " + describe(violation.kind())
                    + " (2nd occurrence). Marked with `" + violation.kind().label() + "`.";
            case BLOCK -> "Blocked: " + who + " " + describe(violation.kind()) + " (occurrence "
                    + violation.occurrences() + "). Merge, close and wave-advance are refused until a correction"
                    + " referencing this event is posted.";
            case NONE -> describe(violation.kind());
        };
        var block = MarkerBlock.builder(MarkerType.VIOLATION)
                .field(STATUS, RECORDED)
                .field("actor", violation.actor())
                .field("kind", violation.kind().name())
                .field("occurrence", String.valueOf(violation.occurrences()))
                .field("level", violation.level().name());
        if (detail != null && !detail.isBlank()) {
            block.field("detail", detail);
        }
        return Markers.render(summary, block.build());
    }

    static String describe(ViolationKind kind) {
        return switch (kind) {
            case MISSING_SCOPE_DECLARATION -> "work started without a scope declaration";
            case WRONG_ORDER_CLAIM -> "claimed a work item before its preceding wave completed";
            case VERDICT_OUTSIDE_REVIEW -> "posted a verdict outside a review thread";
            case TEST_SCOPE_EXCEEDED -> "authored changes inside a test thread";
            case INVALID_DEMOTION -> "attempted to demote from review to test";
            case SELF_APPROVAL -> "acted as tester or reviewer of their own change";
            case MISSING_CHECKPOINT -> "posted a missing or malformed checkpoint";
            case INCOMPLETE_INIT -> "did not post the thread preamble after opening a thread";
            case UNRESOLVED_SCOPE_CONFLICT -> "closed with an unresolved scope conflict";
        };
    }

    private static Optional<ViolationKind> parseKind(String value) {
        try {
            return value.isEmpty() ? Optional.empty() : Optional.of(ViolationKind.valueOf(value));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring violation record with unknown kind '{}'", value);
            return Optional.empty();
        }
    }
}
