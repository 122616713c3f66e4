package com.baton.core.scope;

import com.baton.core.concurrency.OptimisticUpdater;
import com.baton.core.config.BatonProperties;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.metrics.BatonMetrics;
import com.baton.core.model.MarkedEvent;
import com.baton.core.model.Phase;
import com.baton.core.model.ScopeConflict;
import com.baton.core.model.ScopeDeclaration;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.WorkItem;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Advisory detection of overlapping scope declarations between in-progress siblings.
 * <p>
 * Each side of a conflicting pair gets exactly one conflict record. The record is written
 * conditionally and skipped when the pair is already on file, so concurrent scans from both
 * sides never duplicate a notification. Conflicts never block transitions.
 */
@Service
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    static final String STATUS = "status";
    static final String OPEN = "open";
    static final String RESOLVED = "resolved";
    static final String COUNTERPART = "counterpart";

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final EventBus eventBus;
    private final BatonMetrics metrics;
    private final String engineActor;

    public ConflictDetector(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                            EventBus eventBus, BatonMetrics metrics, BatonProperties properties) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.engineActor = properties.getEngineActor();
    }

    /**
     * Compares the item's declaration with every in-progress sibling that has one and
     * notifies both sides of each overlap.
     *
     * @return conflicts from the point of view of {@code workItemId}
     */
    public List<ScopeConflict> scan(String workItemId) {
        WorkItem item = repository.get(workItemId);
        Optional<ScopeDeclaration> declaration = ScopeDeclaration.of(item);
        if (declaration.isEmpty() || !item.phase().isInProgress()) {
            log.debug("Skipping conflict scan for {}: phase {}, declared {}", item.id(), item.phase(),
                    declaration.isPresent());
            return List.of();
        }

        var conflicts = new ArrayList<ScopeConflict>();
        for (WorkItem sibling : repository.siblings(item)) {
            if (!sibling.phase().isInProgress()) continue;
            Optional<ScopeDeclaration> other = ScopeDeclaration.of(sibling);
            if (other.isEmpty()) continue;

            Set<String> overlap = ResourceMatcher.overlap(declaration.get().claimed(), other.get().claimed());
            if (overlap.isEmpty()) continue;

            var conflict = new ScopeConflict(item.id(), sibling.id(), overlap);
            conflicts.add(conflict);
            notifySide(conflict, item.epicId());
            notifySide(conflict.mirror(), item.epicId());
        }
        if (!conflicts.isEmpty()) {
            log.info("Scope of {} overlaps {} sibling(s)", item.id(), conflicts.size());
        }
        return conflicts;
    }

    /**
     * Handles a resolution block posted on {@code workItemId}. The pair is marked resolved
     * on both sides once both carry a resolution naming each other with the same key.
     *
     * @return true if this resolution completed the pair
     */
    public boolean onResolution(String workItemId, StatusEvent event) {
        Optional<MarkerBlock> resolution = event.block(MarkerType.RESOLUTION);
        if (resolution.isEmpty()) return false;

        String counterpartId = WorkItemRepository.normalizeId(resolution.get().text(COUNTERPART));
        String key = resolution.get().text("key");
        if (counterpartId == null || counterpartId.isEmpty() || key.isEmpty()) {
            log.warn("Resolution {} on {} lacks a counterpart or key", event.id(), workItemId);
            return false;
        }

        WorkItem item = repository.get(workItemId);
        Optional<WorkItem> counterpart = repository.find(counterpartId);
        if (counterpart.isEmpty() || !keysAgree(item, counterpart.get())) {
            log.info("Resolution on {} for {} recorded, waiting for the counterpart to agree", workItemId,
                    counterpartId);
            return false;
        }

        boolean first = markResolved(item.id(), counterpartId, key);
        boolean second = markResolved(counterpartId, item.id(), key);
        if (first || second) {
            log.info("Scope conflict between {} and {} resolved with key {}", item.id(), counterpartId, key);
            eventBus.publish(new CoordinationEvent(CoordinationEvent.SCOPE_RESOLVED, item.id(), item.epicId(),
                    event.author(), Map.of(COUNTERPART, counterpartId, "key", key), Instant.now()));
        }
        return true;
    }

    /** Conflicts on the item that neither a resolved record nor matching resolution keys settle. */
    public List<ScopeConflict> unresolvedConflicts(WorkItem item) {
        Map<String, ConflictState> states = conflictStates(item);
        var unresolved = new ArrayList<ScopeConflict>();
        states.forEach((counterpartId, state) -> {
            if (state.resolved) return;
            boolean agreed = repository.find(counterpartId).map(c -> keysAgree(item, c)).orElse(false);
            if (!agreed) {
                unresolved.add(new ScopeConflict(item.id(), counterpartId, Set.copyOf(state.resources)));
            }
        });
        return unresolved;
    }

    public boolean hasConflictRecord(WorkItem item, String counterpartId) {
        return conflictStates(item).containsKey(counterpartId);
    }

    private void notifySide(ScopeConflict conflict, String epicId) {
        boolean written = updater.update(conflict.workItemId(), target -> {
            if (target.phase() == Phase.COMPLETED || hasConflictRecord(target, conflict.counterpartId())) {
                return false;
            }
            var block = MarkerBlock.builder(MarkerType.CONFLICT)
                    .field(STATUS, OPEN)
                    .field(COUNTERPART, conflict.counterpartId())
                    .items("resources", List.copyOf(conflict.resources()))
                    .build();
            String summary = "Scope conflict with #" + conflict.counterpartId() + " on "
                    + String.join(", ", conflict.resources())
                    + ". Agree on merge order, a split or a reassignment and post a resolution on both items.";
            store.postComment(target.id(), target.revision(), engineActor, Markers.render(summary, block));
            return true;
        });
        if (written) {
            metrics.recordScopeConflict();
            log.info("Notified {} of scope conflict with {} on {}", conflict.workItemId(), conflict.counterpartId(),
                    conflict.resources());
            eventBus.publish(new CoordinationEvent(CoordinationEvent.SCOPE_CONFLICT, conflict.workItemId(), epicId,
                    engineActor, Map.of(COUNTERPART, conflict.counterpartId(),
                    "resources", List.copyOf(conflict.resources())), Instant.now()));
        }
    }

    private boolean markResolved(String workItemId, String counterpartId, String key) {
        return updater.update(workItemId, target -> {
            ConflictState state = conflictStates(target).get(counterpartId);
            if (state == null || state.resolved || target.phase() == Phase.COMPLETED) {
                return false;
            }
            var block = MarkerBlock.builder(MarkerType.CONFLICT)
                    .field(STATUS, RESOLVED)
                    .field(COUNTERPART, counterpartId)
                    .field("key", key)
                    .build();
            store.postComment(target.id(), target.revision(), engineActor,
                    Markers.render("Scope conflict with #" + counterpartId + " resolved.", block));
            return true;
        });
    }

    private static boolean keysAgree(WorkItem item, WorkItem counterpart) {
        List<String> mine = resolutionKeys(item, counterpart.id());
        List<String> theirs = resolutionKeys(counterpart, item.id());
        return mine.stream().anyMatch(theirs::contains);
    }

    private static List<String> resolutionKeys(WorkItem item, String counterpartId) {
        return item.marked(MarkerType.RESOLUTION).stream()
                .map(MarkedEvent::block)
                .filter(b -> counterpartId.equals(WorkItemRepository.normalizeId(b.text(COUNTERPART))))
                .map(b -> b.text("key"))
                .filter(k -> !k.isEmpty())
                .toList();
    }

    private static Map<String, ConflictState> conflictStates(WorkItem item) {
        var states = new LinkedHashMap<String, ConflictState>();
        for (MarkedEvent marked : item.marked(MarkerType.CONFLICT)) {
            MarkerBlock block = marked.block();
            String counterpartId = WorkItemRepository.normalizeId(block.text(COUNTERPART));
            if (counterpartId == null || counterpartId.isEmpty()) continue;
            ConflictState state = states.computeIfAbsent(counterpartId, k -> new ConflictState());
            if (RESOLVED.equals(block.text(STATUS))) {
                state.resolved = true;
            } else {
                state.resources.addAll(block.list("resources"));
            }
        }
        return states;
    }

    private static final class ConflictState {
        private final List<String> resources = new ArrayList<>();
        private boolean resolved;
    }
}
