package com.baton.core.scope;

import com.baton.core.concurrency.OptimisticUpdater;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.model.Phase;
import com.baton.core.model.ScopeConflict;
import com.baton.core.model.ScopeDeclaration;
import com.baton.core.model.ScopeDeclarationResult;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.WorkItem;
import com.baton.core.store.Comment;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Write-once scope declarations.
 * <p>
 * The declaration is posted conditionally on the revision at which "no declaration yet"
 * was observed, so two racing declarations on the same item cannot both land. After a
 * successful write the conflict detector re-scans the epic.
 */
@Service
public class ScopeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScopeRegistry.class);

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final ConflictDetector conflictDetector;
    private final EventBus eventBus;

    public ScopeRegistry(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                         ConflictDetector conflictDetector, EventBus eventBus) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
    }

    public ScopeDeclarationResult declareScope(String workItemId, List<String> claimed, List<String> excluded,
                                               String actor) {
        List<String> claimedResources = ScopeDeclaration.clean(claimed);
        List<String> excludedResources = ScopeDeclaration.clean(excluded);
        ScopeDeclaration.malformation(claimedResources, excludedResources).ifPresent(problem -> {
            throw new CoordinationException(RuleViolation.MALFORMED_SCOPE_DECLARATION, workItemId, problem);
        });

        ScopeDeclaration declaration = updater.update(workItemId, item -> {
            if (item.phase() == Phase.COMPLETED) {
                throw new CoordinationException(RuleViolation.WORK_ITEM_COMPLETED, item.id(),
                        "Work item " + item.id() + " is completed; its scope can no longer be declared");
            }
            ScopeDeclaration.of(item).ifPresent(existing -> {
                throw new CoordinationException(RuleViolation.SCOPE_ALREADY_DECLARED, item.id(),
                        "Scope for " + item.id() + " was already declared by " + existing.actor()
                                + " in " + existing.sequence());
            });
            String body = Markers.render("Scope declared by @" + actor + ".",
                    ScopeDeclaration.toBlock(claimedResources, excludedResources));
            Comment comment = store.postComment(item.id(), item.revision(), actor, body);
            return new ScopeDeclaration(item.id(), claimedResources, excludedResources, comment.id(), actor,
                    comment.createdAt());
        });

        log.info("Scope declared on {} by {}: claimed {} excluded {}", declaration.workItemId(), actor,
                claimedResources, excludedResources);
        String epicId = repository.get(declaration.workItemId()).epicId();
        eventBus.publish(new CoordinationEvent(CoordinationEvent.SCOPE_DECLARED, declaration.workItemId(), epicId,
                actor, Map.of("claimed", claimedResources, "excluded", excludedResources), Instant.now()));

        List<ScopeConflict> conflicts = conflictDetector.scan(declaration.workItemId());
        return new ScopeDeclarationResult(declaration, conflicts);
    }

    /**
     * Handles a scope block posted directly as a comment. The block is checked the same way
     * {@link #declareScope} checks its arguments; only the first well-formed block on the
     * item is authoritative.
     *
     * @throws CoordinationException when the block is malformed or the item already has a scope
     */
    public ScopeDeclarationResult onScopeComment(String workItemId, StatusEvent event) {
        MarkerBlock block = event.block(MarkerType.SCOPE).orElseThrow(() ->
                new CoordinationException(RuleViolation.MALFORMED_SCOPE_DECLARATION, workItemId,
                        "Event " + event.id() + " carries no scope block"));
        WorkItem item = repository.get(workItemId);
        Optional<ScopeDeclaration> existing = ScopeDeclaration.of(item)
                .filter(d -> !d.sequence().equals(event.id()));
        if (existing.isPresent()) {
            throw new CoordinationException(RuleViolation.SCOPE_ALREADY_DECLARED, item.id(),
                    "Scope for " + item.id() + " was already declared by " + existing.get().actor()
                            + " in " + existing.get().sequence() + "; " + event.id() + " is ignored");
        }
        Optional<String> problem = ScopeDeclaration.malformation(ScopeDeclaration.clean(block.list("claimed")),
                ScopeDeclaration.clean(block.list("excluded")));
        if (problem.isPresent()) {
            throw new CoordinationException(RuleViolation.MALFORMED_SCOPE_DECLARATION, item.id(),
                    "Scope in " + event.id() + " is malformed: " + problem.get());
        }

        ScopeDeclaration declaration = ScopeDeclaration.of(item).orElseThrow();
        log.info("Scope declared on {} by {} in comment {}: claimed {} excluded {}", item.id(), event.author(),
                event.id(), declaration.claimed(), declaration.excluded());
        return new ScopeDeclarationResult(declaration, conflictDetector.scan(item.id()));
    }

    public Optional<ScopeDeclaration> declaration(String workItemId) {
        return ScopeDeclaration.of(repository.get(workItemId));
    }
}
