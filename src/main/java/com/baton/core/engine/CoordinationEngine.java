package com.baton.core.engine;

import com.baton.core.checkpoint.CheckpointValidator;
import com.baton.core.concurrency.OptimisticUpdater;
import com.baton.core.config.BatonProperties;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.logging.MdcContext;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.model.Phase;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.StatusLabel;
import com.baton.core.model.ThreadType;
import com.baton.core.model.TicketEvent;
import com.baton.core.model.ViolationKind;
import com.baton.core.model.WorkItem;
import com.baton.core.phase.PhaseStateMachine;
import com.baton.core.scope.ConflictDetector;
import com.baton.core.scope.ScopeRegistry;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.violation.ReviewCyclePolicy;
import com.baton.core.violation.ViolationEngine;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reacts to ticket-store events. There is no scheduler: every rule runs because an
 * issue was opened, labelled, assigned or commented on.
 * <p>
 * Events caused by the engine's own actor are ignored so its records never re-trigger it.
 */
@Service
public class CoordinationEngine {

    private static final Logger log = LoggerFactory.getLogger(CoordinationEngine.class);

    public static final String EPIC_LABEL = "epic";

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final PhaseStateMachine phaseStateMachine;
    private final CheckpointValidator checkpointValidator;
    private final ConflictDetector conflictDetector;
    private final ScopeRegistry scopeRegistry;
    private final ViolationEngine violationEngine;
    private final ReviewCyclePolicy reviewCyclePolicy;
    private final String engineActor;

    public CoordinationEngine(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                              PhaseStateMachine phaseStateMachine, CheckpointValidator checkpointValidator,
                              ConflictDetector conflictDetector, ScopeRegistry scopeRegistry,
                              ViolationEngine violationEngine,
                              ReviewCyclePolicy reviewCyclePolicy, BatonProperties properties) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.phaseStateMachine = phaseStateMachine;
        this.checkpointValidator = checkpointValidator;
        this.conflictDetector = conflictDetector;
        this.scopeRegistry = scopeRegistry;
        this.violationEngine = violationEngine;
        this.reviewCyclePolicy = reviewCyclePolicy;
        this.engineActor = properties.getEngineActor();
    }

    public void handle(TicketEvent event) {
        if (engineActor.equals(event.actor())) {
            log.trace("Ignoring own event {} on {}", event.type(), event.issueId());
            return;
        }
        String id = WorkItemRepository.normalizeId(event.issueId());
        MdcContext.setWorkItem(id, event.actor());
        try {
            switch (event.type()) {
                case ISSUE_OPENED -> onIssueOpened(id);
                case ISSUE_LABELED -> onIssueLabeled(id, event.actor(), event.label());
                case ISSUE_ASSIGNED -> onIssueAssigned(id);
                case COMMENT_CREATED -> onCommentCreated(id, event.commentId());
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void onIssueOpened(String id) {
        boolean initialised = updater.update(id, item -> {
            boolean hasState = item.labels().stream().anyMatch(l -> l.startsWith(Phase.STATE_LABEL_PREFIX));
            if (hasState || item.hasLabel(EPIC_LABEL) || item.phase() == Phase.COMPLETED) return false;
            store.updateLabels(item.id(), item.revision(),
                    Set.of(Phase.READY.stateLabel(), StatusLabel.READY.label()), Set.of());
            return true;
        });
        if (initialised) {
            log.info("Initialised work item {} as ready", id);
        }
    }

    /**
     * Phase and state labels are engine-owned. Phase labels are stripped back to the thread
     * that matches the current phase; a second state label added by someone else is removed.
     */
    private void onIssueLabeled(String id, String actor, String label) {
        if (label == null) return;
        Set<String> removed = updater.update(id, item -> {
            Set<String> remove = new HashSet<>();
            if (label.startsWith(ThreadType.LABEL_PREFIX)) {
                Optional<ThreadType> expected = item.phase().openThread();
                for (ThreadType type : item.phaseLabels()) {
                    if (expected.isEmpty() || type != expected.get()) remove.add(type.label());
                }
            }
            long stateLabels = item.labels().stream().filter(l -> l.startsWith(Phase.STATE_LABEL_PREFIX)).count();
            if (label.startsWith(Phase.STATE_LABEL_PREFIX) && stateLabels > 1) {
                remove.add(label);
            }
            if (!remove.isEmpty()) {
                store.updateLabels(item.id(), item.revision(), Set.of(), remove);
            }
            return remove;
        });
        if (!removed.isEmpty()) {
            log.warn("Removed engine-owned label(s) {} added to {} by {}", removed, id, actor);
            store.postComment(id, engineActor, "Removed " + removed + ": phase and state labels change only"
                    + " through transitions.");
        }
    }

    private void onIssueAssigned(String id) {
        WorkItem item = repository.get(id);
        if (item.phase() != Phase.READY || item.assignee() == null) return;
        try {
            phaseStateMachine.claim(id, item.assignee());
        } catch (CoordinationException e) {
            notice(id, "Could not claim #" + id + " for @" + item.assignee() + ": " + e.getMessage());
        }
    }

    private void onCommentCreated(String id, String commentId) {
        WorkItem item = repository.get(id);
        Optional<StatusEvent> found = item.event(commentId);
        if (found.isEmpty()) {
            log.warn("Comment {} not found on {}", commentId, id);
            return;
        }
        StatusEvent event = found.get();
        if (engineActor.equals(event.author())) return;
        MdcContext.setEpic(item.epicId());
        if (item.phase() == Phase.COMPLETED) {
            log.debug("Ignoring comment {} on completed item {}", commentId, id);
            return;
        }

        phaseStateMachine.checkThreadInitialisation(id, event);

        if (event.has(MarkerType.SCOPE)) {
            onScope(id, event);
        }
        if (event.has(MarkerType.CHECKPOINT)) {
            checkpointValidator.onStatusComment(id, event);
        }
        if (event.has(MarkerType.RESOLUTION)) {
            conflictDetector.onResolution(id, event);
        }
        event.block(MarkerType.CORRECTION).ifPresent(correction -> onCorrection(id, event, correction));
        if (event.has(MarkerType.PATTERN) || event.has(MarkerType.ESCALATION)) {
            resumeAfterReviewFailure(id);
        }
        event.block(MarkerType.VERDICT).ifPresent(verdict -> onVerdict(id, event, verdict));
    }

    private void onScope(String id, StatusEvent event) {
        try {
            scopeRegistry.onScopeComment(id, event);
        } catch (CoordinationException e) {
            notice(id, e.getRule() + ": " + e.getMessage());
        }
    }

    private void onCorrection(String id, StatusEvent event, MarkerBlock correction) {
        String violationEventId = correction.text("violation");
        WorkItem item = repository.get(id);
        Optional<ViolationKind> kind = item.event(violationEventId)
                .flatMap(e -> e.block(MarkerType.VIOLATION))
                .map(b -> b.text("kind"))
                .flatMap(CoordinationEngine::parseKind);
        if (kind.isEmpty()) {
            notice(id, "Correction " + event.id() + " does not reference a violation record on #" + id + ".");
            return;
        }
        try {
            violationEngine.clearViolation(id, kind.get(), event.author(), event.id());
        } catch (CoordinationException e) {
            notice(id, e.getMessage());
        }
    }

    private void onVerdict(String id, StatusEvent event, MarkerBlock block) {
        WorkItem item = repository.get(id);
        if (item.phase() != Phase.REVIEW_OPEN) {
            violationEngine.recordViolation(event.author(), id, ViolationKind.VERDICT_OUTSIDE_REVIEW,
                    "Verdict " + event.id() + " posted while in " + item.phase().tag());
            return;
        }
        if (phaseStateMachine.devThreadOpener(item).filter(event.author()::equals).isPresent()) {
            violationEngine.recordViolation(event.author(), id, ViolationKind.SELF_APPROVAL,
                    "Verdict " + event.id() + " posted on their own change");
            return;
        }

        String verdict = block.text("verdict").toUpperCase(Locale.ROOT);
        switch (verdict) {
            case "PASS" -> {
                try {
                    phaseStateMachine.requestTransition(id, Phase.REVIEW_OPEN, Phase.COMPLETED, event.author());
                } catch (CoordinationException e) {
                    notice(id, "Review passed but #" + id + " cannot close yet: " + e.getMessage());
                }
            }
            case "FAIL" -> demote(id);
            default -> notice(id, "Verdict " + event.id() + " must be PASS or FAIL, got '"
                    + block.text("verdict") + "'.");
        }
    }

    /**
     * Sends failed work back to dev. When the review-cycle policy forbids that, the item is
     * parked in {@code review_failed} (labelled needs-input) until a pattern note or an
     * escalation is posted.
     */
    private void demote(String id) {
        try {
            phaseStateMachine.requestTransition(id, Phase.REVIEW_OPEN, Phase.DEV_OPEN, engineActor);
        } catch (CoordinationException e) {
            if (e.getRule() != RuleViolation.PATTERN_NOTE_REQUIRED && e.getRule() != RuleViolation.ESCALATION_REQUIRED) {
                notice(id, "Could not return #" + id + " to dev: " + e.getMessage());
                return;
            }
            try {
                phaseStateMachine.requestTransition(id, Phase.REVIEW_OPEN, Phase.REVIEW_FAILED, engineActor);
            } catch (CoordinationException parked) {
                log.warn("Could not park {} in review_failed: {}", id, parked.getMessage());
            }
            notice(id, e.getMessage() + ". #" + id + " waits in review_failed until then.");
        }
    }

    private void resumeAfterReviewFailure(String id) {
        WorkItem item = repository.get(id);
        if (item.phase() != Phase.REVIEW_FAILED || !reviewCyclePolicy.assess(item).allowsDemotion()) return;
        try {
            phaseStateMachine.requestTransition(id, Phase.REVIEW_FAILED, Phase.DEV_OPEN, engineActor);
        } catch (CoordinationException e) {
            notice(id, "Could not return #" + id + " to dev: " + e.getMessage());
        }
    }

    private void notice(String id, String message) {
        log.info("Notice on {}: {}", id, message);
        store.postComment(id, engineActor, message);
    }

    private static Optional<ViolationKind> parseKind(String value) {
        try {
            return Optional.of(ViolationKind.valueOf(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
