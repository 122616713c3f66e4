package com.baton.core.phase;

import com.baton.core.checkpoint.CheckpointValidator;
import com.baton.core.concurrency.OptimisticUpdater;
import com.baton.core.config.BatonProperties;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.logging.MdcContext;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.metrics.BatonMetrics;
import com.baton.core.model.EnforcementAction;
import com.baton.core.model.Phase;
import com.baton.core.model.ReviewCycleStatus;
import com.baton.core.model.ScopeConflict;
import com.baton.core.model.ScopeDeclaration;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.StatusLabel;
import com.baton.core.model.ThreadType;
import com.baton.core.model.TransitionRecord;
import com.baton.core.model.TransitionResult;
import com.baton.core.model.Violation;
import com.baton.core.model.ViolationKind;
import com.baton.core.model.WorkItem;
import com.baton.core.scope.ConflictDetector;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.violation.ReviewCyclePolicy;
import com.baton.core.violation.ViolationEngine;
import com.baton.core.wave.WaveSequencer;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Enforces the work-item lifecycle
 * {@code ready → claimed → dev_open → dev_closed → test_open → test_closed → review_open → {completed | review_failed}}.
 * <p>
 * The commit point of a transition is a single conditional label write that swaps the
 * {@code state:*}, status and {@code phase:*} labels together, so an item never shows two
 * phase labels. The transition record comment is posted after the commit and asks the
 * initiating actor for the new thread's preamble. Soft violations found on the way are
 * recorded without rolling the transition back.
 */
@Service
public class PhaseStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final OptimisticUpdater updater;
    private final WaveSequencer waveSequencer;
    private final ViolationEngine violationEngine;
    private final ReviewCyclePolicy reviewCyclePolicy;
    private final CheckpointValidator checkpointValidator;
    private final ConflictDetector conflictDetector;
    private final EventBus eventBus;
    private final BatonMetrics metrics;
    private final String engineActor;

    public PhaseStateMachine(TicketStoreClient store, WorkItemRepository repository, OptimisticUpdater updater,
                             WaveSequencer waveSequencer, ViolationEngine violationEngine,
                             ReviewCyclePolicy reviewCyclePolicy, CheckpointValidator checkpointValidator,
                             ConflictDetector conflictDetector, EventBus eventBus, BatonMetrics metrics,
                             BatonProperties properties) {
        this.store = store;
        this.repository = repository;
        this.updater = updater;
        this.waveSequencer = waveSequencer;
        this.violationEngine = violationEngine;
        this.reviewCyclePolicy = reviewCyclePolicy;
        this.checkpointValidator = checkpointValidator;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.engineActor = properties.getEngineActor();
    }

    /** Claims a ready item for {@code actor} and assigns it to them. */
    public TransitionResult claim(String workItemId, String actor) {
        return requestTransition(workItemId, Phase.READY, Phase.CLAIMED, actor);
    }

    public TransitionResult requestTransition(String workItemId, Phase from, Phase to, String actor) {
        String id = WorkItemRepository.normalizeId(workItemId);
        MdcContext.setWorkItem(id, actor);
        try {
            return doTransition(id, from, to, actor);
        } catch (CoordinationException e) {
            metrics.recordRejection(e.getRule().name());
            log.warn("Rejected {} -> {} on {} by {}: {} ({})", from, to, id, actor, e.getRule(), e.getMessage());
            eventBus.publish(new CoordinationEvent(CoordinationEvent.TRANSITION_REJECTED, id, null, actor,
                    Map.of("from", from.tag(), "to", to.tag(), "rule", e.getRule().name()), Instant.now()));
            if (e.getRule() == RuleViolation.WAVE_NOT_ELIGIBLE && to == Phase.CLAIMED && !isEngine(actor)) {
                violationEngine.recordViolation(actor, id, ViolationKind.WRONG_ORDER_CLAIM, e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Checks the first comment of the actor who opened the current thread for the thread
     * preamble. Records {@code INCOMPLETE_INIT} when it is missing or names another thread.
     */
    public Optional<Violation> checkThreadInitialisation(String workItemId, StatusEvent event) {
        WorkItem item = repository.get(workItemId);
        List<TransitionRecord> transitions = item.transitions();
        if (transitions.isEmpty() || item.phase() == Phase.COMPLETED) return Optional.empty();

        TransitionRecord latest = transitions.get(transitions.size() - 1);
        Optional<ThreadType> opened = latest.openedThread();
        if (opened.isEmpty() || isEngine(latest.actor()) || !Objects.equals(latest.actor(), event.author())) {
            return Optional.empty();
        }
        int position = item.indexOf(event.id());
        if (position <= latest.index()) return Optional.empty();

        boolean firstSinceOpen = item.events().subList(latest.index() + 1, position).stream()
                .noneMatch(e -> Objects.equals(e.author(), event.author()));
        if (!firstSinceOpen) return Optional.empty();

        Optional<MarkerBlock> preamble = event.block(MarkerType.PREAMBLE);
        boolean complete = preamble.isPresent()
                && ThreadType.fromTag(preamble.get().text("thread")).equals(opened)
                && preamble.get().has("skills")
                && preamble.get().has("scope");
        if (complete) {
            log.debug("Preamble for {} thread on {} posted by {}", opened.get().tag(), item.id(), event.author());
            return Optional.empty();
        }
        return Optional.of(violationEngine.recordViolation(event.author(), item.id(), ViolationKind.INCOMPLETE_INIT,
                "First comment " + event.id() + " after opening the " + opened.get().tag()
                        + " thread has no preamble"));
    }

    private TransitionResult doTransition(String id, Phase from, Phase to, String actor) {
        if (PhaseTransitionTable.isReviewToTest(from, to)) {
            WorkItem item = repository.get(id);
            if (item.phase() != Phase.COMPLETED && !isEngine(actor)) {
                violationEngine.recordViolation(actor, id, ViolationKind.INVALID_DEMOTION,
                        "Requested review_open -> test_open");
            }
            throw new CoordinationException(RuleViolation.INVALID_DEMOTION_DIRECTION, id,
                    "A review may only send work back to dev_open, never to test_open");
        }
        if (!PhaseTransitionTable.allows(from, to)) {
            throw new CoordinationException(RuleViolation.ILLEGAL_TRANSITION, id,
                    "Illegal transition " + from.tag() + " -> " + to.tag() + "; allowed from " + from.tag() + ": "
                            + PhaseTransitionTable.successors(from).stream().map(Phase::tag).toList());
        }

        WorkItem before = updater.update(id, item -> {
            checkCommon(item, from, to);
            store.updateLabels(item.id(), item.revision(), labelsToAdd(to), labelsToRemove(item, to));
            return item;
        });

        int cycle = reviewCyclePolicy.cycle(before) + (to == Phase.REVIEW_OPEN ? 1 : 0);
        store.postComment(id, engineActor, renderTransition(id, from, to, actor, cycle));
        metrics.recordTransition(from.tag(), to.tag());
        log.info("{} moved {} from {} to {}", actor, id, from.tag(), to.tag());

        List<Violation> softViolations = afterCommit(before, from, to, actor, cycle);

        eventBus.publish(new CoordinationEvent(CoordinationEvent.PHASE_TRANSITIONED, id, before.epicId(), actor,
                Map.of("from", from.tag(), "to", to.tag(), "cycle", cycle), Instant.now()));
        return new TransitionResult(id, from, to, actor, softViolations);
    }

    /** Rules that must hold on the revision the label write is conditioned on. */
    private void checkCommon(WorkItem item, Phase from, Phase to) {
        if (item.phase() == Phase.COMPLETED) {
            throw new CoordinationException(RuleViolation.WORK_ITEM_COMPLETED, item.id(),
                    "Work item " + item.id() + " is completed and can no longer change");
        }
        if (item.phase() != from) {
            if (from == Phase.READY && to == Phase.CLAIMED) {
                throw new CoordinationException(RuleViolation.ALREADY_CLAIMED, item.id(),
                        "Work item " + item.id() + " was already claimed"
                                + (item.assignee() != null ? " by " + item.assignee() : "")
                                + " and is in " + item.phase().tag());
            }
            throw new CoordinationException(RuleViolation.STALE_STATE, item.id(),
                    "Work item " + item.id() + " is in " + item.phase().tag() + ", not " + from.tag());
        }
        if (item.isUnrecoverable()) {
            throw new CoordinationException(RuleViolation.UNRECOVERABLE_STATE, item.id(),
                    "Work item " + item.id() + " is marked " + WorkItem.UNRECOVERABLE_LABEL
                            + "; post a complete checkpoint before changing phase");
        }

        List<ThreadType> open = item.phaseLabels();
        Optional<ThreadType> closing = from.openThread();
        if (open.size() > 1 || (!open.isEmpty() && !closing.equals(Optional.of(open.get(0))))) {
            throw new CoordinationException(RuleViolation.THREAD_STILL_OPEN, item.id(),
                    "Work item " + item.id() + " still has open thread label(s) "
                            + open.stream().map(ThreadType::label).toList());
        }

        if (to == Phase.CLAIMED) {
            waveSequencer.requireEnterable(item);
            violationEngine.assertAllowed(item, EnforcementAction.WAVE_ADVANCE);
        }
        if (to == Phase.COMPLETED) {
            violationEngine.assertAllowed(item, EnforcementAction.MERGE);
            violationEngine.assertAllowed(item, EnforcementAction.CLOSE);
            checkpointValidator.requireFinalCheckpoint(item);
        }
        if (PhaseTransitionTable.isDemotion(from, to)) {
            requireDemotionAllowed(item);
        }
    }

    private void requireDemotionAllowed(WorkItem item) {
        ReviewCycleStatus status = reviewCyclePolicy.assess(item);
        if (status.allowsDemotion()) return;
        if (status.requirement() == ReviewCycleStatus.Requirement.ESCALATION) {
            metrics.incrementEscalations("review_cycle");
            eventBus.publish(new CoordinationEvent(CoordinationEvent.ESCALATION_REQUIRED, item.id(), item.epicId(),
                    engineActor, Map.of("cycle", status.cycle()), Instant.now()));
            throw new CoordinationException(RuleViolation.ESCALATION_REQUIRED, item.id(),
                    "Review cycle " + status.cycle() + " on " + item.id()
                            + " needs an escalation addressed to a maintainer before work continues");
        }
        throw new CoordinationException(RuleViolation.PATTERN_NOTE_REQUIRED, item.id(),
                "Review cycle " + status.cycle() + " on " + item.id()
                        + " needs a pattern note describing the recurring failure before demotion");
    }

    private List<Violation> reportUnresolvedConflicts(WorkItem item, String actor) {
        List<ScopeConflict> unresolved = conflictDetector.unresolvedConflicts(item);
        if (unresolved.isEmpty()) return List.of();
        String owner = devThreadOpener(item).orElse(actor);
        if (isEngine(owner)) return List.of();
        String counterparts = String.join(", ", unresolved.stream().map(c -> "#" + c.counterpartId()).toList());
        return List.of(violationEngine.recordViolation(owner, item.id(), ViolationKind.UNRESOLVED_SCOPE_CONFLICT,
                "Closing with unresolved scope conflicts against " + counterparts));
    }

    private List<Violation> afterCommit(WorkItem before, Phase from, Phase to, String actor, int cycle) {
        var violations = new ArrayList<Violation>();
        String id = before.id();
        switch (to) {
            case CLAIMED -> {
                updater.update(id, item -> store.assign(item.id(), item.revision(), actor));
                if (ScopeDeclaration.of(before).isPresent()) {
                    conflictDetector.scan(id);
                }
            }
            case DEV_OPEN -> {
                if (ScopeDeclaration.of(before).isEmpty() && !isEngine(actor)) {
                    violations.add(violationEngine.recordViolation(actor, id,
                            ViolationKind.MISSING_SCOPE_DECLARATION, "Entered dev_open without a scope declaration"));
                }
            }
            case TEST_OPEN, REVIEW_OPEN -> {
                if (to == Phase.REVIEW_OPEN) {
                    metrics.recordReviewCycle(cycle);
                }
                if (!isEngine(actor) && devThreadOpener(before).filter(actor::equals).isPresent()) {
                    violations.add(violationEngine.recordViolation(actor, id, ViolationKind.SELF_APPROVAL,
                            "Opened the " + to.openThread().map(ThreadType::tag).orElse("") + " thread on work"
                                    + " they developed"));
                }
            }
            case COMPLETED -> {
                violations.addAll(reportUnresolvedConflicts(before, actor));
                updater.update(id, item -> store.close(item.id(), item.revision()));
            }
            default -> {
            }
        }
        return violations;
    }

    /** Actor who opened the dev thread after claiming. Demotions back to dev keep that developer. */
    public Optional<String> devThreadOpener(WorkItem item) {
        String opener = null;
        for (TransitionRecord t : item.transitions()) {
            if (t.from() == Phase.CLAIMED && t.to() == Phase.DEV_OPEN && !isEngine(t.actor())) {
                opener = t.actor();
            }
        }
        return Optional.ofNullable(opener);
    }

    static Set<String> labelsToAdd(Phase to) {
        Set<String> add = new HashSet<>();
        add.add(to.stateLabel());
        add.add(to.statusLabel().label());
        to.openThread().ifPresent(t -> add.add(t.label()));
        return add;
    }

    static Set<String> labelsToRemove(WorkItem item, Phase to) {
        Set<String> keep = labelsToAdd(to);
        Set<String> remove = new HashSet<>();
        for (String label : item.labels()) {
            boolean owned = label.startsWith(Phase.STATE_LABEL_PREFIX)
                    || label.startsWith(ThreadType.LABEL_PREFIX)
                    || StatusLabel.all().contains(label);
            if (owned && !keep.contains(label)) {
                remove.add(label);
            }
        }
        return remove;
    }

    private String renderTransition(String id, Phase from, Phase to, String actor, int cycle) {
        var block = MarkerBlock.builder(MarkerType.TRANSITION)
                .field("from", from.tag())
                .field("to", to.tag())
                .field("actor", actor)
                .field("thread", to.openThread().map(ThreadType::tag).orElse("none"))
                .field("cycle", String.valueOf(cycle))
                .build();
        String summary = "@" + actor + " moved #" + id + " from " + from.tag() + " to " + to.tag() + ".";
        if (to.openThread().isPresent() && !isEngine(actor)) {
            summary += " @" + actor + ", start the " + to.openThread().get().tag()
                    + " thread with its preamble (thread, skills, scope).";
        }
        return Markers.render(summary, block);
    }

    private boolean isEngine(String actor) {
        return engineActor.equals(actor);
    }
}
