package com.baton.dispatch.api;

import com.baton.core.checkpoint.CheckpointValidator;
import com.baton.core.engine.CoordinationEngine;
import com.baton.core.logging.MdcContext;
import com.baton.core.model.CheckpointValidation;
import com.baton.core.model.EnforcementAction;
import com.baton.core.model.Phase;
import com.baton.core.model.ReviewCycleStatus;
import com.baton.core.model.TicketEvent;
import com.baton.core.model.Violation;
import com.baton.core.model.Wave;
import com.baton.core.model.WorkItem;
import com.baton.core.phase.PhaseStateMachine;
import com.baton.core.scope.ConflictDetector;
import com.baton.core.scope.ScopeRegistry;
import com.baton.core.store.Comment;
import com.baton.core.store.Issue;
import com.baton.core.store.NewIssue;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.violation.ReviewCyclePolicy;
import com.baton.core.violation.ViolationEngine;
import com.baton.core.workitem.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * REST controller for work-item coordination: claims, transitions, scopes, comments and checkpoints.
 */
@RestController
@RequestMapping("/api/v1/work-items")
public class WorkItemController {

    private static final Logger log = LoggerFactory.getLogger(WorkItemController.class);

    private final TicketStoreClient store;
    private final WorkItemRepository repository;
    private final PhaseStateMachine phaseStateMachine;
    private final ScopeRegistry scopeRegistry;
    private final ConflictDetector conflictDetector;
    private final CheckpointValidator checkpointValidator;
    private final ViolationEngine violationEngine;
    private final ReviewCyclePolicy reviewCyclePolicy;
    private final CoordinationEngine engine;

    public WorkItemController(TicketStoreClient store, WorkItemRepository repository,
                              PhaseStateMachine phaseStateMachine, ScopeRegistry scopeRegistry,
                              ConflictDetector conflictDetector, CheckpointValidator checkpointValidator,
                              ViolationEngine violationEngine, ReviewCyclePolicy reviewCyclePolicy,
                              CoordinationEngine engine) {
        this.store = store;
        this.repository = repository;
        this.phaseStateMachine = phaseStateMachine;
        this.scopeRegistry = scopeRegistry;
        this.conflictDetector = conflictDetector;
        this.checkpointValidator = checkpointValidator;
        this.violationEngine = violationEngine;
        this.reviewCyclePolicy = reviewCyclePolicy;
        this.engine = engine;
    }

    /**
     * POST /api/v1/work-items: Create a work item (or an epic) in the ticket store.
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateWorkItemRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Title is required"));
        }
        Set<String> labels = new LinkedHashSet<>();
        if (request.labels() != null) labels.addAll(request.labels());
        if (request.epic()) {
            labels.add(CoordinationEngine.EPIC_LABEL);
        } else if (request.wave() != null) {
            Optional<Wave> wave = Wave.parse(request.wave());
            if (wave.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid wave: " + request.wave()));
            }
            labels.add(wave.get().label());
        }

        Issue issue = store.createIssue(new NewIssue(null, request.title(), request.body(), labels,
                WorkItemRepository.normalizeId(request.epicId())));
        engine.handle(TicketEvent.issueOpened(issue.id(), null));
        log.info("Created {} {} '{}'", request.epic() ? "epic" : "work item", issue.id(), issue.title());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkItemResponse.from(repository.get(issue.id())));
    }

    /**
     * GET /api/v1/work-items/{id}: Current projection of a work item.
     */
    @GetMapping("/{id}")
    public ResponseEntity<WorkItemResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(WorkItemResponse.from(repository.get(id)));
    }

    /**
     * POST /api/v1/work-items/{id}/claim: Moves ready → claimed, assigning the actor.
     */
    @PostMapping("/{id}/claim")
    public ResponseEntity<?> claim(@PathVariable String id, @RequestBody ClaimRequest request) {
        if (request.actor() == null || request.actor().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Actor is required"));
        }
        return withMdc(id, request.actor(),
                () -> ResponseEntity.ok(TransitionResponse.from(phaseStateMachine.claim(id, request.actor()))));
    }

    /**
     * POST /api/v1/work-items/{id}/transitions: Request a phase transition.
     */
    @PostMapping("/{id}/transitions")
    public ResponseEntity<?> transition(@PathVariable String id, @RequestBody TransitionRequest request) {
        Optional<Phase> from = Phase.fromTag(request.from());
        Optional<Phase> to = Phase.fromTag(request.to());
        if (from.isEmpty() || to.isEmpty()) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Unknown phase: " + (from.isEmpty() ? request.from() : request.to())));
        }
        if (request.actor() == null || request.actor().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Actor is required"));
        }
        return withMdc(id, request.actor(), () -> ResponseEntity.ok(TransitionResponse.from(
                phaseStateMachine.requestTransition(id, from.get(), to.get(), request.actor()))));
    }

    /**
     * POST /api/v1/work-items/{id}/scope: Declare the item's scope (write-once).
     */
    @PostMapping("/{id}/scope")
    public ResponseEntity<?> declareScope(@PathVariable String id, @RequestBody ScopeRequest request) {
        if (request.actor() == null || request.actor().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Actor is required"));
        }
        return withMdc(id, request.actor(), () -> ResponseEntity.status(HttpStatus.CREATED).body(ScopeResponse.from(
                scopeRegistry.declareScope(id, request.claimed(), request.excluded(), request.actor()))));
    }

    /**
     * POST /api/v1/work-items/{id}/comments: Post a status comment and let the engine react to it.
     */
    @PostMapping("/{id}/comments")
    public ResponseEntity<?> comment(@PathVariable String id, @RequestBody CommentRequest request) {
        if (request.actor() == null || request.actor().isBlank() || request.body() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Actor and body are required"));
        }
        WorkItem item = repository.get(id);
        Comment comment = store.postComment(item.id(), request.actor(), request.body());
        engine.handle(TicketEvent.commentCreated(item.id(), request.actor(), comment.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "comment_id", comment.id(),
                "work_item", WorkItemResponse.from(repository.get(item.id()))));
    }

    /**
     * POST /api/v1/work-items/{id}/checkpoints: Record a structured checkpoint.
     */
    @PostMapping("/{id}/checkpoints")
    public ResponseEntity<?> recordCheckpoint(@PathVariable String id, @RequestBody CheckpointRequest request) {
        if (request.actor() == null || request.actor().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Actor is required"));
        }
        return withMdc(id, request.actor(), () -> {
            CheckpointValidation result = checkpointValidator.recordCheckpoint(id, request.actor(),
                    request.toCheckpoint());
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        });
    }

    /**
     * GET /api/v1/work-items/{id}/checkpoint: Validate the latest checkpoint.
     */
    @GetMapping("/{id}/checkpoint")
    public ResponseEntity<CheckpointValidation> latestCheckpoint(@PathVariable String id) {
        return ResponseEntity.ok(checkpointValidator.validateLatest(id));
    }

    /**
     * GET /api/v1/work-items/{id}/violations: Active violation standings.
     */
    @GetMapping("/{id}/violations")
    public ResponseEntity<List<ViolationResponse>> violations(@PathVariable String id) {
        List<Violation> current = violationEngine.currentViolations(repository.get(id));
        return ResponseEntity.ok(current.stream().map(ViolationResponse::from).toList());
    }

    /**
     * GET /api/v1/work-items/{id}/merge-eligibility: Whether merge, close and wave-advance are allowed.
     */
    @GetMapping("/{id}/merge-eligibility")
    public ResponseEntity<Map<String, Object>> mergeEligibility(@PathVariable String id) {
        WorkItem item = repository.get(id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("work_item_id", item.id());
        for (EnforcementAction action : EnforcementAction.values()) {
            result.put(action.name().toLowerCase(Locale.ROOT), violationEngine.isAllowed(item, action));
        }
        result.put("blocking", violationEngine.blockingViolations(item).stream()
                .map(ViolationResponse::from).toList());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/work-items/{id}/conflicts: Unresolved scope conflicts.
     */
    @GetMapping("/{id}/conflicts")
    public ResponseEntity<List<ScopeResponse.ConflictResponse>> conflicts(@PathVariable String id) {
        WorkItem item = repository.get(id);
        return ResponseEntity.ok(conflictDetector.unresolvedConflicts(item).stream()
                .map(c -> new ScopeResponse.ConflictResponse(c.counterpartId(), List.copyOf(c.resources())))
                .toList());
    }

    /**
     * GET /api/v1/work-items/{id}/review-cycle: Review cycle and what it requires before demotion.
     */
    @GetMapping("/{id}/review-cycle")
    public ResponseEntity<ReviewCycleStatus> reviewCycle(@PathVariable String id) {
        return ResponseEntity.ok(reviewCyclePolicy.assess(repository.get(id)));
    }

    private static <T> T withMdc(String id, String actor, Supplier<T> action) {
        MdcContext.setWorkItem(WorkItemRepository.normalizeId(id), actor);
        try {
            return action.get();
        } finally {
            MdcContext.clear();
        }
    }
}
