package com.baton.core.workitem;

import com.baton.core.config.BatonProperties;
import com.baton.core.error.WorkItemNotFoundException;
import com.baton.core.model.Epic;
import com.baton.core.model.Phase;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.StatusLabel;
import com.baton.core.model.Wave;
import com.baton.core.model.WorkItem;
import com.baton.core.store.Issue;
import com.baton.core.store.IssueQuery;
import com.baton.core.store.IssueState;
import com.baton.core.store.TicketStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Projects ticket-store issues and their comments into {@link WorkItem} and {@link Epic} views.
 * <p>
 * Nothing is cached: every call reads the store, so callers always act on the latest
 * revision and detect races through conditional writes.
 */
@Service
public class WorkItemRepository {

    private static final Logger log = LoggerFactory.getLogger(WorkItemRepository.class);

    private final TicketStoreClient store;
    private final String engineActor;

    public WorkItemRepository(TicketStoreClient store, BatonProperties properties) {
        this.store = store;
        this.engineActor = properties.getEngineActor();
    }

    public WorkItem get(String workItemId) {
        return find(workItemId).orElseThrow(() -> new WorkItemNotFoundException(workItemId));
    }

    public Optional<WorkItem> find(String workItemId) {
        return store.findIssue(normalizeId(workItemId)).map(this::project);
    }

    public Epic epic(String epicId) {
        Issue epicIssue = store.findIssue(normalizeId(epicId))
                .orElseThrow(() -> new WorkItemNotFoundException(epicId));
        List<WorkItem> children = store.listIssues(IssueQuery.childrenOf(epicIssue.id())).stream()
                .map(this::project)
                .toList();
        return new Epic(epicIssue.id(), epicIssue.title(), children);
    }

    /** Other children of the same epic, excluding the item itself. */
    public List<WorkItem> siblings(WorkItem item) {
        if (item.epicId() == null) return List.of();
        return store.listIssues(IssueQuery.childrenOf(item.epicId())).stream()
                .filter(i -> !i.id().equals(item.id()))
                .map(this::project)
                .toList();
    }

    public WorkItem project(Issue issue) {
        List<StatusEvent> events = store.listComments(issue.id()).stream()
                .map(c -> StatusEvent.of(c, engineActor))
                .toList();
        return new WorkItem(issue.id(), issue.title(), issue.body(), phaseOf(issue), issue.labels(),
                issue.assignee(), issue.parentId(), waveOf(issue), events, issue.state(), issue.revision());
    }

    static Phase phaseOf(Issue issue) {
        List<Phase> phases = issue.labels().stream()
                .map(Phase::fromStateLabel)
                .flatMap(Optional::stream)
                .sorted()
                .toList();
        if (phases.size() > 1) {
            log.warn("Issue {} carries several state labels {}, using the most advanced", issue.id(), phases);
        }
        if (!phases.isEmpty()) {
            return phases.get(phases.size() - 1);
        }
        if (issue.state() == IssueState.CLOSED || issue.hasLabel(StatusLabel.COMPLETED.label())) {
            return Phase.COMPLETED;
        }
        return Phase.READY;
    }

    static Wave waveOf(Issue issue) {
        return issue.labels().stream()
                .map(Wave::fromLabel)
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
    }

    public static String normalizeId(String id) {
        if (id == null) return null;
        String trimmed = id.trim();
        return trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
    }
}
