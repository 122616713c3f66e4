package com.baton.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process ticket store used for local runs and tests.
 * <p>
 * Mirrors the semantics of a hosted tracker: every write bumps the issue revision,
 * conditional writes compare against it, and comments are append-only.
 * State is lost on restart.
 */
public class InMemoryTicketStore implements TicketStoreClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTicketStore.class);

    private final Map<String, Issue> issues = new LinkedHashMap<>();
    private final Map<String, List<Comment>> comments = new LinkedHashMap<>();
    private final AtomicLong issueSequence = new AtomicLong(0);
    private final AtomicLong commentSequence = new AtomicLong(0);
    private final Clock clock;

    public InMemoryTicketStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTicketStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Issue createIssue(NewIssue request) {
        String id = request.id() != null ? stripHash(request.id()) : nextIssueId();
        if (issues.containsKey(id)) {
            throw new TicketStoreException("Issue " + id + " already exists");
        }
        if (request.parentId() != null && !issues.containsKey(stripHash(request.parentId()))) {
            throw new TicketStoreException("Parent issue " + request.parentId() + " does not exist");
        }
        var issue = new Issue(id, request.title(), request.body(), request.labels(), null,
                request.parentId() != null ? stripHash(request.parentId()) : null,
                IssueState.OPEN, 1, clock.instant());
        issues.put(id, issue);
        comments.put(id, new ArrayList<>());
        log.debug("Created issue {} with labels {}", id, issue.labels());
        return issue;
    }

    @Override
    public synchronized Optional<Issue> findIssue(String issueId) {
        return Optional.ofNullable(issues.get(stripHash(issueId)));
    }

    @Override
    public synchronized List<Issue> listIssues(IssueQuery query) {
        return issues.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(Issue::id, InMemoryTicketStore::compareIds))
                .toList();
    }

    @Override
    public synchronized Issue updateLabels(String issueId, long expectedRevision, Set<String> add, Set<String> remove) {
        Issue current = requireAt(issueId, expectedRevision);
        var labels = new LinkedHashSet<>(current.labels());
        labels.removeAll(remove);
        labels.addAll(add);
        return store(new Issue(current.id(), current.title(), current.body(), labels, current.assignee(),
                current.parentId(), current.state(), current.revision() + 1, clock.instant()));
    }

    @Override
    public synchronized Comment postComment(String issueId, String author, String body) {
        Issue current = require(issueId);
        return append(current, author, body);
    }

    @Override
    public synchronized Comment postComment(String issueId, long expectedRevision, String author, String body) {
        Issue current = requireAt(issueId, expectedRevision);
        return append(current, author, body);
    }

    @Override
    public synchronized List<Comment> listComments(String issueId) {
        require(issueId);
        return List.copyOf(comments.get(stripHash(issueId)));
    }

    @Override
    public synchronized Issue assign(String issueId, long expectedRevision, String assignee) {
        Issue current = requireAt(issueId, expectedRevision);
        return store(new Issue(current.id(), current.title(), current.body(), current.labels(), assignee,
                current.parentId(), current.state(), current.revision() + 1, clock.instant()));
    }

    @Override
    public synchronized Issue close(String issueId, long expectedRevision) {
        return changeState(issueId, expectedRevision, IssueState.CLOSED);
    }

    @Override
    public synchronized Issue reopen(String issueId, long expectedRevision) {
        return changeState(issueId, expectedRevision, IssueState.OPEN);
    }

    private Issue changeState(String issueId, long expectedRevision, IssueState state) {
        Issue current = requireAt(issueId, expectedRevision);
        return store(new Issue(current.id(), current.title(), current.body(), current.labels(), current.assignee(),
                current.parentId(), state, current.revision() + 1, clock.instant()));
    }

    private Comment append(Issue current, String author, String body) {
        Instant now = clock.instant();
        var comment = new Comment("C-" + commentSequence.incrementAndGet(), current.id(), author, body, now);
        comments.get(current.id()).add(comment);
        store(new Issue(current.id(), current.title(), current.body(), current.labels(), current.assignee(),
                current.parentId(), current.state(), current.revision() + 1, now));
        return comment;
    }

    private Issue store(Issue issue) {
        issues.put(issue.id(), issue);
        return issue;
    }

    private Issue require(String issueId) {
        Issue issue = issues.get(stripHash(issueId));
        if (issue == null) {
            throw new TicketStoreException("Issue " + issueId + " not found");
        }
        return issue;
    }

    private Issue requireAt(String issueId, long expectedRevision) {
        Issue issue = require(issueId);
        if (issue.revision() != expectedRevision) {
            throw new StaleRevisionException(issue.id(), expectedRevision, issue.revision());
        }
        return issue;
    }

    private String nextIssueId() {
        String id;
        do {
            id = String.valueOf(issueSequence.incrementAndGet());
        } while (issues.containsKey(id));
        return id;
    }

    private static String stripHash(String id) {
        return id.startsWith("#") ? id.substring(1) : id;
    }

    private static int compareIds(String a, String b) {
        boolean numericA = a.chars().allMatch(Character::isDigit);
        boolean numericB = b.chars().allMatch(Character::isDigit);
        if (numericA && numericB) {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        }
        return a.compareTo(b);
    }
}
