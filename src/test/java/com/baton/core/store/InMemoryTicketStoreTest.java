package com.baton.core.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTicketStoreTest {

    private InMemoryTicketStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTicketStore();
    }

    @Test
    @DisplayName("created issues get sequential ids and start at revision 1")
    void createIssue() {
        var first = store.createIssue(new NewIssue(null, "One", "", Set.of("a"), null));
        var second = store.createIssue(new NewIssue(null, "Two", "", Set.of(), null));

        assertEquals("1", first.id());
        assertEquals("2", second.id());
        assertEquals(1, first.revision());
        assertEquals(IssueState.OPEN, first.state());
    }

    @Test
    @DisplayName("creating a child of a missing parent fails")
    void missingParent() {
        assertThrows(TicketStoreException.class,
                () -> store.createIssue(new NewIssue(null, "Child", "", Set.of(), "99")));
    }

    @Test
    @DisplayName("every write bumps the revision")
    void writesBumpRevision() {
        var issue = store.createIssue(new NewIssue(null, "One", "", Set.of(), null));

        var labelled = store.updateLabels(issue.id(), 1, Set.of("ready"), Set.of());
        store.postComment(issue.id(), "alice", "hello");
        var assigned = store.assign(issue.id(), 3, "alice");

        assertEquals(2, labelled.revision());
        assertEquals(4, assigned.revision());
        assertEquals("alice", assigned.assignee());
    }

    @Test
    @DisplayName("conditional writes against an old revision are refused and change nothing")
    void staleWriteRefused() {
        var issue = store.createIssue(new NewIssue(null, "One", "", Set.of(), null));
        store.updateLabels(issue.id(), 1, Set.of("state:ready"), Set.of());

        var e = assertThrows(StaleRevisionException.class,
                () -> store.updateLabels(issue.id(), 1, Set.of("state:claimed"), Set.of("state:ready")));

        assertEquals(1, e.getExpectedRevision());
        assertEquals(2, e.getActualRevision());
        assertEquals(Set.of("state:ready"), store.findIssue(issue.id()).orElseThrow().labels());
        assertThrows(StaleRevisionException.class, () -> store.postComment(issue.id(), 1, "bob", "late"));
        assertTrue(store.listComments(issue.id()).isEmpty());
    }

    @Test
    @DisplayName("comments keep posting order and ids accept a leading #")
    void commentsInOrder() {
        var issue = store.createIssue(new NewIssue(null, "One", "", Set.of(), null));
        store.postComment(issue.id(), "a", "first");
        store.postComment("#" + issue.id(), "b", "second");

        List<Comment> comments = store.listComments(issue.id());
        assertEquals(List.of("first", "second"), comments.stream().map(Comment::body).toList());
    }

    @Test
    @DisplayName("listIssues filters by parent, label and state")
    void listIssues() {
        var epic = store.createIssue(new NewIssue(null, "Epic", "", Set.of("epic"), null));
        var child = store.createIssue(new NewIssue(null, "Child", "", Set.of("wave:1"), epic.id()));
        store.createIssue(new NewIssue(null, "Loose", "", Set.of("wave:1"), null));
        store.close(child.id(), 1);

        assertEquals(List.of(child.id()),
                store.listIssues(IssueQuery.childrenOf(epic.id())).stream().map(Issue::id).toList());
        assertEquals(2, store.listIssues(IssueQuery.withLabel("wave:1")).size());
        assertEquals(1, store.listIssues(new IssueQuery(null, Set.of(), IssueState.CLOSED)).size());
    }
}
