package com.baton.core.checkpoint;

import com.baton.core.CoordinationFixture;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.marker.MarkerType;
import com.baton.core.model.Checkpoint;
import com.baton.core.model.CheckpointValidation;
import com.baton.core.model.Phase;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.ViolationKind;
import com.baton.core.model.Wave;
import com.baton.core.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointValidatorTest {

    private static final String COMPLETE = """
            <!-- baton:checkpoint -->
            work log: Added retry with backoff to the uploader
            completed:
            - retry loop
            in progress: none
            pending:
            - metrics
            changed:
            - src/Uploader.java
            commits: abc123
            branch: feature/retry
            next action: Add a counter for retries
            <!-- /baton:checkpoint -->
            """;

    private CoordinationFixture fixture;
    private CheckpointValidator validator;

    @BeforeEach
    void setUp() {
        fixture = new CoordinationFixture();
        validator = fixture.checkpointValidator;
    }

    private static StatusEvent event(String body) {
        return new StatusEvent("C-1", "alice", body, Instant.now(), false);
    }

    @Nested
    @DisplayName("validateCheckpoint")
    class Validate {

        @Test
        @DisplayName("a checkpoint with every section and a concrete next action is valid")
        void complete() {
            CheckpointValidation result = validator.validateCheckpoint(event(COMPLETE));
            assertTrue(result.valid(), result.reason());
        }

        @Test
        @DisplayName("missing next action is reported")
        void missingNextAction() {
            CheckpointValidation result = validator.validateCheckpoint(
                    event(COMPLETE.replace("next action: Add a counter for retries\n", "")));

            assertFalse(result.valid());
            assertEquals(List.of(Checkpoint.NEXT_ACTION), result.missing());
        }

        @Test
        @DisplayName("placeholder next actions such as 'continue.' are rejected")
        void placeholderNextAction() {
            CheckpointValidation result = validator.validateCheckpoint(
                    event(COMPLETE.replace("Add a counter for retries", "Continue.")));

            assertEquals(List.of(Checkpoint.NEXT_ACTION), result.missing());
        }

        @Test
        @DisplayName("every absent section is listed")
        void severalMissing() {
            CheckpointValidation result = validator.validateCheckpoint(event("""
                    <!-- baton:checkpoint -->
                    completed: parser
                    next action: write tests
                    <!-- /baton:checkpoint -->
                    """));

            assertEquals(List.of(Checkpoint.WORK_LOG, Checkpoint.IN_PROGRESS, Checkpoint.PENDING,
                    Checkpoint.CHANGED, Checkpoint.COMMITS, Checkpoint.BRANCH), result.missing());
        }

        @Test
        @DisplayName("a comment without a checkpoint block is incomplete")
        void noBlock() {
            CheckpointValidation result = validator.validateCheckpoint(event("work log: lots"));
            assertEquals(List.of("checkpoint"), result.missing());
        }
    }

    @Nested
    @DisplayName("Unrecoverable state")
    class Unrecoverable {

        private String item;

        @BeforeEach
        void inDev() {
            String epic = fixture.epic("Uploads");
            item = fixture.item(epic, Wave.numbered(1), "Retry");
            fixture.startDev(item, "alice", "src/Uploader.java");
        }

        @Test
        @DisplayName("an incomplete checkpoint flags the item and blocks transitions until a complete one")
        void flagsAndRecovers() {
            var incomplete = new Checkpoint("Added retry", List.of(), List.of(), List.of(), List.of(), List.of(),
                    "feature/retry", null, null);

            CheckpointValidation result = validator.recordCheckpoint(item, "alice", incomplete);

            assertFalse(result.valid());
            WorkItem flagged = fixture.get(item);
            assertTrue(flagged.isUnrecoverable());
            assertEquals(1, fixture.violationEngine.occurrences(flagged, "alice", ViolationKind.MISSING_CHECKPOINT));
            var e = assertThrows(CoordinationException.class,
                    () -> fixture.stateMachine.requestTransition(item, Phase.DEV_OPEN, Phase.DEV_CLOSED, "alice"));
            assertEquals(RuleViolation.UNRECOVERABLE_STATE, e.getRule());
            assertEquals(Phase.DEV_OPEN, fixture.get(item).phase());

            fixture.checkpoint(item, "alice", null);

            assertFalse(fixture.get(item).isUnrecoverable());
            assertDoesNotThrow(
                    () -> fixture.stateMachine.requestTransition(item, Phase.DEV_OPEN, Phase.DEV_CLOSED, "alice"));
        }

        @Test
        @DisplayName("validateLatest reports and flags without recording a violation")
        void validateLatest() {
            fixture.store.postComment(item, "alice", COMPLETE.replace("branch: feature/retry\n", ""));

            CheckpointValidation result = validator.validateLatest(item);

            assertEquals(List.of(Checkpoint.BRANCH), result.missing());
            assertTrue(fixture.get(item).isUnrecoverable());
            assertTrue(fixture.violationEngine.currentViolations(fixture.get(item)).isEmpty());
        }

        @Test
        @DisplayName("an item that never checkpointed is incomplete but not flagged")
        void neverCheckpointed() {
            CheckpointValidation result = validator.validateLatest(item);

            assertFalse(result.valid());
            assertNull(result.eventId());
            assertFalse(fixture.get(item).isUnrecoverable());
        }

        @Test
        @DisplayName("checkpoints posted through comments are validated by the engine")
        void viaEngine() {
            fixture.comment(item, "alice", COMPLETE.replace("next action: Add a counter for retries\n",
                    "next action: tbd\n"));

            assertTrue(fixture.get(item).isUnrecoverable());
            assertTrue(fixture.get(item).hasLabel("unrecoverable-state"));
        }
    }

    @Nested
    @DisplayName("Test thread")
    class TestThread {

        @Test
        @DisplayName("a checkpoint listing changes inside the test thread records TEST_SCOPE_EXCEEDED")
        void testScopeExceeded() {
            String epic = fixture.epic("Uploads");
            String item = fixture.item(epic, Wave.numbered(1), "Retry");
            fixture.startDev(item, "alice", "src/Uploader.java");
            fixture.move(item, Phase.DEV_OPEN, Phase.DEV_CLOSED, "alice");
            fixture.move(item, Phase.DEV_CLOSED, Phase.TEST_OPEN, "bob");

            fixture.comment(item, "bob", COMPLETE);

            assertEquals(1, fixture.violationEngine.occurrences(fixture.get(item), "bob",
                    ViolationKind.TEST_SCOPE_EXCEEDED));
        }
    }

    @Nested
    @DisplayName("Final checkpoint")
    class FinalCheckpoint {

        private String item;

        @BeforeEach
        void inReview() {
            String epic = fixture.epic("Uploads");
            item = fixture.item(epic, Wave.numbered(1), "Retry");
            fixture.startDev(item, "alice", "src/Uploader.java");
            fixture.toReview(item, "alice", "bob", "carol");
        }

        @Test
        @DisplayName("closing requires the latest checkpoint to state the outcome")
        void outcomeRequired() {
            fixture.checkpoint(item, "carol", null);

            var e = assertThrows(CoordinationException.class, () -> fixture.stateMachine.requestTransition(
                    item, Phase.REVIEW_OPEN, Phase.COMPLETED, "carol"));

            assertEquals(RuleViolation.INCOMPLETE_CHECKPOINT, e.getRule());
            assertEquals(Phase.REVIEW_OPEN, fixture.get(item).phase());
        }

        @Test
        @DisplayName("closing with no checkpoint at all is refused")
        void noCheckpoint() {
            var e = assertThrows(CoordinationException.class, () -> validator.requireFinalCheckpoint(fixture.get(item)));
            assertEquals(RuleViolation.INCOMPLETE_CHECKPOINT, e.getRule());
        }

        @Test
        @DisplayName("a final checkpoint with an outcome allows closure")
        void withOutcome() {
            fixture.checkpoint(item, "carol", "merged");

            Checkpoint accepted = validator.requireFinalCheckpoint(fixture.get(item));

            assertEquals("merged", accepted.outcome());
            assertEquals(1, fixture.get(item).marked(MarkerType.CHECKPOINT).size());
        }
    }
}
