package com.baton.core.violation;

import com.baton.core.config.BatonProperties;
import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.marker.Markers;
import com.baton.core.model.Phase;
import com.baton.core.model.ReviewCycleStatus;
import com.baton.core.model.ReviewCycleStatus.Requirement;
import com.baton.core.model.StatusEvent;
import com.baton.core.model.WorkItem;
import com.baton.core.store.IssueState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReviewCyclePolicyTest {

    private ReviewCyclePolicy policy;
    private List<StatusEvent> events;

    @BeforeEach
    void setUp() {
        policy = new ReviewCyclePolicy(new BatonProperties());
        events = new ArrayList<>();
    }

    private void post(String author, MarkerBlock block) {
        events.add(new StatusEvent("C-" + (events.size() + 1), author, Markers.render(block), Instant.now(),
                "baton".equals(author)));
    }

    private void transition(Phase from, Phase to) {
        post("baton", MarkerBlock.builder(MarkerType.TRANSITION)
                .field("from", from.tag())
                .field("to", to.tag())
                .field("actor", "reviewer")
                .build());
    }

    private void reviewCycles(int cycles) {
        for (int i = 0; i < cycles; i++) {
            if (i > 0) transition(Phase.REVIEW_OPEN, Phase.DEV_OPEN);
            transition(Phase.TEST_CLOSED, Phase.REVIEW_OPEN);
        }
    }

    private WorkItem item() {
        return new WorkItem("50", "Retry logic", "", Phase.REVIEW_OPEN, Set.of("state:review_open"), "dev", null,
                null, events, IssueState.OPEN, events.size() + 1);
    }

    @Test
    @DisplayName("an item that never entered review has cycle 0 and no requirement")
    void noReview() {
        assertEquals(new ReviewCycleStatus(0, Requirement.NONE, true), policy.assess(item()));
    }

    @Test
    @DisplayName("cycles 1 and 2 demote freely")
    void normalCycles() {
        reviewCycles(2);

        ReviewCycleStatus status = policy.assess(item());

        assertEquals(2, status.cycle());
        assertEquals(2, policy.cycle(item()));
        assertTrue(status.allowsDemotion());
    }

    @Test
    @DisplayName("cycle 3 needs a pattern note posted during that cycle")
    void patternNote() {
        reviewCycles(2);
        post("dev", MarkerBlock.builder(MarkerType.PATTERN).field("note", "too early").build());
        transition(Phase.REVIEW_OPEN, Phase.DEV_OPEN);
        transition(Phase.TEST_CLOSED, Phase.REVIEW_OPEN);

        ReviewCycleStatus before = policy.assess(item());
        assertEquals(3, before.cycle());
        assertEquals(Requirement.PATTERN_NOTE, before.requirement());
        assertFalse(before.allowsDemotion());

        post("dev", MarkerBlock.builder(MarkerType.PATTERN).field("note", "retries reuse a closed client").build());
        assertTrue(policy.assess(item()).allowsDemotion());
    }

    @Test
    @DisplayName("a pattern block without a note does not count")
    void emptyPattern() {
        reviewCycles(3);
        post("dev", MarkerBlock.builder(MarkerType.PATTERN).field("seen", "yes").build());

        assertFalse(policy.assess(item()).allowsDemotion());
    }

    @Test
    @DisplayName("cycle 4 onwards needs an escalation naming a maintainer")
    void escalation() {
        reviewCycles(4);
        post("dev", MarkerBlock.builder(MarkerType.PATTERN).field("note", "still flaky").build());

        ReviewCycleStatus status = policy.assess(item());
        assertEquals(Requirement.ESCALATION, status.requirement());
        assertFalse(status.allowsDemotion());

        post("dev", MarkerBlock.builder(MarkerType.ESCALATION).field("reason", "stuck").build());
        assertFalse(policy.assess(item()).allowsDemotion());

        post("dev", MarkerBlock.builder(MarkerType.ESCALATION).field("maintainer", "@lead").build());
        assertTrue(policy.assess(item()).allowsDemotion());
    }

    @Test
    @DisplayName("thresholds come from configuration")
    void configurable() {
        var properties = new BatonProperties();
        properties.getReviewCycle().setPatternNoteCycle(2);
        properties.getReviewCycle().setEscalationCycle(3);
        var strict = new ReviewCyclePolicy(properties);
        reviewCycles(2);

        assertEquals(Requirement.PATTERN_NOTE, strict.assess(item()).requirement());
    }
}
