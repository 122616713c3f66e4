package com.baton.core.violation;

import com.baton.core.config.BatonProperties;
import com.baton.core.marker.MarkerType;
import com.baton.core.model.MarkedEvent;
import com.baton.core.model.Phase;
import com.baton.core.model.ReviewCycleStatus;
import com.baton.core.model.ReviewCycleStatus.Requirement;
import com.baton.core.model.TransitionRecord;
import com.baton.core.model.WorkItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Review-cycle escalation: cycles 1-2 are normal, the pattern-note cycle needs a recorded
 * pattern note before demotion, and the escalation cycle onwards needs an escalation
 * addressed to a human maintainer.
 */
@Component
public class ReviewCyclePolicy {

    private final int patternNoteCycle;
    private final int escalationCycle;

    public ReviewCyclePolicy(BatonProperties properties) {
        this.patternNoteCycle = properties.getReviewCycle().getPatternNoteCycle();
        this.escalationCycle = properties.getReviewCycle().getEscalationCycle();
    }

    /** Number of times the item has entered review. */
    public int cycle(WorkItem item) {
        return (int) item.transitions().stream().filter(t -> t.to() == Phase.REVIEW_OPEN).count();
    }

    public ReviewCycleStatus assess(WorkItem item) {
        List<TransitionRecord> reviews = item.transitions().stream()
                .filter(t -> t.to() == Phase.REVIEW_OPEN)
                .toList();
        int cycle = reviews.size();
        if (cycle == 0) {
            return new ReviewCycleStatus(0, Requirement.NONE, true);
        }
        int cycleStart = reviews.get(cycle - 1).index();

        if (cycle >= escalationCycle) {
            boolean escalated = item.marked(MarkerType.ESCALATION).stream()
                    .filter(m -> m.index() > cycleStart)
                    .anyMatch(m -> !m.block().text("maintainer").isEmpty());
            return new ReviewCycleStatus(cycle, Requirement.ESCALATION, escalated);
        }
        if (cycle >= patternNoteCycle) {
            boolean noted = item.marked(MarkerType.PATTERN).stream()
                    .filter(m -> m.index() > cycleStart)
                    .map(MarkedEvent::block)
                    .anyMatch(b -> !b.text("note").isEmpty() || !b.text("pattern").isEmpty());
            return new ReviewCycleStatus(cycle, Requirement.PATTERN_NOTE, noted);
        }
        return new ReviewCycleStatus(cycle, Requirement.NONE, true);
    }
}
