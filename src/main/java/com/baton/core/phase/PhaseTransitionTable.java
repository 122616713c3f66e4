package com.baton.core.phase;

import com.baton.core.model.Phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal direct successors of each phase. {@code completed} has none.
 */
public final class PhaseTransitionTable {

    private static final Map<Phase, Set<Phase>> SUCCESSORS = new EnumMap<>(Phase.class);

    static {
        SUCCESSORS.put(Phase.READY, EnumSet.of(Phase.CLAIMED));
        SUCCESSORS.put(Phase.CLAIMED, EnumSet.of(Phase.DEV_OPEN));
        SUCCESSORS.put(Phase.DEV_OPEN, EnumSet.of(Phase.DEV_CLOSED));
        SUCCESSORS.put(Phase.DEV_CLOSED, EnumSet.of(Phase.TEST_OPEN));
        SUCCESSORS.put(Phase.TEST_OPEN, EnumSet.of(Phase.TEST_CLOSED));
        SUCCESSORS.put(Phase.TEST_CLOSED, EnumSet.of(Phase.REVIEW_OPEN));
        SUCCESSORS.put(Phase.REVIEW_OPEN, EnumSet.of(Phase.COMPLETED, Phase.REVIEW_FAILED, Phase.DEV_OPEN));
        SUCCESSORS.put(Phase.REVIEW_FAILED, EnumSet.of(Phase.DEV_OPEN));
        SUCCESSORS.put(Phase.COMPLETED, EnumSet.noneOf(Phase.class));
    }

    private PhaseTransitionTable() {}

    public static boolean allows(Phase from, Phase to) {
        return SUCCESSORS.getOrDefault(from, Set.of()).contains(to);
    }

    public static Set<Phase> successors(Phase from) {
        return Collections.unmodifiableSet(SUCCESSORS.getOrDefault(from, EnumSet.noneOf(Phase.class)));
    }

    /** Review back to dev: either the direct demotion or the return after a failed review. */
    public static boolean isDemotion(Phase from, Phase to) {
        return to == Phase.DEV_OPEN && (from == Phase.REVIEW_OPEN || from == Phase.REVIEW_FAILED);
    }

    /** Never legal, whatever the table says. */
    public static boolean isReviewToTest(Phase from, Phase to) {
        return from == Phase.REVIEW_OPEN && to == Phase.TEST_OPEN;
    }
}
