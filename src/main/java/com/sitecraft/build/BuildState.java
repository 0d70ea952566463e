package com.sitecraft.build;

import java.util.EnumSet;
import java.util.Set;

public enum BuildState {
    IDLE,
    DISCOVERING,
    DIFFING_CACHE,
    PROPAGATING_INVALIDATION,
    DISPATCHING,
    COLLECTING,
    RECOMPUTING_AGGREGATES,
    COMMITTING,
    FAILED;

    public boolean canTransitionTo(BuildState next) {
        if (next == FAILED) {
            return this != IDLE && this != FAILED;
        }
        return successors().contains(next);
    }

    private Set<BuildState> successors() {
        switch (this) {
            case IDLE:
            case FAILED:
                return EnumSet.of(DISCOVERING);
            case DISCOVERING:
                return EnumSet.of(DIFFING_CACHE);
            case DIFFING_CACHE:
                return EnumSet.of(PROPAGATING_INVALIDATION);
            case PROPAGATING_INVALIDATION:
                return EnumSet.of(DISPATCHING);
            case DISPATCHING:
                return EnumSet.of(COLLECTING);
            case COLLECTING:
                return EnumSet.of(RECOMPUTING_AGGREGATES);
            case RECOMPUTING_AGGREGATES:
                return EnumSet.of(DISPATCHING, COMMITTING);
            case COMMITTING:
                return EnumSet.of(IDLE);
            default:
                return EnumSet.noneOf(BuildState.class);
        }
    }
}
