package com.sitecraft.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.sitecraft.source.ChangeSet;

class BuildStateTest {

    @Test
    void shouldAllowOnlyTheCycleOrderAndTheAggregateLoop() {
        assertTrue(BuildState.IDLE.canTransitionTo(BuildState.DISCOVERING));
        assertTrue(BuildState.COLLECTING.canTransitionTo(BuildState.RECOMPUTING_AGGREGATES));
        assertTrue(BuildState.RECOMPUTING_AGGREGATES.canTransitionTo(BuildState.DISPATCHING));
        assertTrue(BuildState.RECOMPUTING_AGGREGATES.canTransitionTo(BuildState.COMMITTING));
        assertTrue(BuildState.COMMITTING.canTransitionTo(BuildState.IDLE));

        assertFalse(BuildState.DISCOVERING.canTransitionTo(BuildState.COMMITTING));
        assertFalse(BuildState.DISPATCHING.canTransitionTo(BuildState.IDLE));
        assertFalse(BuildState.IDLE.canTransitionTo(BuildState.FAILED));
    }

    @Test
    void shouldAllowFailureFromEveryActiveStateAndRestartAfterIt() {
        for (BuildState state : BuildState.values()) {
            if (state != BuildState.IDLE && state != BuildState.FAILED) {
                assertTrue(state.canTransitionTo(BuildState.FAILED), state.name());
            }
        }
        assertTrue(BuildState.FAILED.canTransitionTo(BuildState.DISCOVERING));
    }

    @Test
    void shouldMapReportsToExitCodes() {
        BuildReport clean = report(BuildState.IDLE, List.of());
        BuildReport partial = report(BuildState.IDLE, List.of(new BuildFailure("a.html", FailureCategory.RENDER, "boom")));
        BuildReport failed = report(BuildState.FAILED, List.of(BuildFailure.cycle(FailureCategory.CONFIG, "bad")));

        assertEquals(0, clean.exitCode());
        assertEquals(1, partial.exitCode());
        assertEquals(2, failed.exitCode());
        assertTrue(FailureCategory.CONFIG.isCycleFatal());
        assertFalse(FailureCategory.RENDER.isCycleFatal());
    }

    private static BuildReport report(BuildState state, List<BuildFailure> failures) {
        return new BuildReport(BuildMode.INCREMENTAL, state, ChangeSet.empty(), 0, 0, 0, 0, false, 1L, failures, Map.of());
    }
}
