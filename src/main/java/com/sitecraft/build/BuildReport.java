package com.sitecraft.build;

import java.util.List;
import java.util.Map;

import com.sitecraft.source.ChangeSet;

/**
 * Summary of one cycle handed back to the driver.
 *
 * @param dirtyReasons why each re-rendered output was dirty; empty in fast mode
 */
public record BuildReport(
        BuildMode mode,
        BuildState finalState,
        ChangeSet changeSet,
        int rebuilt,
        int reused,
        int removed,
        int aggregatePasses,
        boolean aggregateCapReached,
        long elapsedMillis,
        List<BuildFailure> failures,
        Map<String, String> dirtyReasons) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ARTIFACT_FAILURES = 1;
    public static final int EXIT_CYCLE_FAILED = 2;

    public BuildReport {
        failures = List.copyOf(failures);
        dirtyReasons = Map.copyOf(dirtyReasons);
    }

    public int failed() {
        return failures.size();
    }

    public boolean cycleFailed() {
        return finalState == BuildState.FAILED;
    }

    public int exitCode() {
        if (cycleFailed()) {
            return EXIT_CYCLE_FAILED;
        }
        return failures.isEmpty() ? EXIT_OK : EXIT_ARTIFACT_FAILURES;
    }
}
