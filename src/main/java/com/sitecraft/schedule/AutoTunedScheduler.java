package com.sitecraft.schedule;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides per phase whether to parallelize and with how many workers, from calibrated profiles. No timing
 * is sampled during a build.
 */
public class AutoTunedScheduler {
    private static final Logger log = LoggerFactory.getLogger(AutoTunedScheduler.class);

    private final PhaseProfiles profiles;
    private final BuildEnvironment environment;
    private final boolean parallelEnabled;
    private final int maxWorkers;
    private final int availableCores;

    public AutoTunedScheduler(PhaseProfiles profiles, BuildEnvironment environment, boolean parallelEnabled, int maxWorkers) {
        this(profiles, environment, parallelEnabled, maxWorkers, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param maxWorkers upper bound on workers per phase, 0 for no bound beyond the profile
     * @param availableCores processors the pool may occupy
     */
    public AutoTunedScheduler(PhaseProfiles profiles, BuildEnvironment environment, boolean parallelEnabled, int maxWorkers, int availableCores) {
        this.profiles = profiles;
        this.environment = environment;
        this.parallelEnabled = parallelEnabled;
        this.maxWorkers = maxWorkers;
        this.availableCores = Math.max(1, availableCores);
    }

    public SchedulingDecision choose(Phase phase, int taskCount) {
        SchedulingDecision decision = decide(phase, taskCount);
        log.debug("schedule.choose phase={} tasks={} workers={} parallel={} reason={}",
                phase.key(), taskCount, decision.workers(), decision.parallel(), decision.reason());
        return decision;
    }

    private SchedulingDecision decide(Phase phase, int taskCount) {
        if (!parallelEnabled) {
            return SchedulingDecision.sequential(phase, taskCount, "parallel disabled");
        }
        if (taskCount <= 1) {
            return SchedulingDecision.sequential(phase, taskCount, "single task");
        }
        PhaseProfile profile = profiles.get(phase);
        if (taskCount < profile.getBreakEvenThreshold()) {
            return SchedulingDecision.sequential(phase, taskCount, "below break-even " + profile.getBreakEvenThreshold());
        }

        int workers = Math.min(profile.optimalWorkers(taskCount), profile.getContentionPoint());
        String reason = taskCount >= profile.getLargeWorkloadThreshold() ? "large workload" : "small workload";
        if (maxWorkers > 0 && workers > maxWorkers) {
            workers = maxWorkers;
            reason = reason + ", capped by max workers";
        }
        if (workers > availableCores) {
            workers = availableCores;
            reason = reason + ", capped at " + availableCores + " cores";
        }
        if (workers > environment.workerCap()) {
            workers = environment.workerCap();
            reason = reason + ", capped for " + environment.name().toLowerCase(Locale.ROOT);
        }
        workers = Math.min(workers, taskCount);
        if (workers <= 1) {
            return SchedulingDecision.sequential(phase, taskCount, reason);
        }
        return new SchedulingDecision(phase, taskCount, workers, true, reason);
    }
}
