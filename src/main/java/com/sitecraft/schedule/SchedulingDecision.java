package com.sitecraft.schedule;

public record SchedulingDecision(Phase phase, int taskCount, int workers, boolean parallel, String reason) {

    public static SchedulingDecision sequential(Phase phase, int taskCount, String reason) {
        return new SchedulingDecision(phase, taskCount, 1, false, reason);
    }
}
