package com.sitecraft.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Offline-calibrated scheduling profile of one phase.
 * <ul>
 * <li>{@code breakEvenThreshold}: below this many tasks sequential execution wins.</li>
 * <li>{@code smallWorkloadWorkers} / {@code largeWorkloadWorkers}: best worker count for workloads under and
 * at or above {@code largeWorkloadThreshold} tasks.</li>
 * <li>{@code contentionPoint}: worker count beyond which a slowdown of 10% or more was measured.</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PhaseProfile {
    private int breakEvenThreshold = 8;
    private int smallWorkloadWorkers = 2;
    private int largeWorkloadWorkers = 4;
    private int largeWorkloadThreshold = 200;
    private int contentionPoint = 8;

    public PhaseProfile() {
    }

    public PhaseProfile(int breakEvenThreshold, int smallWorkloadWorkers, int largeWorkloadWorkers, int largeWorkloadThreshold, int contentionPoint) {
        this.breakEvenThreshold = breakEvenThreshold;
        this.smallWorkloadWorkers = smallWorkloadWorkers;
        this.largeWorkloadWorkers = largeWorkloadWorkers;
        this.largeWorkloadThreshold = largeWorkloadThreshold;
        this.contentionPoint = contentionPoint;
    }

    public void validate(String phaseName) {
        if (breakEvenThreshold < 1 || smallWorkloadWorkers < 1 || largeWorkloadWorkers < 1 || contentionPoint < 1) {
            throw new IllegalArgumentException("scheduler profile " + phaseName + " must use positive thresholds and worker counts");
        }
        if (largeWorkloadThreshold < breakEvenThreshold) {
            throw new IllegalArgumentException("scheduler profile " + phaseName + " has largeWorkloadThreshold below breakEvenThreshold");
        }
    }

    public int optimalWorkers(int taskCount) {
        return taskCount >= largeWorkloadThreshold ? largeWorkloadWorkers : smallWorkloadWorkers;
    }

    public int getBreakEvenThreshold() {
        return breakEvenThreshold;
    }

    public void setBreakEvenThreshold(int breakEvenThreshold) {
        this.breakEvenThreshold = breakEvenThreshold;
    }

    public int getSmallWorkloadWorkers() {
        return smallWorkloadWorkers;
    }

    public void setSmallWorkloadWorkers(int smallWorkloadWorkers) {
        this.smallWorkloadWorkers = smallWorkloadWorkers;
    }

    public int getLargeWorkloadWorkers() {
        return largeWorkloadWorkers;
    }

    public void setLargeWorkloadWorkers(int largeWorkloadWorkers) {
        this.largeWorkloadWorkers = largeWorkloadWorkers;
    }

    public int getLargeWorkloadThreshold() {
        return largeWorkloadThreshold;
    }

    public void setLargeWorkloadThreshold(int largeWorkloadThreshold) {
        this.largeWorkloadThreshold = largeWorkloadThreshold;
    }

    public int getContentionPoint() {
        return contentionPoint;
    }

    public void setContentionPoint(int contentionPoint) {
        this.contentionPoint = contentionPoint;
    }
}
