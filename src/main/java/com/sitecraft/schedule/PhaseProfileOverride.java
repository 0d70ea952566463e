package com.sitecraft.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Partial {@link PhaseProfile} from engine configuration. Unset fields keep the shipped value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PhaseProfileOverride {
    private Integer breakEvenThreshold;
    private Integer smallWorkloadWorkers;
    private Integer largeWorkloadWorkers;
    private Integer largeWorkloadThreshold;
    private Integer contentionPoint;

    public PhaseProfile applyTo(PhaseProfile base) {
        return new PhaseProfile(
                breakEvenThreshold != null ? breakEvenThreshold : base.getBreakEvenThreshold(),
                smallWorkloadWorkers != null ? smallWorkloadWorkers : base.getSmallWorkloadWorkers(),
                largeWorkloadWorkers != null ? largeWorkloadWorkers : base.getLargeWorkloadWorkers(),
                largeWorkloadThreshold != null ? largeWorkloadThreshold : base.getLargeWorkloadThreshold(),
                contentionPoint != null ? contentionPoint : base.getContentionPoint());
    }

    public Integer getBreakEvenThreshold() {
        return breakEvenThreshold;
    }

    public void setBreakEvenThreshold(Integer breakEvenThreshold) {
        this.breakEvenThreshold = breakEvenThreshold;
    }

    public Integer getSmallWorkloadWorkers() {
        return smallWorkloadWorkers;
    }

    public void setSmallWorkloadWorkers(Integer smallWorkloadWorkers) {
        this.smallWorkloadWorkers = smallWorkloadWorkers;
    }

    public Integer getLargeWorkloadWorkers() {
        return largeWorkloadWorkers;
    }

    public void setLargeWorkloadWorkers(Integer largeWorkloadWorkers) {
        this.largeWorkloadWorkers = largeWorkloadWorkers;
    }

    public Integer getLargeWorkloadThreshold() {
        return largeWorkloadThreshold;
    }

    public void setLargeWorkloadThreshold(Integer largeWorkloadThreshold) {
        this.largeWorkloadThreshold = largeWorkloadThreshold;
    }

    public Integer getContentionPoint() {
        return contentionPoint;
    }

    public void setContentionPoint(Integer contentionPoint) {
        this.contentionPoint = contentionPoint;
    }
}
