package com.sitecraft.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sitecraft.schedule.PhaseProfileOverride;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    private BuildConfig build = new BuildConfig();
    private CacheConfig cache = new CacheConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();

    public BuildConfig getBuild() {
        return build;
    }

    public void setBuild(BuildConfig build) {
        this.build = build == null ? new BuildConfig() : build;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public SchedulerConfig getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerConfig scheduler) {
        this.scheduler = scheduler == null ? new SchedulerConfig() : scheduler;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BuildConfig {
        private boolean parallel = true;
        private boolean fast;
        private boolean memoryOptimized;
        private int maxWorkers;
        private long renderTimeoutMs;
        private int aggregateIterationCap = 3;
        private String environment = "auto";
        private String siteConfig = "site.yml";

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }

        public boolean isFast() {
            return fast;
        }

        public void setFast(boolean fast) {
            this.fast = fast;
        }

        public boolean isMemoryOptimized() {
            return memoryOptimized;
        }

        public void setMemoryOptimized(boolean memoryOptimized) {
            this.memoryOptimized = memoryOptimized;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public long getRenderTimeoutMs() {
            return renderTimeoutMs;
        }

        public void setRenderTimeoutMs(long renderTimeoutMs) {
            this.renderTimeoutMs = renderTimeoutMs;
        }

        public int getAggregateIterationCap() {
            return aggregateIterationCap;
        }

        public void setAggregateIterationCap(int aggregateIterationCap) {
            this.aggregateIterationCap = aggregateIterationCap;
        }

        public String getEnvironment() {
            return environment;
        }

        public void setEnvironment(String environment) {
            this.environment = environment;
        }

        public String getSiteConfig() {
            return siteConfig;
        }

        public void setSiteConfig(String siteConfig) {
            this.siteConfig = siteConfig;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private String path = ".sitecraft/build-cache.json";
        private String compression = "auto";
        private double maxDecompressFraction = 0.05;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getCompression() {
            return compression;
        }

        public void setCompression(String compression) {
            this.compression = compression;
        }

        public double getMaxDecompressFraction() {
            return maxDecompressFraction;
        }

        public void setMaxDecompressFraction(double maxDecompressFraction) {
            this.maxDecompressFraction = maxDecompressFraction;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchedulerConfig {
        private Map<String, PhaseProfileOverride> profiles = new LinkedHashMap<>();

        public Map<String, PhaseProfileOverride> getProfiles() {
            return profiles;
        }

        public void setProfiles(Map<String, PhaseProfileOverride> profiles) {
            this.profiles = profiles == null ? new LinkedHashMap<>() : profiles;
        }
    }
}
