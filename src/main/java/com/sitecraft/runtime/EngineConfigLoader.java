package com.sitecraft.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sitecraft.cache.CompressionMode;
import com.sitecraft.schedule.PhaseProfiles;

/**
 * Reads {@code sitecraft.yml}. A missing file yields the defaults.
 */
public class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public EngineConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            log.debug("config.engine path={} present=false; using defaults", config);
            return new EngineConfig();
        }
        EngineConfig loaded = mapper.readValue(config.toFile(), EngineConfig.class);
        validate(loaded);
        log.debug("config.engine path={} present=true", config);
        return loaded;
    }

    static void validate(EngineConfig config) {
        EngineConfig.BuildConfig build = config.getBuild();
        if (build.getMaxWorkers() < 0) {
            throw new IllegalArgumentException("build.maxWorkers must be >= 0");
        }
        if (build.getRenderTimeoutMs() < 0) {
            throw new IllegalArgumentException("build.renderTimeoutMs must be >= 0");
        }
        if (build.getAggregateIterationCap() < 1) {
            throw new IllegalArgumentException("build.aggregateIterationCap must be >= 1");
        }
        if (build.getSiteConfig() == null || build.getSiteConfig().isBlank()) {
            throw new IllegalArgumentException("build.siteConfig must be set");
        }
        EngineConfig.CacheConfig cache = config.getCache();
        if (cache.getPath() == null || cache.getPath().isBlank()) {
            throw new IllegalArgumentException("cache.path must be set");
        }
        CompressionMode.parse(cache.getCompression());
        if (cache.getMaxDecompressFraction() <= 0 || cache.getMaxDecompressFraction() > 1) {
            throw new IllegalArgumentException("cache.maxDecompressFraction must be in (0, 1]");
        }
        PhaseProfiles.loadDefaults().withOverrides(config.getScheduler().getProfiles());
    }
}
