package com.sitecraft;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sitecraft.build.BuildFailure;
import com.sitecraft.build.BuildMode;
import com.sitecraft.build.BuildOrchestrator;
import com.sitecraft.build.BuildReport;
import com.sitecraft.render.FrontMatterExtractor;
import com.sitecraft.render.LayoutRenderer;
import com.sitecraft.runtime.EngineConfig;
import com.sitecraft.runtime.EngineConfigLoader;
import com.sitecraft.schedule.CancellationToken;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "sitecraft",
        mixinStandardHelpOptions = true,
        version = "sitecraft 0.1.0",
        description = "Builds a site incrementally, re-rendering only outputs whose inputs changed.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Parameters(index = "0", arity = "0..1", description = "Site root directory", defaultValue = ".")
    Path root;

    @Option(names = { "-c", "--config" }, description = "Engine config file, relative to the site root", defaultValue = "sitecraft.yml")
    Path configPath;

    @Option(names = "--full", description = "Discard the build cache and rebuild every output")
    boolean full;

    @Option(names = "--parallel", negatable = true, description = "Allow parallel phases (default: from config)")
    Boolean parallel;

    @Option(names = "--fast", description = "Suppress per-output dirty reasons and per-phase timing")
    boolean fast;

    @Option(names = "--memory-optimized", description = "Write outputs from the workers instead of buffering them")
    boolean memoryOptimized;

    @Option(names = "--max-workers", description = "Upper bound on workers per parallel phase (0 = profile and core count only)")
    Integer maxWorkers;

    @Option(names = "--render-timeout-ms", description = "Per-render ceiling in milliseconds (0 = none)")
    Long renderTimeoutMs;

    @Option(names = "--cache-path", description = "Build cache file, relative to the site root")
    String cachePath;

    @Option(names = "--environment", description = "Build environment: auto, local, ci, production")
    String environment;

    private final Map<String, String> environmentVariables;
    private final CancellationToken cancellation = new CancellationToken();

    public Main() {
        this(System.getenv());
    }

    Main(Map<String, String> environmentVariables) {
        this.environmentVariables = environmentVariables;
    }

    public static void main(String[] args) {
        Main main = new Main();
        Thread hook = new Thread(main.cancellation::cancel, "sitecraft-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        int exitCode = new CommandLine(main).execute(args);
        Runtime.getRuntime().removeShutdownHook(hook);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Path siteRoot = root.toAbsolutePath().normalize();
        Path engineConfig = configPath.isAbsolute() ? configPath : siteRoot.resolve(configPath);
        BuildOrchestrator orchestrator;
        try {
            EngineConfig config = new EngineConfigLoader().load(engineConfig);
            applyOverrides(config);
            orchestrator = new BuildOrchestrator(
                    siteRoot,
                    config,
                    new LayoutRenderer(),
                    new FrontMatterExtractor(),
                    BuildOrchestrator.defaultCacheStore(siteRoot, config),
                    environmentVariables);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid engine configuration {}: {}", engineConfig, e.getMessage());
            return BuildReport.EXIT_CYCLE_FAILED;
        }

        log.info("Building {} with config {} in {} environment", siteRoot, engineConfig, orchestrator.environment());
        BuildReport report = orchestrator.runCycle(full ? BuildMode.FULL : BuildMode.INCREMENTAL, cancellation);

        for (BuildFailure failure : report.failures()) {
            log.error("Failed {} [{}]: {}", failure.artifactId(), failure.category(), failure.message());
        }
        log.info("Build {}: rebuilt={} reused={} removed={} failed={} in {} ms",
                report.cycleFailed() ? "failed" : "finished",
                report.rebuilt(),
                report.reused(),
                report.removed(),
                report.failed(),
                report.elapsedMillis());
        return report.exitCode();
    }

    void applyOverrides(EngineConfig config) {
        EngineConfig.BuildConfig build = config.getBuild();
        if (parallel != null) {
            build.setParallel(parallel);
        }
        if (fast) {
            build.setFast(true);
        }
        if (memoryOptimized) {
            build.setMemoryOptimized(true);
        }
        if (maxWorkers != null) {
            if (maxWorkers < 0) {
                throw new IllegalArgumentException("--max-workers must be >= 0");
            }
            build.setMaxWorkers(maxWorkers);
        }
        if (renderTimeoutMs != null) {
            if (renderTimeoutMs < 0) {
                throw new IllegalArgumentException("--render-timeout-ms must be >= 0");
            }
            build.setRenderTimeoutMs(renderTimeoutMs);
        }
        if (environment != null) {
            build.setEnvironment(environment);
        }
        if (cachePath != null && !cachePath.isBlank()) {
            config.getCache().setPath(cachePath);
        }
    }
}
