package com.sitecraft.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sitecraft.cache.BuildCache;
import com.sitecraft.cache.CacheCommitException;
import com.sitecraft.cache.CacheLoadResult;
import com.sitecraft.cache.CacheStore;
import com.sitecraft.cache.CompressionMode;
import com.sitecraft.cache.DependencyEntry;
import com.sitecraft.cache.OutputKind;
import com.sitecraft.cache.OutputRecord;
import com.sitecraft.graph.AggregateMembership;
import com.sitecraft.graph.AggregateResolver;
import com.sitecraft.graph.DependencyGraph;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.render.FragmentCache;
import com.sitecraft.render.MetadataExtractor;
import com.sitecraft.render.RenderContext;
import com.sitecraft.render.RenderException;
import com.sitecraft.render.RenderResult;
import com.sitecraft.render.RenderSnapshot;
import com.sitecraft.render.RenderTarget;
import com.sitecraft.render.Renderer;
import com.sitecraft.runtime.EngineConfig;
import com.sitecraft.schedule.AutoTunedScheduler;
import com.sitecraft.schedule.BuildEnvironment;
import com.sitecraft.schedule.CancellationToken;
import com.sitecraft.schedule.Phase;
import com.sitecraft.schedule.PhaseExecutor;
import com.sitecraft.schedule.PhaseExecutor.PhaseRun;
import com.sitecraft.schedule.PhaseProfiles;
import com.sitecraft.schedule.SchedulingDecision;
import com.sitecraft.source.ArtifactKind;
import com.sitecraft.source.ChangeDetector;
import com.sitecraft.source.ChangeSet;
import com.sitecraft.source.DiscoveryError;
import com.sitecraft.source.FingerprintStore;
import com.sitecraft.source.SiteLayout;
import com.sitecraft.source.SourceArtifact;
import com.sitecraft.source.SourceTreeScanner;

/**
 * Drives one build cycle through its states:
 * <pre>
 * IDLE -> DISCOVERING -> DIFFING_CACHE -> PROPAGATING_INVALIDATION -> DISPATCHING -> COLLECTING
 *      -> RECOMPUTING_AGGREGATES (-> DISPATCHING ...) -> COMMITTING -> IDLE
 * </pre>
 * Any state may drop to {@link BuildState#FAILED}; a failed cycle never commits, so the previous cache stays
 * authoritative. Workers only read the cycle snapshot and return outcomes; the graph and the cache are
 * mutated by this class alone while collecting.
 */
public class BuildOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    private final Path root;
    private final EngineConfig config;
    private final Renderer renderer;
    private final MetadataExtractor extractor;
    private final CacheStore cacheStore;
    private final BuildEnvironment environment;
    private final AutoTunedScheduler scheduler;
    private final PhaseExecutor boundedExecutor;
    private final PhaseExecutor localExecutor;
    private final FingerprintStore fingerprints;
    private final SiteConfigLoader siteConfigLoader = new SiteConfigLoader();
    private volatile BuildState state = BuildState.IDLE;

    public BuildOrchestrator(Path root, EngineConfig config, Renderer renderer, MetadataExtractor extractor) {
        this(root, config, renderer, extractor, defaultCacheStore(root, config), System.getenv());
    }

    public BuildOrchestrator(
            Path root,
            EngineConfig config,
            Renderer renderer,
            MetadataExtractor extractor,
            CacheStore cacheStore,
            Map<String, String> environmentVariables) {
        this(root, config, renderer, extractor, cacheStore, environmentVariables, new FingerprintStore());
    }

    BuildOrchestrator(
            Path root,
            EngineConfig config,
            Renderer renderer,
            MetadataExtractor extractor,
            CacheStore cacheStore,
            Map<String, String> environmentVariables,
            FingerprintStore fingerprints) {
        this.root = root.toAbsolutePath().normalize();
        this.fingerprints = fingerprints;
        this.config = config;
        this.renderer = renderer;
        this.extractor = extractor;
        this.cacheStore = cacheStore;
        EngineConfig.BuildConfig build = config.getBuild();
        this.environment = BuildEnvironment.detect(build.getEnvironment(), environmentVariables);
        PhaseProfiles profiles = PhaseProfiles.loadDefaults().withOverrides(config.getScheduler().getProfiles());
        this.scheduler = new AutoTunedScheduler(profiles, environment, build.isParallel(), build.getMaxWorkers());
        this.boundedExecutor = new PhaseExecutor(build.getRenderTimeoutMs());
        this.localExecutor = new PhaseExecutor(0L);
    }

    public static CacheStore defaultCacheStore(Path root, EngineConfig config) {
        EngineConfig.CacheConfig cache = config.getCache();
        return new CacheStore(
                root.toAbsolutePath().normalize().resolve(cache.getPath()),
                CompressionMode.parse(cache.getCompression()),
                cache.getMaxDecompressFraction());
    }

    public BuildState state() {
        return state;
    }

    public BuildEnvironment environment() {
        return environment;
    }

    public BuildReport runCycle(BuildMode mode) {
        return runCycle(mode, CancellationToken.none());
    }

    public synchronized BuildReport runCycle(BuildMode mode, CancellationToken cancellation) {
        Cycle cycle = new Cycle(mode, cancellation, config.getBuild());
        log.info("build.start mode={} root={} environment={} parallel={} memoryOptimized={}",
                mode, root, environment, config.getBuild().isParallel(), cycle.memoryOptimized);
        try {
            discover(cycle);
            diff(cycle);
            propagate(cycle);
            dispatch(cycle, new ArrayList<>(cycle.dirty.keySet()));
            recomputeAggregates(cycle);
            commit(cycle);
            transition(BuildState.IDLE);
            BuildReport report = report(cycle, BuildState.IDLE);
            log.info("build.done mode={} rebuilt={} reused={} removed={} failed={} aggregatePasses={} elapsedMs={}",
                    mode, report.rebuilt(), report.reused(), report.removed(), report.failed(),
                    report.aggregatePasses(), report.elapsedMillis());
            return report;
        } catch (ConfigException e) {
            return fail(cycle, FailureCategory.CONFIG, e.getMessage());
        } catch (CacheCommitException e) {
            return fail(cycle, FailureCategory.CACHE_COMMIT, e.getMessage() + ": " + e.getCause());
        } catch (CycleCancelledException e) {
            return fail(cycle, FailureCategory.CANCELLED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(cycle, FailureCategory.CANCELLED, "interrupted");
        } catch (IOException e) {
            return fail(cycle, FailureCategory.IO, e.getMessage());
        } catch (RuntimeException e) {
            log.error("build.failed state={} unexpected error", state, e);
            state = BuildState.FAILED;
            throw e;
        }
    }

    private void discover(Cycle cycle) throws IOException, InterruptedException, CycleCancelledException {
        transition(BuildState.DISCOVERING);
        long started = System.nanoTime();
        String configFile = config.getBuild().getSiteConfig();
        cycle.site = siteConfigLoader.load(root, configFile);
        cycle.layout = cycle.site.toLayout(configFile);
        cycle.output = new OutputWriter(root.resolve(cycle.layout.outputDir()));

        CacheLoadResult loaded = cacheStore.load();
        if (loaded.usable()) {
            cycle.loadedOutputs.putAll(loaded.cache().getOutputs());
        }
        if (cycle.mode == BuildMode.FULL) {
            cycle.previous = BuildCache.empty();
            cycle.fullReason = "full-build";
        } else if (!loaded.usable()) {
            cycle.previous = BuildCache.empty();
            cycle.fullReason = "cache-" + loaded.status().name().toLowerCase(Locale.ROOT).replace('_', '-');
        } else {
            cycle.previous = loaded.cache();
        }
        cycle.working = cycle.previous.copy();

        SourceTreeScanner scanner = new SourceTreeScanner(cycle.layout, fingerprints);
        SourceTreeScanner.Listing listing = scanner.list(root);
        listing.errors().forEach(error -> unreadable(cycle, error));
        SchedulingDecision decision = scheduler.choose(Phase.DISCOVERY, listing.files().size());
        PhaseRun<Path, Discovered> run = localExecutor.run(decision, listing.files(), file -> describe(scanner, file), cycle.cancellation);
        requireNotCancelled(cycle, run.skipped().size(), Phase.DISCOVERY);
        for (Discovered discovered : run.completed()) {
            if (discovered.artifact() != null) {
                cycle.sources.put(discovered.artifact().id(), discovered.artifact());
            } else {
                unreadable(cycle, discovered.error());
            }
        }

        hideSubtrees(cycle);

        for (SourceArtifact source : cycle.sources.values()) {
            cycle.sourceHashes.put(source.id(), source.hash());
        }
        for (String id : cycle.unreadable) {
            String previousHash = cycle.previous.getSources().get(id);
            if (previousHash != null) {
                cycle.sourceHashes.put(id, previousHash);
            }
        }
        cycle.changeSet = new ChangeDetector(cycle.layout).detect(cycle.previous.getSources(), cycle.sources, cycle.unreadable);
        log.info("build.discovered sources={} added={} modified={} removed={} unreadable={} configChanged={}",
                cycle.sources.size(),
                cycle.changeSet.added().size(),
                cycle.changeSet.modified().size(),
                cycle.changeSet.removed().size(),
                cycle.unreadable.size(),
                cycle.changeSet.configChanged());

        parse(cycle);
        logPhase(cycle, "discovery", started);
    }

    private Discovered describe(SourceTreeScanner scanner, Path file) {
        try {
            return new Discovered(scanner.describe(root, file), null);
        } catch (IOException e) {
            String id = SourceTreeScanner.toId(root, file);
            log.warn("discovery.unreadable source={} reason={}", id, e.getMessage());
            return new Discovered(null, new DiscoveryError(id, String.valueOf(e.getMessage())));
        }
    }

    /**
     * Known sources below a directory that could not be listed count as unreadable themselves, so they keep
     * their hash and outputs instead of looking removed.
     */
    private void hideSubtrees(Cycle cycle) {
        if (cycle.unreadable.isEmpty()) {
            return;
        }
        Set<String> known = new TreeSet<>(cycle.previous.getSources().keySet());
        for (OutputRecord record : cycle.loadedOutputs.values()) {
            if (record.primarySource() != null) {
                known.add(record.primarySource());
            }
        }
        Set<String> hidden = new TreeSet<>();
        for (String id : known) {
            if (!cycle.sources.containsKey(id) && !cycle.unreadable.contains(id) && ChangeDetector.isUnreadable(cycle.unreadable, id)) {
                hidden.add(id);
            }
        }
        if (!hidden.isEmpty()) {
            log.warn("discovery.unreadable-subtree hidden={} sources={}", hidden.size(), hidden);
            cycle.unreadable.addAll(hidden);
        }
    }

    private void unreadable(Cycle cycle, DiscoveryError error) {
        cycle.unreadable.add(error.sourceId());
        cycle.failures.add(new BuildFailure(error.sourceId(), FailureCategory.DISCOVERY, error.message()));
    }

    private void parse(Cycle cycle) throws InterruptedException, CycleCancelledException {
        List<SourceArtifact> stale = new ArrayList<>();
        for (SourceArtifact source : cycle.sources.values()) {
            if (source.kind() != ArtifactKind.CONTENT) {
                continue;
            }
            PageMetadata cached = cycle.previous.getPages().get(source.id());
            if (cached != null && source.hash().equals(cycle.previous.getSources().get(source.id()))) {
                cycle.pages.put(source.id(), cached);
            } else {
                stale.add(source);
            }
        }
        for (String id : cycle.unreadable) {
            PageMetadata cached = cycle.previous.getPages().get(id);
            if (cached != null) {
                cycle.pages.put(id, cached);
            }
        }

        SchedulingDecision decision = scheduler.choose(Phase.PARSING, stale.size());
        PhaseRun<SourceArtifact, Parsed> run = boundedExecutor.run(decision, stale, this::parseOne, cycle.cancellation);
        requireNotCancelled(cycle, run.skipped().size(), Phase.PARSING);
        for (Parsed parsed : run.completed()) {
            if (parsed.failure() == null) {
                cycle.pages.put(parsed.sourceId(), parsed.metadata());
                continue;
            }
            parseFailed(cycle, parsed.failure());
        }
        for (SourceArtifact source : run.timedOut()) {
            parseFailed(cycle, new BuildFailure(source.id(), FailureCategory.TIMEOUT,
                    "metadata extraction exceeded " + config.getBuild().getRenderTimeoutMs() + " ms"));
        }
        log.debug("build.parsed parsed={} reused={} failed={}", stale.size(), cycle.pages.size() - stale.size(), cycle.parseFailed.size());
    }

    private Parsed parseOne(SourceArtifact source) {
        try {
            PageMetadata metadata = extractor.extract(source, Files.readAllBytes(source.path()));
            if (metadata == null) {
                return Parsed.failed(source.id(), "extractor returned no metadata");
            }
            return new Parsed(source.id(), metadata, null);
        } catch (RenderException | IOException e) {
            return Parsed.failed(source.id(), String.valueOf(e.getMessage()));
        } catch (RuntimeException e) {
            return Parsed.failed(source.id(), "extractor failed: " + e);
        }
    }

    private void parseFailed(Cycle cycle, BuildFailure failure) {
        log.warn("parse.failed source={} category={} reason={}", failure.artifactId(), failure.category(), failure.message());
        cycle.failures.add(failure);
        cycle.parseFailed.add(failure.artifactId());
        // previous metadata keeps aggregate membership stable until the page parses again
        PageMetadata cached = cycle.previous.getPages().get(failure.artifactId());
        if (cached != null) {
            cycle.pages.put(failure.artifactId(), cached);
        }
    }

    private void diff(Cycle cycle) {
        transition(BuildState.DIFFING_CACHE);
        long started = System.nanoTime();
        cycle.graph = graphOf(cycle.working);
        cycle.aggregates.putAll(new AggregateResolver(cycle.site.aggregateDefinitions()).resolve(cycle.pages));
        collectTargets(cycle);
        markRetained(cycle);

        if (cycle.fullReason == null && cycle.changeSet.configChanged()) {
            cycle.fullReason = "config-changed";
        }
        if (cycle.fullReason != null) {
            for (String outputId : cycle.expected.keySet()) {
                markDirty(cycle, outputId, cycle.fullReason);
            }
            log.info("build.full reason={} outputs={}", cycle.fullReason, cycle.expected.size());
            logPhase(cycle, "diff", started);
            return;
        }

        for (String outputId : cycle.graph.invalidatedBy(cycle.changeSet)) {
            if (cycle.expected.containsKey(outputId)) {
                String reason = cycle.working.get(outputId)
                        .flatMap(record -> record.firstStaleDependency(id -> currentHash(cycle, id)))
                        .map(id -> "changed:" + id)
                        .orElse("dependency-changed");
                markDirty(cycle, outputId, reason);
            }
        }
        for (RenderTarget target : cycle.expected.values()) {
            String outputId = target.outputId();
            if (cycle.dirty.containsKey(outputId)) {
                continue;
            }
            Optional<OutputRecord> record = cycle.working.get(outputId);
            if (record.isEmpty()) {
                markDirty(cycle, outputId, "new");
            } else if (record.get().kind() != target.kind()) {
                markDirty(cycle, outputId, "kind-changed");
            } else if (!cycle.output.exists(outputId)) {
                markDirty(cycle, outputId, "output-missing");
            } else {
                record.get().firstStaleDependency(id -> currentHash(cycle, id))
                        .ifPresent(id -> markDirty(cycle, outputId, "changed:" + id));
            }
        }
        logPhase(cycle, "diff", started);
    }

    private static DependencyGraph graphOf(BuildCache cache) {
        DependencyGraph graph = new DependencyGraph();
        for (OutputRecord record : cache.getOutputs().values()) {
            List<String> sources = new ArrayList<>(record.dependencies().size());
            for (DependencyEntry entry : record.dependencies()) {
                sources.add(entry.source());
            }
            graph.replaceDependencies(record.outputId(), sources);
        }
        return graph;
    }

    private void collectTargets(Cycle cycle) {
        SiteLayout layout = cycle.layout;
        for (SourceArtifact source : cycle.sources.values()) {
            if (source.kind() == ArtifactKind.CONTENT) {
                PageMetadata page = cycle.pages.get(source.id());
                if (page == null || page.draft() || cycle.parseFailed.contains(source.id())) {
                    continue;
                }
                addTarget(cycle, RenderTarget.page(layout.pageOutputId(source.id()), source));
            } else if (source.kind() == ArtifactKind.ASSET) {
                addTarget(cycle, RenderTarget.asset(layout.assetOutputId(source.id()), source));
            }
        }
        for (AggregateMembership membership : cycle.aggregates.values()) {
            addTarget(cycle, RenderTarget.aggregate(membership));
        }
    }

    private void addTarget(Cycle cycle, RenderTarget target) {
        RenderTarget existing = cycle.expected.putIfAbsent(target.outputId(), target);
        if (existing != null) {
            String message = "output collides with " + describe(existing) + "; skipped " + describe(target);
            log.warn("output.collision output={} reason={}", target.outputId(), message);
            cycle.failures.add(new BuildFailure(target.outputId(), FailureCategory.RENDER, message));
        }
    }

    private static String describe(RenderTarget target) {
        return target.kind() == OutputKind.AGGREGATE
                ? "aggregate " + target.membership().predicate().describe()
                : target.kind().name().toLowerCase(Locale.ROOT) + " " + target.primarySource();
    }

    /**
     * Outputs whose source could not be read or parsed this cycle keep their file. Unreadable sources also
     * keep their record; parse failures lose it so the page renders again once it parses.
     */
    private void markRetained(Cycle cycle) {
        Map<String, OutputRecord> known = new TreeMap<>(cycle.loadedOutputs);
        known.putAll(cycle.working.getOutputs());
        for (OutputRecord record : known.values()) {
            if (record.primarySource() != null && ChangeDetector.isUnreadable(cycle.unreadable, record.primarySource())) {
                cycle.retained.add(record.outputId());
            }
        }
        for (String sourceId : cycle.parseFailed) {
            String outputId = cycle.layout.pageOutputId(sourceId);
            if (cycle.expected.containsKey(outputId)) {
                continue;
            }
            cycle.retained.add(outputId);
            cycle.working.removeOutput(outputId);
            cycle.graph.removeOutput(outputId);
        }
    }

    private void propagate(Cycle cycle) {
        transition(BuildState.PROPAGATING_INVALIDATION);
        int direct = cycle.dirty.size();
        for (String outputId : cycle.graph.propagate(new ArrayList<>(cycle.dirty.keySet()))) {
            if (cycle.expected.containsKey(outputId) && !cycle.dirty.containsKey(outputId)) {
                markDirty(cycle, outputId, "upstream-invalidated");
            }
        }
        log.info("build.invalidated direct={} propagated={} clean={}",
                direct, cycle.dirty.size() - direct, cycle.expected.size() - cycle.dirty.size());
    }

    private void dispatch(Cycle cycle, Collection<String> outputIds) throws InterruptedException, CycleCancelledException {
        transition(BuildState.DISPATCHING);
        requireNotCancelled(cycle, outputIds.size(), Phase.RENDERING);
        long started = System.nanoTime();
        List<RenderTarget> renders = new ArrayList<>();
        List<RenderTarget> assets = new ArrayList<>();
        for (String outputId : outputIds) {
            RenderTarget target = cycle.expected.get(outputId);
            if (target == null) {
                continue;
            }
            if (target.kind() == OutputKind.ASSET) {
                assets.add(target);
            } else {
                renders.add(target);
            }
        }

        RenderSnapshot snapshot = cycle.snapshot(root);
        SchedulingDecision renderDecision = scheduler.choose(Phase.RENDERING, renders.size());
        if (renderDecision.parallel()) {
            renders.sort(Comparator.comparingLong(RenderTarget::weight).reversed());
        }
        PhaseRun<RenderTarget, RenderOutcome> rendered = boundedExecutor.run(
                renderDecision, renders, target -> renderOne(cycle, snapshot, target), cycle.cancellation);
        SchedulingDecision assetDecision = scheduler.choose(Phase.POST_PROCESSING, assets.size());
        PhaseRun<RenderTarget, RenderOutcome> copied = localExecutor.run(
                assetDecision, assets, target -> copyAsset(cycle, target), cycle.cancellation);

        transition(BuildState.COLLECTING);
        collect(cycle, rendered);
        collect(cycle, copied);
        requireNotCancelled(cycle, rendered.skipped().size() + copied.skipped().size(), Phase.RENDERING);
        if (!cycle.fast) {
            log.info("build.dispatched renders={} assets={} renderWorkers={} assetWorkers={} elapsedMs={}",
                    renders.size(), assets.size(), renderDecision.workers(), assetDecision.workers(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        }
    }

    private RenderOutcome renderOne(Cycle cycle, RenderSnapshot snapshot, RenderTarget target) {
        try {
            RenderContext context = new RenderContext(snapshot);
            RenderResult result = renderer.render(target, context);
            if (result == null || result.content() == null) {
                return RenderOutcome.failure(target, FailureCategory.RENDER, "renderer returned no content");
            }
            Set<String> dependencies = new TreeSet<>(result.dependencies());
            dependencies.addAll(context.consulted());
            if (target.primarySource() != null) {
                dependencies.add(target.primarySource());
            }
            dependencies.remove(target.outputId());
            return finish(cycle, target, result.content(), dependencies);
        } catch (RenderException e) {
            return RenderOutcome.failure(target, FailureCategory.RENDER, String.valueOf(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("render.crashed output={}", target.outputId(), e);
            return RenderOutcome.failure(target, FailureCategory.RENDER, "renderer failed: " + e);
        }
    }

    private RenderOutcome copyAsset(Cycle cycle, RenderTarget target) {
        try {
            byte[] content = Files.readAllBytes(target.source().path());
            return finish(cycle, target, content, Set.of(target.primarySource()));
        } catch (IOException e) {
            return RenderOutcome.failure(target, FailureCategory.WRITE, "unable to read asset: " + e.getMessage());
        }
    }

    private RenderOutcome finish(Cycle cycle, RenderTarget target, byte[] content, Set<String> dependencyIds) {
        List<DependencyEntry> dependencies = new ArrayList<>(dependencyIds.size());
        for (String id : dependencyIds) {
            dependencies.add(new DependencyEntry(id, currentHash(cycle, id)));
        }
        String outputHash = FingerprintStore.fingerprint(content);
        if (!cycle.memoryOptimized) {
            return RenderOutcome.success(target, content, outputHash, dependencies, false);
        }
        try {
            cycle.output.writeIfChanged(target.outputId(), content, outputHash, cycle.previousOutputHash(target.outputId()));
            return RenderOutcome.success(target, null, outputHash, dependencies, true);
        } catch (IOException e) {
            return RenderOutcome.failure(target, FailureCategory.WRITE, "unable to write: " + e.getMessage());
        }
    }

    private void collect(Cycle cycle, PhaseRun<RenderTarget, RenderOutcome> run) {
        for (RenderOutcome completed : run.completed()) {
            RenderOutcome outcome = completed;
            RenderTarget target = outcome.target();
            String outputId = target.outputId();
            cycle.dispatched.add(outputId);
            if (!outcome.failed() && !outcome.written()) {
                try {
                    cycle.output.writeIfChanged(outputId, outcome.content(), outcome.outputHash(), cycle.previousOutputHash(outputId));
                } catch (IOException e) {
                    outcome = RenderOutcome.failure(target, FailureCategory.WRITE, "unable to write: " + e.getMessage());
                }
            }
            if (outcome.failed()) {
                recordFailure(cycle, outcome.failure());
                continue;
            }

            AggregateMembership membership = target.membership();
            cycle.working.putOutput(new OutputRecord(
                    outputId,
                    target.kind(),
                    target.primarySource(),
                    outcome.outputHash(),
                    outcome.dependencies(),
                    membership == null ? null : membership.predicate(),
                    membership == null ? null : membership.members()));
            List<String> sources = new ArrayList<>(outcome.dependencies().size());
            for (DependencyEntry entry : outcome.dependencies()) {
                sources.add(entry.source());
            }
            cycle.graph.replaceDependencies(outputId, sources);
            cycle.rebuilt++;
        }
        for (RenderTarget target : run.timedOut()) {
            cycle.dispatched.add(target.outputId());
            recordFailure(cycle, new BuildFailure(target.outputId(), FailureCategory.TIMEOUT,
                    "exceeded " + config.getBuild().getRenderTimeoutMs() + " ms"));
        }
    }

    private void recordFailure(Cycle cycle, BuildFailure failure) {
        log.warn("render.failed output={} category={} reason={}", failure.artifactId(), failure.category(), failure.message());
        cycle.failures.add(failure);
        cycle.failed.add(failure.artifactId());
        // without a record the output is treated as new next cycle; the previous file stays in place
        cycle.working.removeOutput(failure.artifactId());
    }

    private void recomputeAggregates(Cycle cycle) throws InterruptedException, CycleCancelledException {
        transition(BuildState.RECOMPUTING_AGGREGATES);
        int cap = config.getBuild().getAggregateIterationCap();
        while (true) {
            Set<String> changed = new LinkedHashSet<>();
            for (AggregateMembership membership : cycle.aggregates.values()) {
                String outputId = membership.outputId();
                RenderTarget target = cycle.expected.get(outputId);
                if (target == null || target.kind() != OutputKind.AGGREGATE || cycle.failed.contains(outputId)) {
                    continue;
                }
                Optional<OutputRecord> record = cycle.working.get(outputId);
                if (record.isEmpty()
                        || !record.get().members().equals(membership.members())
                        || !Objects.equals(record.get().aggregate(), membership.predicate())) {
                    changed.add(outputId);
                }
            }

            Set<String> pending = new LinkedHashSet<>();
            for (String outputId : cycle.graph.propagate(changed)) {
                if (cycle.expected.containsKey(outputId)
                        && !cycle.dispatched.contains(outputId)
                        && !cycle.retained.contains(outputId)) {
                    pending.add(outputId);
                }
            }
            if (pending.isEmpty()) {
                return;
            }
            if (cycle.aggregatePasses >= cap) {
                cycle.aggregateCapReached = true;
                log.warn("aggregate.iteration-cap cap={} pending={}", cap, pending.size());
                return;
            }
            cycle.aggregatePasses++;
            for (String outputId : pending) {
                markDirty(cycle, outputId, changed.contains(outputId) ? "membership-changed" : "aggregate-changed");
            }
            log.info("aggregate.recompute pass={} changed={} pending={}", cycle.aggregatePasses, changed.size(), pending.size());
            dispatch(cycle, pending);
            transition(BuildState.RECOMPUTING_AGGREGATES);
        }
    }

    private void commit(Cycle cycle) throws CacheCommitException, CycleCancelledException {
        requireNotCancelled(cycle, 0, null);
        transition(BuildState.COMMITTING);
        long started = System.nanoTime();
        removeOrphans(cycle);
        Map<String, PageMetadata> pages = new TreeMap<>(cycle.pages);
        pages.keySet().removeAll(cycle.parseFailed);
        cycle.working.setSources(cycle.sourceHashes);
        cycle.working.setPages(pages);
        cacheStore.commit(cycle.working, cycle.elapsedMillis());
        logPhase(cycle, "commit", started);
    }

    private void removeOrphans(Cycle cycle) {
        Set<String> candidates = new TreeSet<>(cycle.loadedOutputs.keySet());
        candidates.addAll(cycle.working.getOutputs().keySet());
        for (String outputId : candidates) {
            if (cycle.expected.containsKey(outputId) || cycle.retained.contains(outputId)) {
                continue;
            }
            cycle.working.removeOutput(outputId);
            cycle.graph.removeOutput(outputId);
            cycle.removed++;
            try {
                boolean deleted = cycle.output.delete(outputId);
                log.info("output.removed output={} deleted={}", outputId, deleted);
            } catch (IOException e) {
                log.warn("output.remove-failed output={} reason={}", outputId, e.getMessage());
                cycle.failures.add(new BuildFailure(outputId, FailureCategory.WRITE, "unable to delete: " + e.getMessage()));
            }
        }
    }

    private static String currentHash(Cycle cycle, String id) {
        AggregateMembership membership = cycle.aggregates.get(id);
        if (membership != null) {
            return membership.digest();
        }
        String hash = cycle.sourceHashes.get(id);
        return hash == null ? FingerprintStore.ABSENT : hash;
    }

    private void markDirty(Cycle cycle, String outputId, String reason) {
        if (cycle.dirty.putIfAbsent(outputId, reason) == null && !cycle.fast) {
            log.debug("output.dirty output={} reason={}", outputId, reason);
        }
    }

    private void requireNotCancelled(Cycle cycle, int pending, Phase phase) throws CycleCancelledException {
        if (cycle.cancellation.isCancelled()) {
            throw new CycleCancelledException("cancelled" + (phase == null ? " before commit" : " during " + phase.key())
                    + (pending > 0 ? " with " + pending + " tasks pending" : ""));
        }
    }

    private void transition(BuildState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal build state transition " + state + " -> " + next);
        }
        log.debug("build.state from={} to={}", state, next);
        state = next;
    }

    private void logPhase(Cycle cycle, String phase, long startedNanos) {
        if (!cycle.fast) {
            log.info("build.phase phase={} elapsedMs={}", phase, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
        }
    }

    private BuildReport fail(Cycle cycle, FailureCategory category, String message) {
        log.error("build.failed state={} category={} reason={}", state, category, message);
        if (state.canTransitionTo(BuildState.FAILED)) {
            transition(BuildState.FAILED);
        } else {
            state = BuildState.FAILED;
        }
        cycle.failures.add(BuildFailure.cycle(category, message));
        return report(cycle, BuildState.FAILED);
    }

    private BuildReport report(Cycle cycle, BuildState finalState) {
        int reused = 0;
        for (String outputId : cycle.expected.keySet()) {
            if (!cycle.dispatched.contains(outputId)) {
                reused++;
            }
        }
        return new BuildReport(
                cycle.mode,
                finalState,
                cycle.changeSet,
                cycle.rebuilt,
                reused,
                cycle.removed,
                cycle.aggregatePasses,
                cycle.aggregateCapReached,
                cycle.elapsedMillis(),
                cycle.failures,
                cycle.fast ? Map.of() : cycle.dirty);
    }

    private record Discovered(SourceArtifact artifact, DiscoveryError error) {
    }

    private record Parsed(String sourceId, PageMetadata metadata, BuildFailure failure) {
        static Parsed failed(String sourceId, String message) {
            return new Parsed(sourceId, null, new BuildFailure(sourceId, FailureCategory.PARSE, message));
        }
    }

    private static final class CycleCancelledException extends Exception {
        CycleCancelledException(String message) {
            super(message);
        }
    }

    /**
     * Mutable state of one cycle. Only the orchestrator thread writes to it; workers read the maps that are
     * settled before dispatch.
     */
    private static final class Cycle {
        final BuildMode mode;
        final CancellationToken cancellation;
        final boolean fast;
        final boolean memoryOptimized;
        final long startedNanos = System.nanoTime();

        SiteConfig site;
        SiteLayout layout;
        OutputWriter output;
        BuildCache previous;
        BuildCache working;
        DependencyGraph graph;
        String fullReason;
        ChangeSet changeSet = ChangeSet.empty();
        RenderSnapshot snapshot;

        final Map<String, OutputRecord> loadedOutputs = new HashMap<>();
        final Map<String, SourceArtifact> sources = new TreeMap<>();
        final Map<String, String> sourceHashes = new TreeMap<>();
        final Set<String> unreadable = new TreeSet<>();
        final Set<String> parseFailed = new TreeSet<>();
        final Map<String, PageMetadata> pages = new TreeMap<>();
        final Map<String, AggregateMembership> aggregates = new LinkedHashMap<>();
        final Map<String, RenderTarget> expected = new LinkedHashMap<>();
        final Map<String, String> dirty = new LinkedHashMap<>();
        final Set<String> retained = new HashSet<>();
        final Set<String> dispatched = new HashSet<>();
        final Set<String> failed = new HashSet<>();
        final List<BuildFailure> failures = new ArrayList<>();
        final FragmentCache fragments = new FragmentCache();
        int rebuilt;
        int removed;
        int aggregatePasses;
        boolean aggregateCapReached;

        Cycle(BuildMode mode, CancellationToken cancellation, EngineConfig.BuildConfig build) {
            this.mode = mode;
            this.cancellation = cancellation;
            this.fast = build.isFast();
            this.memoryOptimized = build.isMemoryOptimized();
        }

        RenderSnapshot snapshot(Path root) {
            if (snapshot == null) {
                snapshot = new RenderSnapshot(root, layout, site.getTitle(), site.getBaseUrl(), site.getParams(),
                        sources, pages, aggregates, fragments);
            }
            return snapshot;
        }

        String previousOutputHash(String outputId) {
            OutputRecord record = previous.getOutputs().get(outputId);
            return record == null ? null : record.outputHash();
        }

        long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }
    }
}
