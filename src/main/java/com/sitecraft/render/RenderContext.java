package com.sitecraft.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.sitecraft.graph.AggregateMembership;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.SiteLayout;
import com.sitecraft.source.SourceArtifact;

/**
 * Per-render window onto the cycle snapshot. Every source, page or aggregate looked up through it is
 * remembered and merged into the dependency set the renderer reports. Reads that bypass the context are
 * not seen.
 * <p>
 * One instance serves exactly one render on one thread.
 */
public final class RenderContext {
    private final RenderSnapshot snapshot;
    private final Set<String> consulted = new LinkedHashSet<>();

    public RenderContext(RenderSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public byte[] read(String sourceId) throws IOException {
        consulted.add(sourceId);
        SourceArtifact source = snapshot.sources().get(sourceId);
        if (source == null) {
            throw new NoSuchFileException(sourceId);
        }
        return Files.readAllBytes(source.path());
    }

    public boolean exists(String sourceId) {
        consulted.add(sourceId);
        return snapshot.sources().containsKey(sourceId);
    }

    public Optional<SourceArtifact> source(String sourceId) {
        consulted.add(sourceId);
        return Optional.ofNullable(snapshot.sources().get(sourceId));
    }

    public Optional<PageMetadata> page(String contentId) {
        consulted.add(contentId);
        return Optional.ofNullable(snapshot.pages().get(contentId));
    }

    public List<String> members(String aggregateId) {
        consulted.add(aggregateId);
        AggregateMembership membership = snapshot.aggregates().get(aggregateId);
        return membership == null ? List.of() : membership.members();
    }

    public SiteLayout layout() {
        return snapshot.layout();
    }

    public String siteTitle() {
        return snapshot.siteTitle();
    }

    public String baseUrl() {
        return snapshot.baseUrl();
    }

    public Map<String, Object> params() {
        return snapshot.params();
    }

    public FragmentCache fragments() {
        return snapshot.fragments();
    }

    public Set<String> consulted() {
        return Set.copyOf(consulted);
    }
}
