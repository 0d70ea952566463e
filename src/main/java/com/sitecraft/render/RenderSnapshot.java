package com.sitecraft.render;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sitecraft.graph.AggregateMembership;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.SiteLayout;
import com.sitecraft.source.SourceArtifact;

/**
 * Read-only view of one cycle's inputs shared by every worker. The fragment cache is the only mutable
 * member and guards itself.
 */
public record RenderSnapshot(
        Path root,
        SiteLayout layout,
        String siteTitle,
        String baseUrl,
        Map<String, Object> params,
        Map<String, SourceArtifact> sources,
        Map<String, PageMetadata> pages,
        Map<String, AggregateMembership> aggregates,
        FragmentCache fragments) {

    public RenderSnapshot {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        sources = Map.copyOf(sources);
        pages = Map.copyOf(pages);
        aggregates = Map.copyOf(aggregates);
    }
}
