package com.sitecraft.render;

import java.util.List;

import com.sitecraft.cache.OutputKind;
import com.sitecraft.graph.AggregateMembership;
import com.sitecraft.source.SourceArtifact;

/**
 * One output to produce. Pages and assets carry their primary source; aggregates carry their membership.
 */
public record RenderTarget(String outputId, OutputKind kind, SourceArtifact source, AggregateMembership membership) {

    public static RenderTarget page(String outputId, SourceArtifact source) {
        return new RenderTarget(outputId, OutputKind.PAGE, source, null);
    }

    public static RenderTarget asset(String outputId, SourceArtifact source) {
        return new RenderTarget(outputId, OutputKind.ASSET, source, null);
    }

    public static RenderTarget aggregate(AggregateMembership membership) {
        return new RenderTarget(membership.outputId(), OutputKind.AGGREGATE, null, membership);
    }

    public String primarySource() {
        return source == null ? null : source.id();
    }

    public List<String> members() {
        return membership == null ? List.of() : membership.members();
    }

    /**
     * Relative cost used to dispatch heavy targets first.
     */
    public long weight() {
        if (source != null) {
            return source.size();
        }
        return membership == null ? 0L : membership.members().size() * 1024L;
    }
}
