package com.sitecraft.render;

import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.SourceArtifact;

/**
 * Content parser seam: pulls page metadata out of a content file.
 */
public interface MetadataExtractor {
    PageMetadata extract(SourceArtifact source, byte[] content) throws RenderException;
}
