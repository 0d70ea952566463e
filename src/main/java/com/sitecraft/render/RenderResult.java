package com.sitecraft.render;

import java.util.Arrays;
import java.util.List;

/**
 * Rendered bytes plus every source the renderer consulted to produce them. Omitting a consulted source
 * lets a stale output survive a change to it.
 */
public record RenderResult(byte[] content, List<String> dependencies) {

    public RenderResult {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static RenderResult of(byte[] content, String... dependencies) {
        return new RenderResult(content, Arrays.asList(dependencies));
    }
}
