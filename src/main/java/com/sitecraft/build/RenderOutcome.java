package com.sitecraft.build;

import java.util.List;

import com.sitecraft.cache.DependencyEntry;
import com.sitecraft.render.RenderTarget;

/**
 * Result of one dispatched target as handed from a worker to the collecting step. {@code content} is null
 * once the worker has written the file itself.
 */
record RenderOutcome(
        RenderTarget target,
        byte[] content,
        String outputHash,
        List<DependencyEntry> dependencies,
        boolean written,
        BuildFailure failure) {

    static RenderOutcome success(RenderTarget target, byte[] content, String outputHash, List<DependencyEntry> dependencies, boolean written) {
        return new RenderOutcome(target, content, outputHash, List.copyOf(dependencies), written, null);
    }

    static RenderOutcome failure(RenderTarget target, FailureCategory category, String message) {
        return new RenderOutcome(target, null, null, List.of(), false, new BuildFailure(target.outputId(), category, message));
    }

    boolean failed() {
        return failure != null;
    }
}
