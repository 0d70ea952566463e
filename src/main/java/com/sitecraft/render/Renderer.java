package com.sitecraft.render;

/**
 * Template compiler/renderer seam. Implementations are invoked concurrently from worker threads and must
 * only read from the context they are given.
 */
public interface Renderer {
    RenderResult render(RenderTarget target, RenderContext context) throws RenderException;
}
