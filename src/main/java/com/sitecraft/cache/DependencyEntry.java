package com.sitecraft.cache;

/**
 * One consulted source (or aggregate) and the hash it had when the output was rendered.
 */
public record DependencyEntry(String source, String hash) {
}
