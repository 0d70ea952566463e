package com.sitecraft.source;

import java.nio.file.Path;

/**
 * An input file the build can depend on. {@code id} is the root-relative path with forward slashes and
 * is stable across runs; {@code lastModified} is advisory and never used for change detection.
 */
public record SourceArtifact(String id, ArtifactKind kind, Path path, String hash, long size, long lastModified) {
}
