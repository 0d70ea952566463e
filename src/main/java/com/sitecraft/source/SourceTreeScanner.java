package com.sitecraft.source;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a build root and describes every classified file as a {@link SourceArtifact}. Unreadable entries
 * are reported as {@link DiscoveryError}s and never abort the walk.
 */
public class SourceTreeScanner {
    private static final Logger log = LoggerFactory.getLogger(SourceTreeScanner.class);

    private final SiteLayout layout;
    private final FingerprintStore fingerprints;

    public SourceTreeScanner(SiteLayout layout, FingerprintStore fingerprints) {
        this.layout = layout;
        this.fingerprints = fingerprints;
    }

    public Listing list(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        List<DiscoveryError> errors = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                return layout.isExcludedDirectory(toId(root, dir)) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && layout.classify(toId(root, file)).isPresent()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                String id = toId(root, file);
                log.warn("discovery.unreadable source={} reason={}", id, e.getMessage());
                errors.add(new DiscoveryError(id, String.valueOf(e.getMessage())));
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return new Listing(files, errors);
    }

    public SourceArtifact describe(Path root, Path file) throws IOException {
        String id = toId(root, file);
        Optional<ArtifactKind> kind = layout.classify(id);
        if (kind.isEmpty()) {
            throw new IllegalArgumentException("Not a source artifact: " + id);
        }
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        return new SourceArtifact(
                id,
                kind.get(),
                file,
                fingerprints.fingerprint(file),
                attributes.size(),
                attributes.lastModifiedTime().toMillis());
    }

    public static String toId(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public record Listing(List<Path> files, List<DiscoveryError> errors) {
    }
}
