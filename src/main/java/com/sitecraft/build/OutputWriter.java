package com.sitecraft.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.sitecraft.cache.AtomicFiles;

/**
 * Writes and removes files under the output directory. Each write replaces the target atomically, so a
 * reader never sees a half-written page.
 */
public class OutputWriter {
    private final Path outputRoot;

    public OutputWriter(Path outputRoot) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
    }

    public Path resolve(String outputId) throws IOException {
        Path target = outputRoot.resolve(outputId).normalize();
        if (!target.startsWith(outputRoot) || target.equals(outputRoot)) {
            throw new IOException("Output id escapes the output directory: " + outputId);
        }
        return target;
    }

    /**
     * Writes {@code content} unless the previous build produced the same hash and the file is still there.
     *
     * @return true when the file was written
     */
    public boolean writeIfChanged(String outputId, byte[] content, String hash, String previousHash) throws IOException {
        Path target = resolve(outputId);
        if (hash.equals(previousHash) && Files.isRegularFile(target)) {
            return false;
        }
        AtomicFiles.write(target, content);
        return true;
    }

    public boolean exists(String outputId) {
        try {
            return Files.isRegularFile(resolve(outputId));
        } catch (IOException e) {
            return false;
        }
    }

    public boolean delete(String outputId) throws IOException {
        return Files.deleteIfExists(resolve(outputId));
    }

    public Path root() {
        return outputRoot;
    }
}
