package com.sitecraft.cache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sitecraft.source.FingerprintStore;

/**
 * Persists the {@link BuildCache} as one file per build root.
 * <p>
 * The file is either plain JSON or a GZIP envelope around the same JSON; the envelope is recognised by its
 * magic bytes, so loading never depends on configuration. A missing, unreadable or incompatible file loads
 * as an empty cache. Commits replace the file atomically, so the previous cache stays valid if a commit
 * fails or the process dies mid-write.
 */
public class CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);
    private static final int GZIP_MAGIC_0 = 0x1f;
    private static final int GZIP_MAGIC_1 = 0x8b;

    private final Path cacheFile;
    private final CompressionMode compression;
    private final double maxDecompressFraction;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private BuildCache current = BuildCache.empty();

    public CacheStore(Path cacheFile) {
        this(cacheFile, CompressionMode.AUTO, 0.05);
    }

    public CacheStore(Path cacheFile, CompressionMode compression, double maxDecompressFraction) {
        this.cacheFile = cacheFile;
        this.compression = compression;
        this.maxDecompressFraction = maxDecompressFraction;
    }

    public CacheLoadResult load() {
        CacheLoadResult result = readCacheFile();
        current = result.cache();
        if (result.usable()) {
            log.info("cache.load path={} outputs={} sources={} compressed={} decodeMs={}",
                    cacheFile,
                    current.getOutputs().size(),
                    current.getSources().size(),
                    result.compressed(),
                    result.decodeNanos() / 1_000_000);
        } else {
            log.info("cache.load path={} status={} detail={}; falling back to a full rebuild",
                    cacheFile, result.status(), result.detail());
        }
        return result;
    }

    public Optional<OutputRecord> get(String outputId) {
        return current.get(outputId);
    }

    public BuildCache current() {
        return current;
    }

    /**
     * Writes {@code cache} in one atomic replace and makes it the current cache.
     *
     * @param cycleMillis wall time of the cycle being committed, used to judge the compression trade-off
     */
    public void commit(BuildCache cache, long cycleMillis) throws CacheCommitException {
        cache.setSchemaVersion(BuildCache.SCHEMA_VERSION);
        cache.setHashAlgorithm(FingerprintStore.ALGORITHM);
        cache.setLastBuildMillis(cycleMillis);
        byte[] payload;
        boolean compressed;
        try {
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(cache);
            byte[] gzipped = compression == CompressionMode.NEVER ? null : gzip(json);
            compressed = gzipped != null && shouldCompress(gzipped, cycleMillis);
            payload = compressed ? gzipped : json;
            AtomicFiles.write(cacheFile, payload);
        } catch (IOException e) {
            throw new CacheCommitException("Unable to commit build cache to " + cacheFile, e);
        }
        current = cache;
        log.info("cache.commit path={} outputs={} sources={} compressed={} bytes={}",
                cacheFile, cache.getOutputs().size(), cache.getSources().size(), compressed, payload.length);
    }

    public Path cacheFile() {
        return cacheFile;
    }

    boolean shouldCompress(byte[] gzipped, long cycleMillis) throws IOException {
        if (compression == CompressionMode.ALWAYS) {
            return true;
        }
        long start = System.nanoTime();
        gunzip(gzipped);
        long decodeNanos = System.nanoTime() - start;
        double budgetNanos = maxDecompressFraction * Math.max(1L, cycleMillis) * 1_000_000d;
        boolean worthIt = decodeNanos <= budgetNanos;
        log.debug("cache.compression decodeNanos={} budgetNanos={} compress={}", decodeNanos, (long) budgetNanos, worthIt);
        return worthIt;
    }

    private CacheLoadResult readCacheFile() {
        if (!Files.exists(cacheFile)) {
            return CacheLoadResult.degraded(CacheLoadResult.Status.MISSING, "no cache file");
        }
        try {
            byte[] raw = Files.readAllBytes(cacheFile);
            boolean compressed = isGzip(raw);
            long start = System.nanoTime();
            byte[] json = compressed ? gunzip(raw) : raw;
            long decodeNanos = compressed ? System.nanoTime() - start : 0L;
            if (!compressed && !looksLikeJsonObject(json)) {
                return CacheLoadResult.degraded(CacheLoadResult.Status.CORRUPT, "unrecognised cache envelope");
            }

            JsonNode tree = mapper.readTree(json);
            int schemaVersion = tree.path("schemaVersion").asInt(0);
            String algorithm = tree.path("hashAlgorithm").asText("");
            if (schemaVersion != BuildCache.SCHEMA_VERSION || !FingerprintStore.ALGORITHM.equals(algorithm)) {
                return CacheLoadResult.degraded(CacheLoadResult.Status.SCHEMA_MISMATCH,
                        "schema " + schemaVersion + "/" + algorithm + " != " + BuildCache.SCHEMA_VERSION + "/" + FingerprintStore.ALGORITHM);
            }
            BuildCache cache = mapper.treeToValue(tree, BuildCache.class);
            return new CacheLoadResult(cache, CacheLoadResult.Status.LOADED, "", compressed, decodeNanos);
        } catch (IOException | RuntimeException e) {
            log.warn("cache.load.corrupt path={} reason={}", cacheFile, e.getMessage());
            return CacheLoadResult.degraded(CacheLoadResult.Status.CORRUPT, String.valueOf(e.getMessage()));
        }
    }

    private static boolean isGzip(byte[] bytes) {
        return bytes.length >= 2 && (bytes[0] & 0xff) == GZIP_MAGIC_0 && (bytes[1] & 0xff) == GZIP_MAGIC_1;
    }

    private static boolean looksLikeJsonObject(byte[] bytes) {
        for (byte b : bytes) {
            if (!Character.isWhitespace(b)) {
                return b == '{';
            }
        }
        return false;
    }

    private static byte[] gzip(byte[] bytes) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, bytes.length / 4));
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(bytes);
        }
        return buffer.toByteArray();
    }

    private static byte[] gunzip(byte[] bytes) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        }
    }
}
