package com.sitecraft.cache;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.FingerprintStore;

/**
 * In-memory form of the persisted cache: source hashes, output records and parsed page metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuildCache {
    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private String hashAlgorithm = FingerprintStore.ALGORITHM;
    private long lastBuildMillis;
    private Map<String, String> sources = new TreeMap<>();
    private Map<String, OutputRecord> outputs = new TreeMap<>();
    private Map<String, PageMetadata> pages = new TreeMap<>();

    public static BuildCache empty() {
        return new BuildCache();
    }

    public BuildCache copy() {
        BuildCache copy = new BuildCache();
        copy.schemaVersion = schemaVersion;
        copy.hashAlgorithm = hashAlgorithm;
        copy.lastBuildMillis = lastBuildMillis;
        copy.sources = new TreeMap<>(sources);
        copy.outputs = new TreeMap<>(outputs);
        copy.pages = new TreeMap<>(pages);
        return copy;
    }

    public Optional<OutputRecord> get(String outputId) {
        return Optional.ofNullable(outputs.get(outputId));
    }

    public void putOutput(OutputRecord record) {
        outputs.put(record.outputId(), record);
    }

    public void removeOutput(String outputId) {
        outputs.remove(outputId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sources.isEmpty() && outputs.isEmpty();
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getHashAlgorithm() {
        return hashAlgorithm;
    }

    public void setHashAlgorithm(String hashAlgorithm) {
        this.hashAlgorithm = hashAlgorithm;
    }

    public long getLastBuildMillis() {
        return lastBuildMillis;
    }

    public void setLastBuildMillis(long lastBuildMillis) {
        this.lastBuildMillis = lastBuildMillis;
    }

    public Map<String, String> getSources() {
        return sources;
    }

    public void setSources(Map<String, String> sources) {
        this.sources = sources == null ? new TreeMap<>() : new TreeMap<>(sources);
    }

    public Map<String, OutputRecord> getOutputs() {
        return outputs;
    }

    public void setOutputs(Map<String, OutputRecord> outputs) {
        this.outputs = outputs == null ? new TreeMap<>() : new TreeMap<>(outputs);
    }

    public Map<String, PageMetadata> getPages() {
        return pages;
    }

    public void setPages(Map<String, PageMetadata> pages) {
        this.pages = pages == null ? new TreeMap<>() : new TreeMap<>(pages);
    }
}
