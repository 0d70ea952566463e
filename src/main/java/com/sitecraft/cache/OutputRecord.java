package com.sitecraft.cache;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sitecraft.graph.AggregatePredicate;

/**
 * A produced file as remembered by the cache. {@code primarySource} is the content or asset the output was
 * derived from and is null for aggregates; {@code aggregate} and {@code members} are set only for
 * aggregates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OutputRecord(
        String outputId,
        OutputKind kind,
        String primarySource,
        String outputHash,
        List<DependencyEntry> dependencies,
        AggregatePredicate aggregate,
        List<String> members) {

    public OutputRecord {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        members = members == null ? List.of() : List.copyOf(members);
    }

    /**
     * First dependency whose recorded hash no longer matches, or empty when the output is reusable.
     */
    public Optional<String> firstStaleDependency(Function<String, String> currentHash) {
        for (DependencyEntry entry : dependencies) {
            if (!entry.hash().equals(currentHash.apply(entry.source()))) {
                return Optional.of(entry.source());
            }
        }
        return Optional.empty();
    }
}
