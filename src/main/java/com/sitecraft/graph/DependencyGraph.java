package com.sitecraft.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.sitecraft.source.ChangeSet;

/**
 * Directed graph from outputs to the sources (or other outputs, such as aggregates) they were built from.
 * <p>
 * Nodes live in an arena and are addressed by index; edges are kept in both directions so invalidation can
 * walk from a changed source to every output that consumed it. The graph may contain cycles, for example a
 * menu aggregate that lists pages which in turn embed the menu, so every walk is breadth-first with a
 * visited set and touches each edge at most once.
 * <p>
 * Not thread-safe. The orchestrator mutates it only while merging results serially.
 */
public class DependencyGraph {
    private final Map<String, Integer> index = new HashMap<>();
    private final List<String> ids = new ArrayList<>();
    private final List<Set<Integer>> dependencies = new ArrayList<>();
    private final List<Set<Integer>> dependents = new ArrayList<>();
    private final BitSet outputs = new BitSet();
    private int edgeCount;

    public void recordDependency(String output, String source) {
        int from = node(output);
        int to = node(source);
        outputs.set(from);
        if (dependencies.get(from).add(to)) {
            dependents.get(to).add(from);
            edgeCount++;
        }
    }

    /**
     * Replaces every edge of {@code output} with the given dependency set, as reported by its latest render.
     */
    public void replaceDependencies(String output, Collection<String> sources) {
        clearDependencies(output);
        int from = node(output);
        outputs.set(from);
        for (String source : sources) {
            recordDependency(output, source);
        }
    }

    public void clearDependencies(String output) {
        Integer from = index.get(output);
        if (from == null) {
            return;
        }
        for (Integer to : dependencies.get(from)) {
            dependents.get(to).remove(from);
            edgeCount--;
        }
        dependencies.get(from).clear();
    }

    public void removeOutput(String output) {
        clearDependencies(output);
        Integer from = index.get(output);
        if (from != null) {
            outputs.clear(from);
        }
    }

    /**
     * Outputs reachable backwards from any source in the change set.
     */
    public Set<String> invalidatedBy(ChangeSet changeSet) {
        return reverseReachable(changeSet.changed(), false);
    }

    /**
     * Closes {@code seeds} under the reverse-dependency relation: an invalidated output that is itself
     * consumed by another output invalidates that one too, until nothing new is added. The seeds are part of
     * the result.
     */
    public Set<String> propagate(Collection<String> seeds) {
        return reverseReachable(seeds, true);
    }

    public Set<String> dependenciesOf(String output) {
        return names(index.get(output), dependencies);
    }

    public Set<String> dependentsOf(String source) {
        return names(index.get(source), dependents);
    }

    public boolean isOutput(String id) {
        Integer node = index.get(id);
        return node != null && outputs.get(node);
    }

    public int edgeCount() {
        return edgeCount;
    }

    public int nodeCount() {
        return ids.size();
    }

    private Set<String> reverseReachable(Collection<String> seeds, boolean includeSeeds) {
        Set<String> reached = new LinkedHashSet<>();
        BitSet visited = new BitSet(ids.size());
        Deque<Integer> queue = new ArrayDeque<>();
        for (String seed : seeds) {
            if (includeSeeds) {
                reached.add(seed);
            }
            Integer node = index.get(seed);
            if (node != null && !visited.get(node)) {
                visited.set(node);
                queue.add(node);
            }
        }

        int traversed = 0;
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (Integer dependent : dependents.get(current)) {
                traversed++;
                if (traversed > edgeCount) {
                    throw new IllegalStateException("Reverse walk exceeded edge count " + edgeCount);
                }
                if (visited.get(dependent)) {
                    continue;
                }
                visited.set(dependent);
                if (outputs.get(dependent)) {
                    reached.add(ids.get(dependent));
                }
                queue.add(dependent);
            }
        }
        return reached;
    }

    private Set<String> names(Integer node, List<Set<Integer>> adjacency) {
        if (node == null) {
            return Set.of();
        }
        Set<String> names = new TreeSet<>();
        for (Integer neighbour : adjacency.get(node)) {
            names.add(ids.get(neighbour));
        }
        return names;
    }

    private int node(String id) {
        Integer existing = index.get(id);
        if (existing != null) {
            return existing;
        }
        int created = ids.size();
        ids.add(id);
        dependencies.add(new LinkedHashSet<>());
        dependents.add(new LinkedHashSet<>());
        index.put(id, created);
        return created;
    }
}
