package com.sitecraft.source;

import java.util.Set;
import java.util.TreeSet;

/**
 * Source-level differences between the committed cache and the current tree.
 */
public record ChangeSet(Set<String> added, Set<String> modified, Set<String> removed, boolean configChanged) {

    public ChangeSet {
        added = Set.copyOf(added);
        modified = Set.copyOf(modified);
        removed = Set.copyOf(removed);
    }

    public static ChangeSet empty() {
        return new ChangeSet(Set.of(), Set.of(), Set.of(), false);
    }

    public Set<String> changed() {
        Set<String> all = new TreeSet<>(added);
        all.addAll(modified);
        all.addAll(removed);
        return all;
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }

    public int size() {
        return added.size() + modified.size() + removed.size();
    }
}
