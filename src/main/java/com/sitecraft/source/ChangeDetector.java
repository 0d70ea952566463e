package com.sitecraft.source;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final SiteLayout layout;

    public ChangeDetector(SiteLayout layout) {
        this.layout = layout;
    }

    /**
     * Compares current fingerprints with the committed ones. Sources in {@code unreadable}, or under a
     * directory in it, could not be fingerprinted this cycle and are treated as unchanged.
     */
    public ChangeSet detect(Map<String, String> previousHashes, Map<String, SourceArtifact> current, Set<String> unreadable) {
        Set<String> added = new HashSet<>();
        Set<String> modified = new HashSet<>();
        Set<String> removed = new HashSet<>();

        for (SourceArtifact artifact : current.values()) {
            String previous = previousHashes.get(artifact.id());
            if (previous == null) {
                added.add(artifact.id());
            } else if (!previous.equals(artifact.hash())) {
                modified.add(artifact.id());
            }
        }
        for (String previousId : previousHashes.keySet()) {
            if (!current.containsKey(previousId) && !isUnreadable(unreadable, previousId)) {
                removed.add(previousId);
            }
        }

        boolean configChanged = isConfig(added) || isConfig(modified) || isConfig(removed);
        ChangeSet changeSet = new ChangeSet(added, modified, removed, configChanged);
        log.debug("changes.detected added={} modified={} removed={} configChanged={}",
                added.size(), modified.size(), removed.size(), configChanged);
        return changeSet;
    }

    /**
     * True when {@code sourceId} itself or one of its parent directories failed to be read.
     */
    public static boolean isUnreadable(Set<String> unreadable, String sourceId) {
        if (unreadable.isEmpty()) {
            return false;
        }
        String candidate = sourceId;
        while (true) {
            if (unreadable.contains(candidate)) {
                return true;
            }
            int slash = candidate.lastIndexOf('/');
            if (slash <= 0) {
                return false;
            }
            candidate = candidate.substring(0, slash);
        }
    }

    private boolean isConfig(Set<String> ids) {
        for (String id : ids) {
            Optional<ArtifactKind> kind = layout.classify(id);
            if (kind.isPresent() && kind.get() == ArtifactKind.CONFIG) {
                return true;
            }
        }
        return false;
    }
}
