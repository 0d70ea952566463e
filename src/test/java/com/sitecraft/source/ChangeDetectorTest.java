package com.sitecraft.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector(SiteLayout.defaults());

    @Test
    void shouldClassifyAddedModifiedAndRemovedSources() {
        Map<String, String> previous = Map.of(
                "content/a.md", "h1",
                "content/b.md", "h2",
                "content/c.md", "h3");
        Map<String, SourceArtifact> current = artifacts(
                artifact("content/a.md", ArtifactKind.CONTENT, "h1"),
                artifact("content/b.md", ArtifactKind.CONTENT, "h2-edited"),
                artifact("content/d.md", ArtifactKind.CONTENT, "h4"));

        ChangeSet changes = detector.detect(previous, current, Set.of());

        assertEquals(Set.of("content/d.md"), changes.added());
        assertEquals(Set.of("content/b.md"), changes.modified());
        assertEquals(Set.of("content/c.md"), changes.removed());
        assertFalse(changes.configChanged());
        assertEquals(3, changes.size());
    }

    @Test
    void shouldNotReportUnreadableSourceAsRemoved() {
        Map<String, String> previous = Map.of("content/locked.md", "h1");

        ChangeSet changes = detector.detect(previous, Map.of(), Set.of("content/locked.md"));

        assertTrue(changes.isEmpty());
    }

    @Test
    void shouldNotReportSourcesBelowUnreadableDirectoryAsRemoved() {
        Map<String, String> previous = Map.of(
                "content/sub/a.md", "h1",
                "content/sub/deep/b.md", "h2",
                "content/subway.md", "h3");

        ChangeSet changes = detector.detect(previous, Map.of(), Set.of("content/sub"));

        assertEquals(Set.of("content/subway.md"), changes.removed());
        assertTrue(ChangeDetector.isUnreadable(Set.of("content/sub"), "content/sub/deep/b.md"));
        assertFalse(ChangeDetector.isUnreadable(Set.of("content/sub"), "content/subway.md"));
    }

    @Test
    void shouldFlagConfigurationEdits() {
        Map<String, String> previous = Map.of("site.yml", "old");
        Map<String, SourceArtifact> current = artifacts(artifact("site.yml", ArtifactKind.CONFIG, "new"));

        ChangeSet changes = detector.detect(previous, current, Set.of());

        assertTrue(changes.configChanged());
        assertEquals(Set.of("site.yml"), changes.changed());
    }

    private static SourceArtifact artifact(String id, ArtifactKind kind, String hash) {
        return new SourceArtifact(id, kind, Path.of(id), hash, 1L, 0L);
    }

    private static Map<String, SourceArtifact> artifacts(SourceArtifact... artifacts) {
        Map<String, SourceArtifact> map = new LinkedHashMap<>();
        for (SourceArtifact artifact : artifacts) {
            map.put(artifact.id(), artifact);
        }
        return map;
    }
}
