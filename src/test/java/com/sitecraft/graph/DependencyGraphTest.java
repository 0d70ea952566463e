package com.sitecraft.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.sitecraft.source.ChangeSet;

class DependencyGraphTest {

    @Test
    void shouldInvalidateEveryOutputThatConsumedAChangedSource() {
        DependencyGraph graph = new DependencyGraph();
        graph.replaceDependencies("a.html", List.of("content/a.md", "templates/page.html"));
        graph.replaceDependencies("b.html", List.of("content/b.md", "templates/page.html"));
        graph.replaceDependencies("c.html", List.of("content/c.md", "templates/other.html"));

        Set<String> invalidated = graph.invalidatedBy(new ChangeSet(Set.of(), Set.of("templates/page.html"), Set.of(), false));

        assertEquals(Set.of("a.html", "b.html"), invalidated);
    }

    @Test
    void shouldPropagateThroughAggregatesWithoutLoopingOnCycles() {
        DependencyGraph graph = new DependencyGraph();
        // the menu lists pages that embed the menu
        graph.replaceDependencies("menu.html", List.of("content/a.md", "content/b.md"));
        graph.replaceDependencies("a.html", List.of("content/a.md", "menu.html"));
        graph.replaceDependencies("b.html", List.of("content/b.md", "menu.html"));
        graph.recordDependency("menu.html", "a.html");

        Set<String> closure = graph.propagate(List.of("menu.html"));

        assertEquals(Set.of("menu.html", "a.html", "b.html"), closure);
    }

    @Test
    void shouldDropOldEdgesWhenDependenciesAreReplaced() {
        DependencyGraph graph = new DependencyGraph();
        graph.replaceDependencies("a.html", List.of("content/a.md", "templates/old.html"));
        assertEquals(2, graph.edgeCount());

        graph.replaceDependencies("a.html", List.of("content/a.md", "templates/new.html"));

        assertEquals(2, graph.edgeCount());
        assertEquals(Set.of("content/a.md", "templates/new.html"), graph.dependenciesOf("a.html"));
        assertTrue(graph.dependentsOf("templates/old.html").isEmpty());
        assertTrue(graph.invalidatedBy(new ChangeSet(Set.of(), Set.of("templates/old.html"), Set.of(), false)).isEmpty());
    }

    @Test
    void shouldForgetRemovedOutputs() {
        DependencyGraph graph = new DependencyGraph();
        graph.replaceDependencies("a.html", List.of("content/a.md"));

        graph.removeOutput("a.html");

        assertFalse(graph.isOutput("a.html"));
        assertEquals(0, graph.edgeCount());
        assertTrue(graph.invalidatedBy(new ChangeSet(Set.of(), Set.of("content/a.md"), Set.of(), false)).isEmpty());
    }

    @Test
    void shouldReachOutputsDependingOnAnAbsentSourceOnceItAppears() {
        DependencyGraph graph = new DependencyGraph();
        graph.replaceDependencies("a.html", List.of("content/a.md", "templates/partials/footer.html"));

        Set<String> invalidated = graph.invalidatedBy(new ChangeSet(Set.of("templates/partials/footer.html"), Set.of(), Set.of(), false));

        assertEquals(Set.of("a.html"), invalidated);
    }
}
