package com.sitecraft.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AggregateResolverTest {

    @Test
    void shouldExpandPerValueAggregatesAndOrderMembersByWeight() {
        Map<String, PageMetadata> pages = new LinkedHashMap<>();
        pages.put("content/a.md", page("A", false, 2, Map.of("tags", List.of("Java", "Build Tools"))));
        pages.put("content/b.md", page("B", false, 1, Map.of("tags", List.of("Java"))));
        pages.put("content/c.md", page("C", true, 0, Map.of("tags", List.of("Java"))));

        AggregateResolver resolver = new AggregateResolver(List.of(
                new AggregateDefinition("tags/{value}.html", "tags", null, true),
                new AggregateDefinition("sitemap.xml", null, null, false)));
        Map<String, AggregateMembership> resolved = resolver.resolve(pages);

        assertEquals(List.of("content/b.md", "content/a.md"), resolved.get("tags/java.html").members());
        assertEquals(List.of("content/a.md"), resolved.get("tags/build-tools.html").members());
        assertEquals(List.of("content/b.md", "content/a.md"), resolved.get("sitemap.xml").members());
        assertFalse(resolved.containsKey("tags/_.html"));
    }

    @Test
    void shouldMergeValuesSharingASlugIntoOneAggregate() {
        Map<String, PageMetadata> pages = new LinkedHashMap<>();
        pages.put("content/a.md", page("A", false, 0, Map.of("tags", List.of("Python"))));
        pages.put("content/b.md", page("B", false, 0, Map.of("tags", List.of("python"))));
        pages.put("content/c.md", page("C", false, 0, Map.of("tags", List.of("Rust"))));

        Map<String, AggregateMembership> resolved = new AggregateResolver(List.of(
                new AggregateDefinition("tags/{value}.html", "tags", null, true))).resolve(pages);

        assertEquals(List.of("tags/python.html", "tags/rust.html"), List.copyOf(resolved.keySet()));
        assertEquals(List.of("content/a.md", "content/b.md"), resolved.get("tags/python.html").members());
        assertEquals("Python", resolved.get("tags/python.html").predicate().value());
    }

    @Test
    void shouldChangeDigestOnlyWhenMembershipChanges() {
        AggregatePredicate predicate = new AggregatePredicate("menu", null);

        String first = AggregateMembership.of("menu.html", predicate, List.of("content/a.md")).digest();
        String same = AggregateMembership.of("menu.html", predicate, List.of("content/a.md")).digest();
        String grown = AggregateMembership.of("menu.html", predicate, List.of("content/a.md", "content/b.md")).digest();

        assertEquals(first, same);
        assertNotEquals(first, grown);
    }

    @Test
    void shouldOmitAggregatesWithoutMembers() {
        AggregateResolver resolver = new AggregateResolver(List.of(new AggregateDefinition("menu.html", "menu", null, false)));

        Map<String, AggregateMembership> resolved = resolver.resolve(Map.of("content/a.md", page("A", false, 0, Map.of())));

        assertFalse(resolved.containsKey("menu.html"));
    }

    @Test
    void shouldRejectPerValueDefinitionWithoutPlaceholder() {
        assertThrows(IllegalArgumentException.class, () -> new AggregateDefinition("tags.html", "tags", null, true));
    }

    @Test
    void shouldSlugValues() {
        assertEquals("build-tools", AggregateResolver.slug(" Build Tools! "));
        assertEquals("_", AggregateResolver.slug("???"));
    }

    private static PageMetadata page(String title, boolean draft, int weight, Map<String, List<String>> fields) {
        return new PageMetadata(title, draft, weight, null, fields);
    }
}
