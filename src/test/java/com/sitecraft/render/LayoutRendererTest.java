package com.sitecraft.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sitecraft.graph.AggregateMembership;
import com.sitecraft.graph.AggregatePredicate;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.FingerprintStore;
import com.sitecraft.source.SiteLayout;
import com.sitecraft.source.SourceArtifact;
import com.sitecraft.source.SourceTreeScanner;

class LayoutRendererTest {

    @TempDir
    Path tempDir;

    private final LayoutRenderer renderer = new LayoutRenderer();
    private final Map<String, SourceArtifact> sources = new LinkedHashMap<>();
    private final Map<String, PageMetadata> pages = new LinkedHashMap<>();
    private final Map<String, AggregateMembership> aggregates = new LinkedHashMap<>();

    @Test
    void shouldMergePageIntoLayoutAndRecordConsultedSources() throws Exception {
        write("templates/page.html", "<title>{{title}} | {{site}}</title>{{partial:nav}}<main>{{content}}</main>{{param:footer}}");
        write("templates/partials/nav.html", "<nav>home</nav>");
        write("content/a.md", "---\ntitle: A & B\n---\n<p>hi</p>\n");
        pages.put("content/a.md", new PageMetadata("A & B", false, 0, null, Map.of()));

        RenderContext context = new RenderContext(snapshot());
        RenderResult result = renderer.render(RenderTarget.page("a.html", sources.get("content/a.md")), context);

        assertEquals("<title>A &amp; B | Test</title><nav>home</nav><main><p>hi</p>\n</main>(c)",
                new String(result.content(), StandardCharsets.UTF_8));
        assertTrue(result.dependencies().containsAll(List.of("content/a.md", "templates/page.html", "templates/partials/nav.html")));
    }

    @Test
    void shouldFailOnMissingTemplate() throws Exception {
        write("content/a.md", "body");
        pages.put("content/a.md", new PageMetadata("A", false, 0, "missing", Map.of()));

        RenderContext context = new RenderContext(snapshot());

        assertThrows(RenderException.class, () -> renderer.render(RenderTarget.page("a.html", sources.get("content/a.md")), context));
        assertTrue(context.consulted().contains("templates/missing.html"));
    }

    @Test
    void shouldRenderAggregateListAndSitemap() throws Exception {
        write("content/a.md", "a");
        write("content/b.md", "b");
        pages.put("content/a.md", new PageMetadata("Alpha", false, 0, null, Map.of("tags", List.of("java"))));
        pages.put("content/b.md", new PageMetadata("Beta", false, 1, null, Map.of("tags", List.of("java"))));
        AggregateMembership tags = AggregateMembership.of("tags/java.html", new AggregatePredicate("tags", "java"), List.of("content/a.md", "content/b.md"));
        AggregateMembership sitemap = AggregateMembership.of("sitemap.xml", AggregatePredicate.allPages(), List.of("content/a.md"));

        String list = new String(renderer.render(RenderTarget.aggregate(tags), new RenderContext(snapshot())).content(), StandardCharsets.UTF_8);
        String xml = new String(renderer.render(RenderTarget.aggregate(sitemap), new RenderContext(snapshot())).content(), StandardCharsets.UTF_8);

        assertTrue(list.startsWith("<h1>java</h1>"));
        assertTrue(list.contains("<a href=\"/a.html\">Alpha</a>"));
        assertTrue(list.contains("<a href=\"/b.html\">Beta</a>"));
        assertTrue(xml.contains("<loc>https://example.org/a.html</loc>"));
    }

    @Test
    void shouldRecordConsultedAggregateWhenEmbeddingIt() throws Exception {
        write("templates/page.html", "{{aggregate:menu.html}}|{{link:missing.md}}");
        write("content/a.md", "a");
        pages.put("content/a.md", new PageMetadata("A", false, 0, null, Map.of("menu", List.of("main"))));
        aggregates.put("menu.html", AggregateMembership.of("menu.html", new AggregatePredicate("menu", null), List.of("content/a.md")));

        RenderContext context = new RenderContext(snapshot());
        RenderResult result = renderer.render(RenderTarget.page("a.html", sources.get("content/a.md")), context);

        assertTrue(new String(result.content(), StandardCharsets.UTF_8).endsWith("|#missing:missing.md"));
        assertTrue(result.dependencies().contains("menu.html"));
        assertTrue(result.dependencies().contains("content/missing.md"));
    }

    private RenderSnapshot snapshot() {
        return new RenderSnapshot(tempDir, SiteLayout.defaults(), "Test", "https://example.org/", Map.of("footer", "(c)"),
                sources, pages, aggregates, new FragmentCache());
    }

    private void write(String id, String content) throws Exception {
        Path file = tempDir.resolve(id);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        sources.put(id, new SourceTreeScanner(SiteLayout.defaults(), new FingerprintStore()).describe(tempDir, file));
    }
}
