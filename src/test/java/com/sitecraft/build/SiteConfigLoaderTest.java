package com.sitecraft.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sitecraft.graph.AggregateDefinition;
import com.sitecraft.source.SiteLayout;

class SiteConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final SiteConfigLoader loader = new SiteConfigLoader();

    @Test
    void shouldUseDefaultsWhenFileIsMissingOrEmpty() throws Exception {
        assertEquals(SiteLayout.defaults(), loader.load(tempDir, "site.yml").toLayout("site.yml"));

        Files.writeString(tempDir.resolve("site.yml"), "");
        assertEquals("Untitled", loader.load(tempDir, "site.yml").getTitle());
    }

    @Test
    void shouldReadLayoutParamsAndAggregates() throws Exception {
        Files.writeString(tempDir.resolve("site.yml"), """
                title: Docs
                baseUrl: https://docs.example.org
                params:
                  footer: Built with care
                layout:
                  content: pages
                  output: dist
                aggregates:
                  - output: sitemap.xml
                  - output: tags/{value}.html
                    field: tags
                    perValue: true
                """);

        SiteConfig config = loader.load(tempDir, "site.yml");

        assertEquals("Docs", config.getTitle());
        assertEquals("Built with care", config.getParams().get("footer"));
        SiteLayout layout = config.toLayout("site.yml");
        assertEquals("pages", layout.contentDir());
        assertEquals("dist", layout.outputDir());
        assertEquals(List.of(
                new AggregateDefinition("sitemap.xml", null, null, false),
                new AggregateDefinition("tags/{value}.html", "tags", null, true)), config.aggregateDefinitions());
    }

    @Test
    void shouldRejectLayoutsThatOverlapOrEscapeTheRoot() throws Exception {
        Files.writeString(tempDir.resolve("site.yml"), "layout:\n  output: content\n");
        ConfigException overlap = assertThrows(ConfigException.class, () -> loader.load(tempDir, "site.yml"));
        assertTrue(overlap.getMessage().contains("used twice"));

        Files.writeString(tempDir.resolve("site.yml"), "layout:\n  output: ../elsewhere\n");
        assertThrows(ConfigException.class, () -> loader.load(tempDir, "site.yml"));
    }

    @Test
    void shouldRejectDuplicateAggregateOutputs() throws Exception {
        Files.writeString(tempDir.resolve("site.yml"), "aggregates:\n  - output: menu.html\n    field: menu\n  - output: menu.html\n");

        assertThrows(ConfigException.class, () -> loader.load(tempDir, "site.yml"));
    }
}
