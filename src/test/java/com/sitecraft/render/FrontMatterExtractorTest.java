package com.sitecraft.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.ArtifactKind;
import com.sitecraft.source.SourceArtifact;

class FrontMatterExtractorTest {

    private final FrontMatterExtractor extractor = new FrontMatterExtractor();

    @Test
    void shouldExtractReservedKeysAndListFields() throws Exception {
        PageMetadata page = extract("content/post.md", """
                ---
                title: Hello
                weight: 3
                layout: post
                tags: [java, build]
                menu: main
                ---
                Body text
                """);

        assertEquals("Hello", page.title());
        assertEquals(3, page.weight());
        assertEquals("post", page.layout());
        assertFalse(page.draft());
        assertEquals(List.of("java", "build"), page.values("tags"));
        assertEquals(List.of("main"), page.values("menu"));
    }

    @Test
    void shouldDefaultTitleToFileStemWithoutFrontMatter() throws Exception {
        PageMetadata page = extract("content/notes/first-steps.md", "Just a body\n");

        assertEquals("first-steps", page.title());
        assertNull(page.layout());
        assertTrue(page.fields().isEmpty());
    }

    @Test
    void shouldMarkDrafts() throws Exception {
        assertTrue(extract("content/wip.md", "---\ndraft: true\n---\n").draft());
    }

    @Test
    void shouldRejectInvalidWeightAndUnterminatedFrontMatter() {
        assertThrows(RenderException.class, () -> extract("content/a.md", "---\nweight: heavy\n---\n"));
        assertThrows(RenderException.class, () -> extract("content/b.md", "---\ntitle: never closed\n"));
    }

    @Test
    void shouldSplitBodyFromFrontMatter() throws Exception {
        FrontMatter frontMatter = FrontMatter.parse("---\ntitle: X\n---\n<p>body</p>\n");

        assertEquals("X", frontMatter.fields().get("title"));
        assertEquals("<p>body</p>\n", frontMatter.body());
    }

    private PageMetadata extract(String id, String content) throws RenderException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        SourceArtifact source = new SourceArtifact(id, ArtifactKind.CONTENT, Path.of(id), "hash", bytes.length, 0L);
        return extractor.extract(source, bytes);
    }
}
