package com.sitecraft.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceTreeScannerTest {

    @TempDir
    Path tempDir;

    private final SourceTreeScanner scanner = new SourceTreeScanner(SiteLayout.defaults(), new FingerprintStore());

    @Test
    void shouldListClassifiedFilesAndSkipOutputAndCacheDirectories() throws Exception {
        write("site.yml", "title: Test");
        write("content/index.md", "home");
        write("content/blog/post.md", "post");
        write("templates/page.html", "{{content}}");
        write("templates/partials/nav.html", "<nav/>");
        write("data/authors.json", "{}");
        write("assets/site.css", "body{}");
        write("public/index.html", "stale");
        write(".sitecraft/build-cache.json", "{}");
        write(".git/HEAD", "ref");
        write("README.md", "not a source");

        SourceTreeScanner.Listing listing = scanner.list(tempDir);

        List<String> ids = listing.files().stream().map(file -> SourceTreeScanner.toId(tempDir, file)).toList();
        assertEquals(List.of(
                "assets/site.css",
                "content/blog/post.md",
                "content/index.md",
                "data/authors.json",
                "site.yml",
                "templates/page.html",
                "templates/partials/nav.html"), ids);
        assertTrue(listing.errors().isEmpty());
    }

    @Test
    void shouldDescribeFileWithKindHashAndSize() throws Exception {
        Path file = write("templates/partials/nav.html", "<nav/>");

        SourceArtifact artifact = scanner.describe(tempDir, file);

        assertEquals("templates/partials/nav.html", artifact.id());
        assertEquals(ArtifactKind.PARTIAL, artifact.kind());
        assertEquals(6L, artifact.size());
        assertEquals(new FingerprintStore().fingerprint(file), artifact.hash());
    }

    @Test
    void shouldMapContentToHtmlOutputIds() {
        SiteLayout layout = SiteLayout.defaults();

        assertEquals("blog/post.html", layout.pageOutputId("content/blog/post.md"));
        assertEquals("about.html", layout.pageOutputId("content/about"));
        assertEquals("templates/page.html", layout.templateId("Page"));
        assertEquals(ArtifactKind.CONFIG, layout.classify("site.yml").orElseThrow());
        assertTrue(layout.classify("public/index.html").isEmpty());
    }

    private Path write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
