package com.sitecraft;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sitecraft.runtime.EngineConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildSiteAndExitCleanly() throws IOException {
        writeSite();

        int exitCode = new CommandLine(new Main(Map.of())).execute(tempDir.toString());

        assertEquals(0, exitCode);
        assertEquals("<h1>Home</h1>\n", Files.readString(tempDir.resolve("public/index.html")));
        assertTrue(Files.exists(tempDir.resolve(".sitecraft/build-cache.json")));
    }

    @Test
    void shouldReturnArtifactFailureExitCode() throws IOException {
        writeSite();
        Files.writeString(tempDir.resolve("content/broken.md"), "---\nlayout: nope\n---\n");

        int exitCode = new CommandLine(new Main(Map.of())).execute(tempDir.toString(), "--no-parallel");

        assertEquals(1, exitCode);
    }

    @Test
    void shouldReturnCycleFailureExitCodeForBadConfiguration() throws IOException {
        writeSite();
        Files.writeString(tempDir.resolve("sitecraft.yml"), "cache:\n  compression: brotli\n");

        assertEquals(2, new CommandLine(new Main(Map.of())).execute(tempDir.toString()));
    }

    @Test
    void shouldApplyCommandLineOverrides() {
        Main main = new Main(Map.of());
        new CommandLine(main).parseArgs("--no-parallel", "--fast", "--memory-optimized", "--max-workers", "3",
                "--render-timeout-ms", "250", "--cache-path", "tmp/cache.json", "--environment", "ci");
        EngineConfig config = new EngineConfig();

        main.applyOverrides(config);

        assertFalse(config.getBuild().isParallel());
        assertTrue(config.getBuild().isFast());
        assertTrue(config.getBuild().isMemoryOptimized());
        assertEquals(3, config.getBuild().getMaxWorkers());
        assertEquals(250L, config.getBuild().getRenderTimeoutMs());
        assertEquals("ci", config.getBuild().getEnvironment());
        assertEquals("tmp/cache.json", config.getCache().getPath());
    }

    private void writeSite() throws IOException {
        Files.createDirectories(tempDir.resolve("content"));
        Files.createDirectories(tempDir.resolve("templates"));
        Files.writeString(tempDir.resolve("site.yml"), "title: CLI\n");
        Files.writeString(tempDir.resolve("templates/page.html"), "<h1>{{title}}</h1>\n");
        Files.writeString(tempDir.resolve("content/index.md"), "---\ntitle: Home\n---\nwelcome\n");
    }
}
