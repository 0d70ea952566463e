package com.sitecraft.source;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps root-relative source ids to artifact kinds and page sources to output ids.
 */
public record SiteLayout(
        String contentDir,
        String templatesDir,
        String partialsDir,
        String dataDir,
        String assetsDir,
        String outputDir,
        String cacheDir,
        String configFile) {

    public static SiteLayout defaults() {
        return new SiteLayout("content", "templates", "templates/partials", "data", "assets", "public", ".sitecraft", "site.yml");
    }

    public Optional<ArtifactKind> classify(String sourceId) {
        if (sourceId.equals(configFile)) {
            return Optional.of(ArtifactKind.CONFIG);
        }
        if (isUnder(sourceId, outputDir) || isUnder(sourceId, cacheDir)) {
            return Optional.empty();
        }
        if (isUnder(sourceId, contentDir)) {
            return Optional.of(ArtifactKind.CONTENT);
        }
        // partials usually live inside the templates directory, so check them first
        if (isUnder(sourceId, partialsDir)) {
            return Optional.of(ArtifactKind.PARTIAL);
        }
        if (isUnder(sourceId, templatesDir)) {
            return Optional.of(ArtifactKind.TEMPLATE);
        }
        if (isUnder(sourceId, dataDir)) {
            return Optional.of(ArtifactKind.DATA);
        }
        if (isUnder(sourceId, assetsDir)) {
            return Optional.of(ArtifactKind.ASSET);
        }
        return Optional.empty();
    }

    public boolean isExcludedDirectory(String relativeDir) {
        return relativeDir.equals(outputDir) || relativeDir.equals(cacheDir) || relativeDir.startsWith(".");
    }

    public String pageOutputId(String contentSourceId) {
        String relative = contentSourceId.substring(contentDir.length() + 1);
        int dot = relative.lastIndexOf('.');
        int slash = relative.lastIndexOf('/');
        String stem = dot > slash ? relative.substring(0, dot) : relative;
        return stem + ".html";
    }

    public String assetOutputId(String assetSourceId) {
        return assetSourceId;
    }

    public String templateId(String name) {
        return templatesDir + "/" + name.toLowerCase(Locale.ROOT) + ".html";
    }

    public String partialId(String name) {
        return partialsDir + "/" + name.toLowerCase(Locale.ROOT) + ".html";
    }

    public String dataId(String name) {
        return dataDir + "/" + name;
    }

    private static boolean isUnder(String sourceId, String dir) {
        return dir != null && !dir.isBlank() && sourceId.startsWith(dir + "/");
    }
}
