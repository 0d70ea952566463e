package com.sitecraft.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sitecraft.graph.AggregateDefinition;

/**
 * Loads and validates the site configuration of a build root. Every problem surfaces as a
 * {@link ConfigException}.
 */
public class SiteConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public SiteConfig load(Path root, String configFile) {
        Path path = root.resolve(configFile);
        if (!Files.exists(path)) {
            return new SiteConfig();
        }
        SiteConfig config;
        try {
            byte[] bytes = Files.readAllBytes(path);
            config = bytes.length == 0 ? new SiteConfig() : mapper.readValue(bytes, SiteConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Invalid site configuration " + configFile + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new SiteConfig();
        }
        validate(config, configFile);
        return config;
    }

    static void validate(SiteConfig config, String configFile) {
        SiteConfig.LayoutConfig layout = config.getLayout();
        List<String> dirs = List.of(
                nonBlank(layout.getContent(), "layout.content"),
                nonBlank(layout.getTemplates(), "layout.templates"),
                nonBlank(layout.getData(), "layout.data"),
                nonBlank(layout.getAssets(), "layout.assets"),
                nonBlank(layout.getOutput(), "layout.output"),
                nonBlank(layout.getCache(), "layout.cache"));
        Set<String> seen = new HashSet<>();
        for (String dir : dirs) {
            if (dir.startsWith("/") || dir.contains("..")) {
                throw new ConfigException(configFile + ": layout directory " + dir + " must be relative to the site root");
            }
            if (!seen.add(dir)) {
                throw new ConfigException(configFile + ": layout directory " + dir + " is used twice");
            }
        }
        nonBlank(layout.getPartials(), "layout.partials");

        Set<String> outputs = new HashSet<>();
        try {
            for (AggregateDefinition definition : config.aggregateDefinitions()) {
                if (definition.output().startsWith("/") || definition.output().contains("..")) {
                    throw new ConfigException(configFile + ": aggregate output " + definition.output() + " must be relative");
                }
                if (!outputs.add(definition.output())) {
                    throw new ConfigException(configFile + ": aggregate output " + definition.output() + " is declared twice");
                }
            }
        } catch (ConfigException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigException(configFile + ": " + e.getMessage(), e);
        }
    }

    private static String nonBlank(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(key + " must be set");
        }
        return value;
    }
}
