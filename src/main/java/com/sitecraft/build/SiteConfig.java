package com.sitecraft.build;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sitecraft.graph.AggregateDefinition;
import com.sitecraft.source.SiteLayout;

/**
 * Contents of the site configuration file. The file is itself a {@code CONFIG} source artifact, so any edit
 * to it invalidates every output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteConfig {
    private String title = "Untitled";
    private String baseUrl = "";
    private Map<String, Object> params = new LinkedHashMap<>();
    private LayoutConfig layout = new LayoutConfig();
    private List<AggregateConfig> aggregates = new ArrayList<>();

    public SiteLayout toLayout(String configFile) {
        return new SiteLayout(
                layout.getContent(),
                layout.getTemplates(),
                layout.getPartials(),
                layout.getData(),
                layout.getAssets(),
                layout.getOutput(),
                layout.getCache(),
                configFile);
    }

    public List<AggregateDefinition> aggregateDefinitions() {
        List<AggregateDefinition> definitions = new ArrayList<>(aggregates.size());
        for (AggregateConfig aggregate : aggregates) {
            definitions.add(new AggregateDefinition(aggregate.getOutput(), aggregate.getField(), aggregate.getValue(), aggregate.isPerValue()));
        }
        return definitions;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params == null ? new LinkedHashMap<>() : params;
    }

    public LayoutConfig getLayout() {
        return layout;
    }

    public void setLayout(LayoutConfig layout) {
        this.layout = layout == null ? new LayoutConfig() : layout;
    }

    public List<AggregateConfig> getAggregates() {
        return aggregates;
    }

    public void setAggregates(List<AggregateConfig> aggregates) {
        this.aggregates = aggregates == null ? new ArrayList<>() : aggregates;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LayoutConfig {
        private String content = "content";
        private String templates = "templates";
        private String partials = "templates/partials";
        private String data = "data";
        private String assets = "assets";
        private String output = "public";
        private String cache = ".sitecraft";

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }

        public String getTemplates() {
            return templates;
        }

        public void setTemplates(String templates) {
            this.templates = templates;
        }

        public String getPartials() {
            return partials;
        }

        public void setPartials(String partials) {
            this.partials = partials;
        }

        public String getData() {
            return data;
        }

        public void setData(String data) {
            this.data = data;
        }

        public String getAssets() {
            return assets;
        }

        public void setAssets(String assets) {
            this.assets = assets;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public String getCache() {
            return cache;
        }

        public void setCache(String cache) {
            this.cache = cache;
        }
    }

    /**
     * One aggregate declaration. {@code field} unset selects every published page; {@code value} unset
     * selects pages that define the field at all.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AggregateConfig {
        private String output;
        private String field;
        private String value;
        private boolean perValue;

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public boolean isPerValue() {
            return perValue;
        }

        public void setPerValue(boolean perValue) {
            this.perValue = perValue;
        }
    }
}
