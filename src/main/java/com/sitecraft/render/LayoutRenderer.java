package com.sitecraft.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sitecraft.cache.OutputKind;
import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.SiteLayout;
import com.sitecraft.source.SourceArtifact;

/**
 * Minimal placeholder-substitution renderer used by the command line driver. Pages are merged into
 * {@code templates/<layout>.html}; aggregates into {@code templates/aggregate.html} when present, and
 * {@code .xml} aggregates are written as sitemaps.
 * <p>
 * Supported placeholders: {@code {{title}}}, {@code {{site}}}, {@code {{content}}},
 * {@code {{partial:name}}}, {@code {{data:file}}}, {@code {{aggregate:output}}}, {@code {{link:page}}} and
 * {@code {{param:key}}}.
 */
public class LayoutRenderer implements Renderer {
    public static final String DEFAULT_LAYOUT = "page";
    public static final String AGGREGATE_LAYOUT = "aggregate";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-z]+)(?::([^}\\s]+))?\\s*}}");

    @Override
    public RenderResult render(RenderTarget target, RenderContext context) throws RenderException {
        if (target.kind() == OutputKind.AGGREGATE) {
            return renderAggregate(target, context);
        }
        if (target.kind() == OutputKind.PAGE) {
            return renderPage(target, context);
        }
        throw new RenderException("Unsupported output kind " + target.kind() + " for " + target.outputId());
    }

    private RenderResult renderPage(RenderTarget target, RenderContext context) throws RenderException {
        SourceArtifact source = target.source();
        FrontMatter frontMatter = FrontMatter.parse(read(context, source.id()));
        PageMetadata page = context.page(source.id())
                .orElseThrow(() -> new RenderException("No metadata for " + source.id()));
        String layoutName = page.layout() == null || page.layout().isBlank() ? DEFAULT_LAYOUT : page.layout();
        String templateId = context.layout().templateId(layoutName);
        if (!context.exists(templateId)) {
            throw new RenderException("Missing template " + templateId + " for " + source.id());
        }
        String html = expand(read(context, templateId), page.title(), frontMatter.body(), context);
        return new RenderResult(html.getBytes(StandardCharsets.UTF_8), new ArrayList<>(context.consulted()));
    }

    private RenderResult renderAggregate(RenderTarget target, RenderContext context) throws RenderException {
        if (target.outputId().endsWith(".xml")) {
            return new RenderResult(sitemap(target, context).getBytes(StandardCharsets.UTF_8), List.of());
        }
        String list = memberList(target.members(), context);
        String title = target.membership().predicate().value() != null
                ? target.membership().predicate().value()
                : target.outputId();
        String templateId = context.layout().templateId(AGGREGATE_LAYOUT);
        String html = context.exists(templateId)
                ? expand(read(context, templateId), escape(title), list, context)
                : "<h1>" + escape(title) + "</h1>\n" + list;
        return new RenderResult(html.getBytes(StandardCharsets.UTF_8), new ArrayList<>(context.consulted()));
    }

    private String expand(String template, String title, String body, RenderContext context) throws RenderException {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + body.length());
        while (matcher.find()) {
            String replacement = resolve(matcher.group(1), matcher.group(2), title, body, context);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String resolve(String name, String argument, String title, String body, RenderContext context) throws RenderException {
        SiteLayout layout = context.layout();
        switch (name) {
            case "title":
                return escape(title);
            case "site":
                return escape(context.siteTitle());
            case "content":
                return body;
            case "partial":
                return partial(layout.partialId(require(name, argument)), context);
            case "data":
                return read(context, layout.dataId(require(name, argument))).trim();
            case "aggregate":
                return memberList(context.members(require(name, argument)), context);
            case "link":
                String contentId = layout.contentDir() + "/" + require(name, argument);
                return context.exists(contentId) ? "/" + layout.pageOutputId(contentId) : "#missing:" + argument;
            case "param":
                Object value = context.params().get(require(name, argument));
                return value == null ? "" : escape(String.valueOf(value));
            default:
                throw new RenderException("Unknown placeholder {{" + name + "}}");
        }
    }

    private String partial(String partialId, RenderContext context) throws RenderException {
        Optional<SourceArtifact> partial = context.source(partialId);
        if (partial.isEmpty()) {
            throw new RenderException("Missing partial " + partialId);
        }
        return context.fragments().computeIfAbsent("partial:" + partial.get().hash(), () -> read(context, partialId));
    }

    private String memberList(List<String> members, RenderContext context) {
        StringBuilder list = new StringBuilder("<ul>\n");
        for (String member : members) {
            String title = context.page(member).map(PageMetadata::title).orElse(member);
            list.append("  <li><a href=\"/")
                    .append(context.layout().pageOutputId(member))
                    .append("\">")
                    .append(escape(title))
                    .append("</a></li>\n");
        }
        return list.append("</ul>").toString();
    }

    private String sitemap(RenderTarget target, RenderContext context) {
        String base = context.baseUrl() == null ? "" : context.baseUrl().replaceAll("/+$", "");
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n");
        for (String member : target.members()) {
            xml.append("  <url><loc>")
                    .append(escape(base + "/" + context.layout().pageOutputId(member)))
                    .append("</loc></url>\n");
        }
        return xml.append("</urlset>\n").toString();
    }

    private static String read(RenderContext context, String sourceId) throws RenderException {
        try {
            return new String(context.read(sourceId), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RenderException("Unable to read " + sourceId + ": " + e.getMessage(), e);
        }
    }

    private static String require(String name, String argument) throws RenderException {
        if (argument == null || argument.isBlank()) {
            throw new RenderException("Placeholder {{" + name + "}} needs an argument");
        }
        return argument;
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
