package com.sitecraft.graph;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Membership rule of a virtual aggregate. A null {@code field} matches every published page (sitemap);
 * a null {@code value} matches every page that carries the field (menu); otherwise the page must carry
 * the value (tag index). With {@code bySlug} set, any value with the same slug as {@code value} matches,
 * so {@code Python} and {@code python} share one tag page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatePredicate(String field, String value, boolean bySlug) {

    public AggregatePredicate(String field, String value) {
        this(field, value, false);
    }

    public static AggregatePredicate allPages() {
        return new AggregatePredicate(null, null);
    }

    public boolean matches(PageMetadata page) {
        if (page.draft()) {
            return false;
        }
        if (field == null) {
            return true;
        }
        if (value == null) {
            return !page.values(field).isEmpty();
        }
        if (!bySlug) {
            return page.values(field).contains(value);
        }
        String wanted = slug(value);
        for (String candidate : page.values(field)) {
            if (slug(candidate).equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    public String describe() {
        if (field == null) {
            return "all";
        }
        if (value == null) {
            return field + "=*";
        }
        return bySlug ? field + "~" + slug(value) : field + "=" + value;
    }

    /**
     * Lower-case, dash-separated form of a field value used in output ids.
     */
    public static String slug(String value) {
        String slug = value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("(^-+)|(-+$)", "");
        return slug.isEmpty() ? "_" : slug;
    }
}
