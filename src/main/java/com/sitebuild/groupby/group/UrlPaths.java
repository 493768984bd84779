package com.sitebuild.groupby.group;

import lombok.experimental.UtilityClass;

/**
 * URL path helpers shared by groups and the resolver.
 */
@UtilityClass
public class UrlPaths {
    private static final String INDEX_HTML = "index.html";

    /**
     * Join a record URL with a slug. The slug is always relative to the
     * record; a trailing {@code index.html} is dropped so directory URLs end in a slash.
     */
    public String join(String baseUrl, String slug) {
        String base = baseUrl == null || baseUrl.isEmpty() ? "/" : baseUrl;
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        String rel = slug.startsWith("/") ? slug.substring(1) : slug;
        return normalize(base + rel);
    }

    /**
     * Canonical lookup form: leading slash, no trailing {@code index.html}, no duplicate slashes.
     */
    public String normalize(String url) {
        if (url == null || url.isBlank()) {
            return "/";
        }
        String result = url.trim().replaceAll("/{2,}", "/");
        if (!result.startsWith("/")) {
            result = "/" + result;
        }
        if (result.endsWith("/" + INDEX_HTML)) {
            result = result.substring(0, result.length() - INDEX_HTML.length());
        }
        return result;
    }
}
