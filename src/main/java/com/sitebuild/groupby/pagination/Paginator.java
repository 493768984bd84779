package com.sitebuild.groupby.pagination;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Page splitting and page URL rules.
 *
 * URL rule for page N >= 2:
 * - slug ending in "/" or "/index.html": {@code <dir>/<suffix>/N/index.html}
 * - slug with a file extension: {@code <stem><suffix>N.<ext>}
 * - any other slug is treated as a directory
 */
@UtilityClass
public class Paginator {
    private static final String INDEX_HTML = "index.html";

    public int pageCount(int total, int perPage) {
        if (perPage <= 0) {
            throw new IllegalArgumentException("perPage must be > 0, got " + perPage);
        }
        if (total <= 0) {
            return 1;
        }
        return (total + perPage - 1) / perPage;
    }

    /**
     * Split {@code items} into consecutive pages. Always returns at least one (possibly empty) page.
     */
    public <T> List<List<T>> split(List<T> items, int perPage) {
        int pages = pageCount(items.size(), perPage);
        List<List<T>> result = new ArrayList<>(pages);
        for (int page = 0; page < pages; page++) {
            int from = page * perPage;
            int to = Math.min(items.size(), from + perPage);
            result.add(List.copyOf(items.subList(Math.min(from, items.size()), to)));
        }
        return result;
    }

    public String pageSlug(String slug, int pageNum, String urlSuffix) {
        if (slug == null || pageNum <= 1) {
            return slug;
        }
        if (slug.endsWith("/" + INDEX_HTML) || slug.equals(INDEX_HTML)) {
            String dir = slug.substring(0, slug.length() - INDEX_HTML.length());
            return dir + urlSuffix + "/" + pageNum + "/" + INDEX_HTML;
        }
        if (slug.endsWith("/")) {
            return slug + urlSuffix + "/" + pageNum + "/" + INDEX_HTML;
        }
        int lastSlash = slug.lastIndexOf('/');
        int lastDot = slug.lastIndexOf('.');
        if (lastDot > lastSlash + 1) {
            return slug.substring(0, lastDot) + urlSuffix + pageNum + slug.substring(lastDot);
        }
        return slug + "/" + urlSuffix + "/" + pageNum + "/" + INDEX_HTML;
    }
}
