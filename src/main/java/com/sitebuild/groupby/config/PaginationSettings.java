package com.sitebuild.groupby.config;

import lombok.Builder;
import lombok.Value;

/**
 * Pagination of a group's children.
 */
@Value
@Builder(toBuilder = true)
public class PaginationSettings {
    public static final int DEFAULT_PER_PAGE = 20;
    public static final String DEFAULT_URL_SUFFIX = "page";

    @Builder.Default
    boolean enabled = false;

    @Builder.Default
    int perPage = DEFAULT_PER_PAGE;

    @Builder.Default
    String urlSuffix = DEFAULT_URL_SUFFIX;

    /**
     * Optional filter expression; only children for which it is truthy are paginated.
     */
    String items;

    public static PaginationSettings disabled() {
        return PaginationSettings.builder().build();
    }

    public static PaginationSettings perPage(int perPage) {
        return PaginationSettings.builder().enabled(true).perPage(perPage).build();
    }
}
