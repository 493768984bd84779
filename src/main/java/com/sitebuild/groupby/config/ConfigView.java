package com.sitebuild.groupby.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot of a {@link GroupByConfig}, handed to templates as {@code this.config}.
 */
@Value
@Builder
public class ConfigView {
    String attribute;
    String root;
    String slug;
    String template;
    String split;
    String replaceNoneKey;
    boolean enabled;

    @Singular
    Set<String> dependencies;

    @Singular
    Set<String> fieldNames;

    @Singular("keyMapEntry")
    Map<String, String> keyMap;

    PaginationSettings pagination;

    @Singular("orderByKey")
    List<SortKey> orderBy;

    /**
     * Same as {@link #getAttribute()}; templates address the config by its key.
     */
    public String getKey() {
        return attribute;
    }
}
