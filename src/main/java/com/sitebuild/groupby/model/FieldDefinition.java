package com.sitebuild.groupby.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Schema entry of a data model or flow block. Options carry the attribute
 * flags a watcher looks for (e.g. {@code tags = true}).
 */
@Value
@Builder
public class FieldDefinition {

    @NonNull
    String name;

    @Builder.Default
    FieldType type = FieldType.PLAIN;

    @Singular
    Map<String, String> options;

    /**
     * Allowed flow block ids for {@link FieldType#FLOW} fields. {@code null} means all.
     */
    List<String> flowBlocks;

    public boolean hasAttribute(String attribute) {
        return isTrue(options.get(attribute));
    }

    public boolean isFlow() {
        return type == FieldType.FLOW;
    }

    public boolean allowsFlowBlock(String blockId) {
        return flowBlocks == null || flowBlocks.contains(blockId);
    }

    static boolean isTrue(String value) {
        if (value == null) {
            return false;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on" -> true;
            default -> false;
        };
    }
}
