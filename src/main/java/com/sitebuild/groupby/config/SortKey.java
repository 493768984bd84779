package com.sitebuild.groupby.config;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One ordering criterion. A leading {@code -} reverses it, a leading {@code +}
 * is accepted and ignored.
 */
public record SortKey(String field, boolean descending) {

    private static final Pattern FIELD = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    public SortKey {
        if (field == null || !FIELD.matcher(field).matches()) {
            throw new IllegalArgumentException("Invalid order-by key: '" + field + "'");
        }
    }

    public static SortKey parse(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Invalid order-by key: null");
        }
        String trimmed = token.trim();
        if (trimmed.startsWith("-")) {
            return new SortKey(trimmed.substring(1), true);
        }
        if (trimmed.startsWith("+")) {
            return new SortKey(trimmed.substring(1), false);
        }
        return new SortKey(trimmed, false);
    }

    /**
     * Parse a comma separated list such as {@code "-date, title"}. Blank input yields an empty list.
     */
    public static List<SortKey> parseList(String text) {
        List<SortKey> keys = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return keys;
        }
        for (String token : text.split(",")) {
            if (!token.isBlank()) {
                keys.add(parse(token));
            }
        }
        return keys;
    }

    @Override
    public String toString() {
        return descending ? "-" + field : field;
    }
}
