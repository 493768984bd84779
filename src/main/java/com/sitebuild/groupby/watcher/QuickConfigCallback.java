package com.sitebuild.groupby.watcher;

import com.sitebuild.groupby.scan.FieldOccurrence;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default callback for watchers declared only in the config file.
 *
 * - non-empty text: split by the configured delimiter (parts stripped) or used whole
 * - booleans and numbers: used as-is
 * - lists: one key per element
 * - empty or absent values: a single {@code null} key, which resolves to the none key
 */
public class QuickConfigCallback implements GroupingCallback {

    private final String split;

    public QuickConfigCallback(String split) {
        this.split = split == null || split.isEmpty() ? null : split;
    }

    @Override
    public void group(FieldOccurrence occurrence, GroupingSink sink) {
        Object value = occurrence.field();
        if (value instanceof CharSequence text && text.length() > 0) {
            if (split == null) {
                sink.emit(text.toString());
            } else {
                for (String part : text.toString().split(Pattern.quote(split), -1)) {
                    sink.emit(part.strip());
                }
            }
        } else if (value instanceof Boolean || value instanceof Number) {
            sink.emit(value);
        } else if (isEmpty(value)) {
            sink.emit(null);
        } else if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                sink.emit(item);
            }
        }
    }

    private static boolean isEmpty(Object value) {
        return value == null
                || (value instanceof CharSequence text && text.length() == 0)
                || (value instanceof Collection<?> c && c.isEmpty())
                || (value instanceof Map<?, ?> m && m.isEmpty());
    }

    public String getSplit() {
        return split;
    }
}
