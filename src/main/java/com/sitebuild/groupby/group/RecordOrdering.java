package com.sitebuild.groupby.group;

import com.sitebuild.groupby.config.SortKey;
import com.sitebuild.groupby.model.ContentRecord;

import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Comparators for order-by specs. Missing values sort last in both
 * directions; mixed types fall back to comparing string forms.
 */
public final class RecordOrdering {

    private RecordOrdering() {
        // Utility class
    }

    public static Comparator<ContentRecord> records(List<SortKey> keys) {
        return of(keys, RecordOrdering::recordValue);
    }

    /**
     * Build a comparator reading each sort key through {@code accessor}.
     * An empty key list compares everything as equal, so a stable sort keeps the current order.
     */
    public static <T> Comparator<T> of(List<SortKey> keys, BiFunction<T, String, Object> accessor) {
        Comparator<T> comparator = (a, b) -> 0;
        for (SortKey key : keys) {
            comparator = comparator.thenComparing((a, b) ->
                    compareValues(accessor.apply(a, key.field()), accessor.apply(b, key.field()), key.descending()));
        }
        return comparator;
    }

    static Object recordValue(ContentRecord record, String field) {
        return record.getProperty(field);
    }

    @SuppressWarnings("unchecked")
    static int compareValues(Object a, Object b, boolean descending) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        int result;
        if (a instanceof Number x && b instanceof Number y) {
            result = Double.compare(x.doubleValue(), y.doubleValue());
        } else if (a instanceof Comparable<?> && a.getClass().isInstance(b)) {
            result = ((Comparable<Object>) a).compareTo(b);
        } else {
            result = String.valueOf(a).compareTo(String.valueOf(b));
        }
        return descending ? -result : result;
    }
}
