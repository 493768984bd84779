package com.sitebuild.groupby.group;

import com.sitebuild.groupby.config.SortKey;
import com.sitebuild.groupby.model.ContentRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable, chainable view over the records of a group.
 */
public final class ChildQuery {

    private final List<GroupChild> source;
    private final Predicate<ContentRecord> filter;
    private final List<SortKey> orderBy;
    private final int offset;
    private final Integer limit;

    ChildQuery(List<GroupChild> source) {
        this(source, record -> true, List.of(), 0, null);
    }

    private ChildQuery(List<GroupChild> source, Predicate<ContentRecord> filter,
                       List<SortKey> orderBy, int offset, Integer limit) {
        this.source = source;
        this.filter = filter;
        this.orderBy = orderBy;
        this.offset = offset;
        this.limit = limit;
    }

    public ChildQuery filter(Predicate<ContentRecord> predicate) {
        return new ChildQuery(source, filter.and(predicate), orderBy, offset, limit);
    }

    /**
     * Re-order by record fields; {@code "-date"} sorts descending.
     */
    public ChildQuery orderBy(String... keys) {
        List<SortKey> parsed = new ArrayList<>();
        Arrays.stream(keys).map(SortKey::parse).forEach(parsed::add);
        return new ChildQuery(source, filter, parsed, offset, limit);
    }

    public ChildQuery offset(int offset) {
        return new ChildQuery(source, filter, orderBy, Math.max(0, offset), limit);
    }

    public ChildQuery limit(int limit) {
        return new ChildQuery(source, filter, orderBy, offset, Math.max(0, limit));
    }

    public Stream<GroupChild> childStream() {
        Stream<GroupChild> stream = source.stream().filter(child -> filter.test(child.getRecord()));
        if (!orderBy.isEmpty()) {
            stream = stream.sorted((a, b) -> RecordOrdering.records(orderBy).compare(a.getRecord(), b.getRecord()));
        }
        stream = stream.skip(offset);
        if (limit != null) {
            stream = stream.limit(limit);
        }
        return stream;
    }

    public Stream<ContentRecord> stream() {
        return childStream().map(GroupChild::getRecord);
    }

    public List<ContentRecord> all() {
        return stream().toList();
    }

    public List<GroupChild> children() {
        return childStream().toList();
    }

    public Optional<ContentRecord> first() {
        return stream().findFirst();
    }

    public Optional<ContentRecord> get(String path) {
        String normalized = ContentRecord.normalizePath(path);
        return stream().filter(record -> record.getPath().equals(normalized)).findFirst();
    }

    public int count() {
        return (int) childStream().count();
    }

    /**
     * Number of records in the group, ignoring filters and limits.
     */
    public int total() {
        return source.size();
    }

    public boolean isEmpty() {
        return count() == 0;
    }
}
