package com.sitebuild.groupby.query;

import com.sitebuild.groupby.cache.BuildCache;
import com.sitebuild.groupby.cache.DependencyRecorder;
import com.sitebuild.groupby.config.SortKey;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.GroupChild;
import com.sitebuild.groupby.group.RecordOrdering;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.watcher.Watcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Collects the groups that records at or below a parent record belong to.
 *
 * Records are visited breadth-first starting with the parent. Groups come
 * out in first-seen order, each at most once, unless an order is given.
 * Every visited record and every watcher's config dependencies are
 * reported to the dependency recorder.
 *
 * <pre>
 * engine.query(blog).keys("tags").recursive(true).orderBy("key").list();
 * </pre>
 */
public class GroupQuery {

    private final BuildCache cache;
    private final ContentRecord parent;

    private Set<String> keys;
    private Set<String> fields;
    private Set<String> flows;
    private boolean recursive;
    private List<SortKey> orderBy = List.of();
    private DependencyRecorder recorder = DependencyRecorder.NONE;

    public GroupQuery(BuildCache cache, ContentRecord parent) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    /**
     * Restrict to these attributes. Without a call every watched attribute counts.
     */
    public GroupQuery keys(String... attributes) {
        this.keys = toSet(attributes);
        return this;
    }

    /**
     * Only count occurrences found in one of these record fields.
     */
    public GroupQuery fields(String... fieldKeys) {
        this.fields = toSet(fieldKeys);
        return this;
    }

    /**
     * Only count occurrences found in one of these flow block fields.
     */
    public GroupQuery flows(String... flowKeys) {
        this.flows = toSet(flowKeys);
        return this;
    }

    public GroupQuery recursive(boolean recursive) {
        this.recursive = recursive;
        return this;
    }

    /**
     * Sort by group properties, e.g. {@code "key"} or {@code "-count"}.
     */
    public GroupQuery orderBy(String... sortKeys) {
        List<SortKey> parsed = new ArrayList<>();
        for (String key : sortKeys) {
            parsed.add(SortKey.parse(key));
        }
        this.orderBy = List.copyOf(parsed);
        return this;
    }

    public GroupQuery recordingTo(DependencyRecorder recorder) {
        this.recorder = recorder == null ? DependencyRecorder.NONE : recorder;
        return this;
    }

    public List<GroupBySource> list() {
        List<Watcher> watchers = new ArrayList<>();
        for (Watcher watcher : cache.watchers()) {
            if (keys == null || keys.contains(watcher.getAttribute())) {
                watchers.add(watcher);
                watcher.getConfig().getDependencies().forEach(recorder::recordDependency);
            }
        }

        Set<GroupBySource> result = new LinkedHashSet<>();
        Deque<ContentRecord> queue = new ArrayDeque<>();
        queue.add(parent);
        while (!queue.isEmpty()) {
            ContentRecord record = queue.poll();
            if (recursive) {
                queue.addAll(record.getChildren());
            }
            recorder.recordDependency(record.getPath());
            record.getSourceFiles().forEach(recorder::recordDependency);
            for (Watcher watcher : watchers) {
                if (!record.isUnder(watcher.getRoot())) {
                    continue;
                }
                for (GroupBySource group : watcher.groups().groupsOf(record.getPath())) {
                    if (matches(group, record)) {
                        result.add(group);
                    }
                }
            }
        }

        List<GroupBySource> groups = new ArrayList<>(result);
        if (!orderBy.isEmpty()) {
            groups.sort(RecordOrdering.<GroupBySource>of(orderBy, GroupBySource::getProperty));
        }
        return groups;
    }

    public Stream<GroupBySource> stream() {
        return list().stream();
    }

    private boolean matches(GroupBySource group, ContentRecord record) {
        if (fields == null && flows == null) {
            return true;
        }
        return group.getChild(record)
                .map(this::matchesFilters)
                .orElse(false);
    }

    private boolean matchesFilters(GroupChild child) {
        boolean fieldOk = fields == null || fields.stream().anyMatch(child::matchesField);
        boolean flowOk = flows == null || flows.stream().anyMatch(child::matchesFlowKey);
        return fieldOk && flowOk;
    }

    private static Set<String> toSet(String... values) {
        if (values == null || values.length == 0) {
            return null;
        }
        return new LinkedHashSet<>(Arrays.asList(values));
    }
}
