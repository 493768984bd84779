package com.sitebuild.groupby.group;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of one watcher build.
 *
 * Groups keep the order in which their key was first seen. Keys of groups
 * merged because of a slug collision stay resolvable as aliases.
 */
public final class GroupSet {
    private static final GroupSet EMPTY = new GroupSet(Map.of(), Map.of(), Set.of());

    private final Map<String, GroupBySource> byKey;
    private final List<GroupBySource> groups;
    private final Map<String, List<GroupBySource>> byRecordPath;
    private final Set<String> dependencies;

    private GroupSet(Map<String, GroupBySource> byKey, Map<String, List<GroupBySource>> byRecordPath,
                     Set<String> dependencies) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
        this.groups = List.copyOf(new LinkedHashSet<>(byKey.values()));
        Map<String, List<GroupBySource>> reverse = new LinkedHashMap<>();
        byRecordPath.forEach((path, list) -> reverse.put(path, List.copyOf(list)));
        this.byRecordPath = Collections.unmodifiableMap(reverse);
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public static GroupSet empty() {
        return EMPTY;
    }

    /**
     * @param byKey        every key, aliases included, mapped to its finished group
     * @param byRecordPath record path mapped to the groups the record belongs to
     * @param dependencies identifiers whose change invalidates this set
     */
    public static GroupSet of(Map<String, GroupBySource> byKey, Map<String, List<GroupBySource>> byRecordPath,
                              Set<String> dependencies) {
        return new GroupSet(byKey, byRecordPath, dependencies);
    }

    public List<GroupBySource> groups() {
        return groups;
    }

    public Optional<GroupBySource> find(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public boolean contains(String key) {
        return byKey.containsKey(key);
    }

    public Set<String> keys() {
        return byKey.keySet();
    }

    /**
     * Groups a record belongs to, in group order.
     */
    public List<GroupBySource> groupsOf(String recordPath) {
        return byRecordPath.getOrDefault(recordPath, List.of());
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
