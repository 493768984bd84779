package com.sitebuild.groupby.watcher;

import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.exception.CallbackException;
import com.sitebuild.groupby.exception.GroupByException;
import com.sitebuild.groupby.expression.ExpressionEvaluator;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.GroupChild;
import com.sitebuild.groupby.group.GroupSet;
import com.sitebuild.groupby.group.ResolvedGroup;
import com.sitebuild.groupby.key.KeyResolver;
import com.sitebuild.groupby.key.ResolvedKey;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.scan.FieldOccurrence;
import com.sitebuild.groupby.scan.RecordScanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Runs one full build for a watcher: scan, call back, resolve keys and
 * accumulate children, then assign slugs, merge slug collisions, sort,
 * paginate and freeze.
 */
public class GroupAggregator {
    private static final Logger log = LoggerFactory.getLogger(GroupAggregator.class);

    private final ContentTree tree;
    private final RecordScanner scanner;
    private final KeyResolver keyResolver;
    private final ExpressionEvaluator evaluator;

    public GroupAggregator(ContentTree tree, KeyResolver keyResolver, ExpressionEvaluator evaluator) {
        this.tree = tree;
        this.scanner = new RecordScanner(tree);
        this.keyResolver = keyResolver;
        this.evaluator = evaluator;
    }

    public GroupSet build(GroupByConfig config, GroupingCallback callback, boolean flatten) {
        long start = System.currentTimeMillis();
        String attribute = config.getAttribute();
        log.info("Building groups for [{}] under {}", attribute, config.getRoot());

        Set<String> dependencies = new LinkedHashSet<>(config.getDependencies());
        Optional<ContentRecord> root = tree.get(config.getRoot());
        if (root.isEmpty()) {
            log.info("Built 0 group(s) for [{}]: root {} not found", attribute, config.getRoot());
            return GroupSet.of(Map.of(), Map.of(), dependencies);
        }
        try (Stream<ContentRecord> records = scanner.records(config.getRoot())) {
            records.forEach(record -> {
                dependencies.add(record.getPath());
                dependencies.addAll(record.getSourceFiles());
            });
        }

        Map<String, GroupBySource> byKey = new LinkedHashMap<>();
        try (Stream<FieldOccurrence> occurrences = scanner.scan(config.getRoot(), attribute, flatten)) {
            Iterator<FieldOccurrence> it = occurrences.iterator();
            while (it.hasNext()) {
                FieldOccurrence occurrence = it.next();
                GroupingSink sink = rawKey -> accumulate(byKey, config, root.get(), occurrence, rawKey);
                invoke(callback, occurrence, sink, attribute);
            }
        }

        Map<String, GroupBySource> finalKeys = mergeBySlug(byKey, attribute);
        Map<String, List<GroupBySource>> byRecordPath = new LinkedHashMap<>();
        for (GroupBySource group : new LinkedHashSet<>(finalKeys.values())) {
            group.sortChildren(config.getOrderBy());
            group.finish();
            for (GroupChild child : group.getChildren()) {
                byRecordPath.computeIfAbsent(child.getRecord().getPath(), p -> new ArrayList<>()).add(group);
            }
        }

        GroupSet result = GroupSet.of(finalKeys, byRecordPath, dependencies);
        log.info("Built {} group(s) for [{}] under {} in {} ms",
                result.size(), attribute, config.getRoot(), System.currentTimeMillis() - start);
        return result;
    }

    private ResolvedGroup accumulate(Map<String, GroupBySource> byKey, GroupByConfig config, ContentRecord root,
                                     FieldOccurrence occurrence, Object rawKey) {
        ResolvedKey resolved = keyResolver.resolve(rawKey, occurrence, config);
        GroupBySource group = byKey.computeIfAbsent(resolved.key(),
                key -> new GroupBySource(config, root, key, resolved.keyObj(), evaluator));
        GroupChild child = group.addOccurrence(occurrence.record(), rawKey, occurrence.key());
        return new ResolvedGroup(group, child);
    }

    private static void invoke(GroupingCallback callback, FieldOccurrence occurrence, GroupingSink sink,
                               String attribute) {
        try {
            callback.group(occurrence, sink);
        } catch (GroupByException e) {
            throw e;
        } catch (Exception e) {
            throw new CallbackException(attribute, occurrence.record().getPath(), e);
        }
    }

    /**
     * Compute slugs and fold groups sharing a slug into the first one seen.
     * The merged keys stay resolvable as aliases of the surviving group.
     */
    private static Map<String, GroupBySource> mergeBySlug(Map<String, GroupBySource> byKey, String attribute) {
        Map<String, GroupBySource> bySlug = new LinkedHashMap<>();
        Map<String, GroupBySource> result = new LinkedHashMap<>();
        for (GroupBySource group : byKey.values()) {
            String slug = group.computeSlug();
            GroupBySource owner = slug == null ? null : bySlug.putIfAbsent(slug, group);
            if (owner == null) {
                result.put(group.getKey(), group);
                continue;
            }
            log.warn("Groups '{}' and '{}' of [{}] share slug {}; merging into '{}'",
                    owner.getKey(), group.getKey(), attribute, slug, owner.getKey());
            owner.mergeFrom(group);
            result.put(group.getKey(), owner);
        }
        return result;
    }
}
