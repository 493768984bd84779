package com.sitebuild.groupby.cache;

import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.watcher.Watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of watchers for one build run, keyed by attribute and root.
 * Each watcher carries its own build lock, so different watchers build
 * in parallel. Registration order is kept and decides URL precedence.
 */
public class BuildCache {
    private static final Logger log = LoggerFactory.getLogger(BuildCache.class);

    private final Map<WatcherKey, Watcher> watchers = new ConcurrentHashMap<>();
    private final List<Watcher> ordered = new CopyOnWriteArrayList<>();

    /**
     * Register a watcher. Registering the same attribute and root again with
     * identical settings returns the existing watcher; different settings
     * are a conflict.
     *
     * @throws ConfigException if another watcher with different settings owns the key
     */
    public synchronized Watcher register(Watcher watcher) {
        WatcherKey key = keyOf(watcher);
        Watcher existing = watchers.get(key);
        if (existing != null) {
            if (existing.getConfig().hasSameSettings(watcher.getConfig())) {
                log.debug("Watcher {} already registered with the same settings", key);
                return existing;
            }
            throw new ConfigException(watcher.getAttribute(), "root", watcher.getRoot(),
                    "a watcher with different settings is already registered for " + key);
        }
        watchers.put(key, watcher);
        ordered.add(watcher);
        log.info("Registered watcher {} (slug={}, preBuild={})", key,
                watcher.getConfig().getSlug(), watcher.isPreBuild());
        return watcher;
    }

    public Optional<Watcher> get(WatcherKey key) {
        return Optional.ofNullable(watchers.get(key));
    }

    public Optional<Watcher> get(String attribute, String root) {
        return get(new WatcherKey(attribute, root));
    }

    /**
     * All watchers in registration order.
     */
    public List<Watcher> watchers() {
        return List.copyOf(ordered);
    }

    public List<Watcher> byAttribute(String attribute) {
        List<Watcher> result = new ArrayList<>();
        for (Watcher watcher : ordered) {
            if (watcher.getAttribute().equals(attribute)) {
                result.add(watcher);
            }
        }
        return result;
    }

    /**
     * Position in registration order, or -1 if unknown.
     */
    public int registrationIndex(Watcher watcher) {
        return ordered.indexOf(watcher);
    }

    /**
     * Mark every watcher depending on {@code identifier} stale.
     *
     * @return the watchers that were affected
     */
    public List<Watcher> invalidate(String identifier) {
        List<Watcher> affected = new ArrayList<>();
        for (Watcher watcher : ordered) {
            if (watcher.isAffectedBy(identifier)) {
                watcher.markStale();
                affected.add(watcher);
            }
        }
        if (!affected.isEmpty()) {
            log.debug("Change of {} invalidated {} watcher(s)", identifier, affected.size());
        }
        return affected;
    }

    /**
     * Start a new build run: every cached group set is dropped.
     */
    public void startBuild() {
        ordered.forEach(Watcher::reset);
        log.debug("Reset {} watcher(s) for a new build run", ordered.size());
    }

    public int size() {
        return ordered.size();
    }

    private static WatcherKey keyOf(Watcher watcher) {
        return new WatcherKey(watcher.getAttribute(), watcher.getRoot());
    }
}
