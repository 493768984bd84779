package com.sitebuild.groupby.watcher;

import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.exception.MissingGroupException;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.GroupSet;
import com.sitebuild.groupby.model.ContentRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Binds one attribute below one root to a config and a grouping callback,
 * and owns the cached result of the last build.
 *
 * Builds happen on first access and at most once at a time: concurrent
 * readers of an unbuilt or stale watcher wait on the build lock and then
 * get the fresh result. Readers never see a partially built set.
 */
public class Watcher {
    private static final Logger log = LoggerFactory.getLogger(Watcher.class);

    private final GroupByConfig config;
    private final boolean preBuild;
    private final GroupAggregator aggregator;

    private final ReentrantLock buildLock = new ReentrantLock();
    private final Object stateMonitor = new Object();
    private final AtomicInteger buildCount = new AtomicInteger();

    private volatile WatcherState state = WatcherState.UNBUILT;
    private volatile GroupSet current = GroupSet.empty();
    private volatile GroupingCallback callback;
    private volatile boolean flatten = true;
    private boolean changedWhileBuilding;

    public Watcher(GroupByConfig config, boolean preBuild, GroupAggregator aggregator) {
        this.config = Objects.requireNonNull(config, "config");
        this.preBuild = preBuild;
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        config.onChange(this::markStale);
    }

    /**
     * Set the callback that turns field occurrences into keys.
     *
     * @param flatten process flow blocks one by one ({@code true}) or the
     *                whole flow field as one occurrence
     */
    public Watcher setGrouping(GroupingCallback callback, boolean flatten) {
        this.callback = Objects.requireNonNull(callback, "callback");
        this.flatten = flatten;
        markStale();
        return this;
    }

    public Watcher setGrouping(GroupingCallback callback) {
        return setGrouping(callback, true);
    }

    /**
     * Add identifiers (e.g. template or config files) whose change invalidates this watcher.
     */
    public Watcher dependsOn(String... identifiers) {
        for (String identifier : identifiers) {
            config.addDependency(identifier);
        }
        return this;
    }

    /**
     * Current groups, building them first if needed. A disabled watcher is
     * always empty and never scans.
     */
    public GroupSet groups() {
        if (!config.isEnabled()) {
            return GroupSet.empty();
        }
        if (state == WatcherState.BUILT) {
            return current;
        }
        if (buildLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Groups of [" + config.getAttribute() + "] accessed while building them");
        }
        buildLock.lock();
        try {
            if (state == WatcherState.BUILT) {
                return current;
            }
            return build();
        } finally {
            buildLock.unlock();
        }
    }

    private GroupSet build() {
        GroupingCallback cb = callback;
        if (cb == null) {
            throw new ConfigException(config.getAttribute(), "grouping", null, "no grouping callback set");
        }
        WatcherState previous;
        synchronized (stateMonitor) {
            previous = state;
            state = WatcherState.BUILDING;
            changedWhileBuilding = false;
        }
        try {
            GroupSet result = aggregator.build(config, cb, flatten);
            buildCount.incrementAndGet();
            current = result;
            synchronized (stateMonitor) {
                state = changedWhileBuilding ? WatcherState.STALE : WatcherState.BUILT;
            }
            return result;
        } catch (RuntimeException e) {
            synchronized (stateMonitor) {
                state = previous;
            }
            log.warn("Build of [{}] under {} failed: {}", config.getAttribute(), config.getRoot(), e.getMessage());
            throw e;
        }
    }

    /**
     * Look up a group by key, or by the key of a group merged into it.
     *
     * @throws MissingGroupException if no such group exists
     */
    public GroupBySource getGroup(String key) {
        return findGroup(key).orElseThrow(() -> new MissingGroupException(config.getAttribute(), key));
    }

    public Optional<GroupBySource> findGroup(String key) {
        return groups().find(key);
    }

    /**
     * Discard the cached groups on next access. Calls during a build make
     * that build's result stale as soon as it completes.
     */
    public void markStale() {
        synchronized (stateMonitor) {
            switch (state) {
                case BUILT -> {
                    state = WatcherState.STALE;
                    log.debug("Watcher [{}] under {} is stale", config.getAttribute(), config.getRoot());
                }
                case BUILDING -> changedWhileBuilding = true;
                default -> {
                    // nothing cached yet
                }
            }
        }
    }

    /**
     * Forget the cached groups entirely, as at the start of a new build run.
     */
    public void reset() {
        buildLock.lock();
        try {
            synchronized (stateMonitor) {
                state = WatcherState.UNBUILT;
                current = GroupSet.empty();
            }
        } finally {
            buildLock.unlock();
        }
    }

    /**
     * Whether a change of {@code identifier} must invalidate this watcher:
     * a dependency of the last build, a declared dependency, or a record path
     * below the root (which covers records added since the last build).
     */
    public boolean isAffectedBy(String identifier) {
        if (identifier == null) {
            return false;
        }
        if (current.dependencies().contains(identifier) || config.getDependencies().contains(identifier)) {
            return true;
        }
        return identifier.startsWith("/") && ContentRecord.isUnder(identifier, config.getRoot());
    }

    public WatcherState state() {
        return state;
    }

    public GroupByConfig getConfig() {
        return config;
    }

    public String getAttribute() {
        return config.getAttribute();
    }

    public String getRoot() {
        return config.getRoot();
    }

    public boolean isPreBuild() {
        return preBuild;
    }

    public boolean isFlatten() {
        return flatten;
    }

    public GroupingCallback getCallback() {
        return callback;
    }

    /**
     * Number of completed builds since creation.
     */
    public int getBuildCount() {
        return buildCount.get();
    }

    @Override
    public String toString() {
        return "<Watcher attribute=\"" + config.getAttribute() + "\" root=\"" + config.getRoot()
                + "\" state=" + state + ">";
    }
}
