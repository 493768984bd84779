package com.sitebuild.groupby.cache;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects recorded dependencies in first-seen order. Thread-safe.
 */
public class DependencyTracker implements DependencyRecorder {

    private final Set<String> dependencies = Collections.synchronizedSet(new LinkedHashSet<>());

    @Override
    public void recordDependency(String identifier) {
        if (identifier != null && !identifier.isEmpty()) {
            dependencies.add(identifier);
        }
    }

    public boolean contains(String identifier) {
        return dependencies.contains(identifier);
    }

    public Set<String> getDependencies() {
        synchronized (dependencies) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        }
    }

    public void clear() {
        dependencies.clear();
    }
}
