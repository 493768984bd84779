package com.sitebuild.groupby.cache;

/**
 * Hook into the host's dependency tracking, typically the template being
 * rendered. Recorded identifiers invalidate the caller's output when they change.
 */
@FunctionalInterface
public interface DependencyRecorder {

    void recordDependency(String identifier);

    DependencyRecorder NONE = identifier -> { };
}
