package com.sitebuild.groupby.watcher;

import com.sitebuild.groupby.group.ResolvedGroup;

/**
 * Receives the raw keys a grouping callback produces. Each key is resolved
 * right away, so the callback can use the final key (e.g. to rewrite the
 * source text) while the group itself is still being built.
 */
@FunctionalInterface
public interface GroupingSink {

    ResolvedGroup emit(Object rawKey);

    /**
     * Emit a key and attach {@code extra} to the current record's membership.
     */
    default ResolvedGroup emit(Object rawKey, Object extra) {
        return emit(rawKey).attachExtra(extra);
    }
}
