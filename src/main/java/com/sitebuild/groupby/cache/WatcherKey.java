package com.sitebuild.groupby.cache;

import com.sitebuild.groupby.model.ContentRecord;

/**
 * Identity of a watcher: one attribute below one root.
 */
public record WatcherKey(String attribute, String root) {

    public WatcherKey {
        root = ContentRecord.normalizePath(root);
    }

    @Override
    public String toString() {
        return attribute + "@" + root;
    }
}
