package com.sitebuild.groupby.watcher;

public enum WatcherState {
    UNBUILT,
    BUILDING,
    BUILT,
    STALE
}
