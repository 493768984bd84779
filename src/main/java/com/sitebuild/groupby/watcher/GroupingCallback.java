package com.sitebuild.groupby.watcher;

import com.sitebuild.groupby.scan.FieldOccurrence;

/**
 * User code that decides which groups a field occurrence belongs to.
 * Emitting nothing means the occurrence joins no group. Runs on one thread
 * per watcher build.
 */
@FunctionalInterface
public interface GroupingCallback {

    void group(FieldOccurrence occurrence, GroupingSink sink) throws Exception;

}
