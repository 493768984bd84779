package com.sitebuild.groupby.key;

/**
 * Outcome of key resolution.
 *
 * @param key    slug-safe group identifier, never empty
 * @param keyObj the key object after transform and empty-substitution, before remapping
 */
public record ResolvedKey(String key, Object keyObj) {
}
