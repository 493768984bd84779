package com.sitebuild.groupby.key;

/**
 * Turns arbitrary text into a URL path segment. Supplied by the host.
 */
@FunctionalInterface
public interface Slugifier {

    String slugify(String text);
}
