package com.sitebuild.groupby.exception;

/**
 * Lookup of a group key that the watcher did not produce. Distinguishes
 * "no such group" from a group without children.
 */
public class MissingGroupException extends GroupByException {

    private static final long serialVersionUID = 1L;

    private final String attribute;
    private final String key;

    public MissingGroupException(String attribute, String key) {
        super("No group '" + key + "' for attribute [" + attribute + "]");
        this.attribute = attribute;
        this.key = key;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getKey() {
        return key;
    }
}
