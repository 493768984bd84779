package com.sitebuild.groupby.model;

/**
 * Storage kind of a data model field.
 */
public enum FieldType {
    /**
     * Any single value: string, list of strings, number, boolean, text.
     */
    PLAIN,

    /**
     * Sequence of nested blocks, each typed by a {@link FlowBlockModel}.
     */
    FLOW
}
