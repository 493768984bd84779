package com.sitebuild.groupby.exception;

/**
 * A grouping callback produced a key object that has no usable string form.
 */
public class InvalidYieldException extends GroupByException {

    private static final long serialVersionUID = 1L;

    private final transient Object value;

    public InvalidYieldException(String attribute, Object value) {
        super("Unsupported groupby yield for [" + attribute + "]: "
                + (value == null ? "null" : value.getClass().getName() + " " + value));
        this.value = value;
    }

    public Object getValue() {
        return value;
    }
}
