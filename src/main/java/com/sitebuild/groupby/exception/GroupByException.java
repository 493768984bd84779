package com.sitebuild.groupby.exception;

/**
 * Base type for every failure raised by the grouping engine.
 */
public class GroupByException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GroupByException(String message) {
        super(message);
    }

    public GroupByException(String message, Throwable cause) {
        super(message, cause);
    }
}
