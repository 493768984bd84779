package com.sitebuild.groupby.exception;

/**
 * A grouping callback failed while a watcher was building its groups.
 * Nothing of the failed build is cached.
 */
public class CallbackException extends GroupByException {

    private static final long serialVersionUID = 1L;

    private final String attribute;
    private final String recordPath;

    public CallbackException(String attribute, String recordPath, Throwable cause) {
        super("Grouping callback for [" + attribute + "] failed on record " + recordPath
                + ": " + cause.getMessage(), cause);
        this.attribute = attribute;
        this.recordPath = recordPath;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getRecordPath() {
        return recordPath;
    }
}
