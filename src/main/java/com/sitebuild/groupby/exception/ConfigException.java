package com.sitebuild.groupby.exception;

import java.util.List;

/**
 * Malformed watcher configuration. Holds every problem found so they can be
 * reported together; a config with errors is never partially applied.
 */
public class ConfigException extends GroupByException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ConfigException(String key, String field, Object expr, Object error) {
        this(List.of(format(key, field, expr, error)));
    }

    public ConfigException(String key, String field, Object expr, Throwable cause) {
        super(format(key, field, expr, cause.getMessage()), cause);
        this.errors = List.of(getMessage());
    }

    public ConfigException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    public static String format(String key, String field, Object expr, Object error) {
        return String.format("Invalid config for [%s.%s] = \"%s\" - Error: %s", key, field, expr, error);
    }
}
