package com.sitebuild.groupby.expression;

/**
 * Objects exposing named properties to expressions.
 */
public interface PropertySource {

    /**
     * @return the property value, or {@code null} if it is not defined
     */
    Object getProperty(String name);
}
