package com.sitebuild.groupby.expression;

/**
 * Evaluates the string expressions found in configs (slugs, fields, key
 * transforms). Hosts plug in their template engine here.
 */
@FunctionalInterface
public interface ExpressionEvaluator {

    /**
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    Object evaluate(String expression, ExpressionContext context);
}
