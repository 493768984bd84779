package com.sitebuild.groupby.expression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Variables visible to an expression. The engine always provides
 * {@code this}, {@code record} and {@code config}; key transforms also get
 * {@code X} (the raw key object) and {@code args} (the field occurrence).
 */
@Value
@Builder(toBuilder = true)
public class ExpressionContext {
    public static final String THIS = "this";
    public static final String RECORD = "record";
    public static final String CONFIG = "config";

    @Singular
    Map<String, Object> variables;

    public boolean has(String name) {
        return variables.containsKey(name);
    }

    public Object lookup(String name) {
        return variables.get(name);
    }

    public static ExpressionContext of(Object self, Object record, Object config) {
        ExpressionContextBuilder builder = ExpressionContext.builder();
        putIfPresent(builder, THIS, self);
        putIfPresent(builder, RECORD, record);
        putIfPresent(builder, CONFIG, config);
        return builder.build();
    }

    private static void putIfPresent(ExpressionContextBuilder builder, String name, Object value) {
        if (value != null) {
            builder.variable(name, value);
        }
    }
}
