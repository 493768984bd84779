package com.sitebuild.groupby.expression;

import java.util.Objects;
import java.util.function.Function;

/**
 * A config value that is either fixed or evaluated against an
 * {@link ExpressionContext} every time it is read.
 */
public interface FieldExpression {

    Object evaluate(ExpressionContext context, ExpressionEvaluator evaluator);

    /**
     * Text shown in error messages.
     */
    String describe();

    static FieldExpression constant(Object value) {
        return new Constant(value);
    }

    static FieldExpression template(String source) {
        return new Template(Objects.requireNonNull(source, "source"));
    }

    static FieldExpression computed(Function<ExpressionContext, Object> function) {
        return new Computed(Objects.requireNonNull(function, "function"));
    }

    /**
     * Strings become templates, anything else is taken as-is.
     */
    static FieldExpression of(Object value) {
        if (value instanceof FieldExpression expression) {
            return expression;
        }
        if (value instanceof String text) {
            return template(text);
        }
        return constant(value);
    }

    record Constant(Object value) implements FieldExpression {
        @Override
        public Object evaluate(ExpressionContext context, ExpressionEvaluator evaluator) {
            return value;
        }

        @Override
        public String describe() {
            return String.valueOf(value);
        }
    }

    record Template(String source) implements FieldExpression {
        @Override
        public Object evaluate(ExpressionContext context, ExpressionEvaluator evaluator) {
            return evaluator.evaluate(source, context);
        }

        @Override
        public String describe() {
            return source;
        }
    }

    record Computed(Function<ExpressionContext, Object> function) implements FieldExpression {
        @Override
        public Object evaluate(ExpressionContext context, ExpressionEvaluator evaluator) {
            return function.apply(context);
        }

        @Override
        public String describe() {
            return "<computed>";
        }
    }
}
