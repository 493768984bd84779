package com.sitebuild.groupby.key;

import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.exception.InvalidYieldException;
import com.sitebuild.groupby.expression.ExpressionContext;
import com.sitebuild.groupby.expression.ExpressionEvaluator;
import com.sitebuild.groupby.scan.FieldOccurrence;

import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a raw key object yielded by a grouping callback into the final group key.
 *
 * Steps, in order:
 * 1. key_obj_fn transform (with the raw object as {@code X} and the occurrence as {@code args})
 * 2. empty/null substitution with replace_none_key, or {@link #DEFAULT_NONE_KEY}
 * 3. key_map lookup of the string form
 * 4. slugify
 *
 * Stateless; safe to share between watchers. Hosts whose callbacks yield
 * their own value types register them as key types.
 */
public class KeyResolver {
    public static final String DEFAULT_NONE_KEY = "none";

    private final Slugifier slugifier;
    private final ExpressionEvaluator evaluator;
    private final List<Class<?>> keyTypes;

    public KeyResolver(Slugifier slugifier, ExpressionEvaluator evaluator, Class<?>... keyTypes) {
        this.slugifier = Objects.requireNonNull(slugifier, "slugifier");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.keyTypes = List.of(keyTypes);
    }

    public ResolvedKey resolve(Object rawKeyObj, GroupByConfig config) {
        return resolve(rawKeyObj, null, config);
    }

    public ResolvedKey resolve(Object rawKeyObj, FieldOccurrence occurrence, GroupByConfig config) {
        Object keyObj = rawKeyObj;
        checkSupported(config.getAttribute(), keyObj);

        if (config.getKeyObjFn() != null) {
            keyObj = transform(keyObj, occurrence, config);
            checkSupported(config.getAttribute(), keyObj);
        }

        if (isEmpty(keyObj)) {
            keyObj = noneKey(config);
        }

        String text = String.valueOf(keyObj);
        String mapped = config.getKeyMap().getOrDefault(text, text);
        String key = slugifier.slugify(mapped);
        if (key == null || key.isEmpty()) {
            // e.g. "###": fall back to the none key so the group stays addressable
            key = slugifier.slugify(noneKey(config));
            if (key == null || key.isEmpty()) {
                key = DEFAULT_NONE_KEY;
            }
        }
        return new ResolvedKey(key, keyObj);
    }

    /**
     * Key map lookup and slugify only, for callers that already hold a final key object.
     */
    public String slugify(String keyText, GroupByConfig config) {
        return resolve(keyText, config).key();
    }

    private Object transform(Object keyObj, FieldOccurrence occurrence, GroupByConfig config) {
        ExpressionContext.ExpressionContextBuilder context = ExpressionContext.builder()
                .variable("config", config.view());
        if (keyObj != null) {
            context.variable("X", keyObj);
            context.variable("key_obj", keyObj);
        }
        if (occurrence != null) {
            context.variable("args", occurrence);
            context.variable("record", occurrence.record());
        }
        try {
            return config.getKeyObjFn().evaluate(context.build(), evaluator);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(config.getAttribute(), "key_obj_fn", config.getKeyObjFn().describe(), e);
        }
    }

    private static String noneKey(GroupByConfig config) {
        return Optional.ofNullable(config.getReplaceNoneKey()).orElse(DEFAULT_NONE_KEY);
    }

    private static boolean isEmpty(Object keyObj) {
        return keyObj == null || (keyObj instanceof CharSequence text && text.toString().isBlank());
    }

    /**
     * Accepted: null, strings, numbers, booleans, characters, enums, dates and
     * instances of the registered key types. Anything else, containers and
     * arrays included, has no usable string form.
     */
    void checkSupported(String attribute, Object value) {
        if (value == null
                || value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof TemporalAccessor
                || value instanceof Date) {
            return;
        }
        for (Class<?> keyType : keyTypes) {
            if (keyType.isInstance(value)) {
                return;
            }
        }
        throw new InvalidYieldException(attribute, value);
    }
}
