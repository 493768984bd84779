package com.sitebuild.groupby.config;

import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.expression.FieldExpression;
import com.sitebuild.groupby.model.ContentRecord;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Settings of one watched attribute.
 *
 * Identity settings (attribute, root, slug, template, split, replace_none_key,
 * key_obj_fn) are fixed at construction. The remaining settings may be
 * changed at any time; every change is reported to the listeners registered
 * with {@link #onChange(Runnable)}, so a built watcher goes stale and
 * regroups on next access.
 *
 * Defaults:
 * - root: "/"
 * - slug: "{attribute}/{key}/index.html" ("none" disables addressing)
 * - template: "groupby-{attribute}.html"
 */
@Getter
public class GroupByConfig {
    public static final String NO_SLUG = "none";

    private final String attribute;
    private final String root;
    private final String slug;
    private final String template;
    private final String split;
    private final String replaceNoneKey;
    private final FieldExpression keyObjFn;

    private volatile boolean enabled = true;
    private final Set<String> dependencies = ConcurrentHashMap.newKeySet();
    private Map<String, FieldExpression> fields = Map.of();
    private Map<String, String> keyMap = Map.of();
    private PaginationSettings pagination = PaginationSettings.disabled();
    private List<SortKey> orderBy = List.of();

    @Getter(AccessLevel.NONE)
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    @Builder
    public GroupByConfig(@NonNull String attribute, String root, String slug, String template,
                         String split, String replaceNoneKey, FieldExpression keyObjFn) {
        if (attribute.isBlank() || attribute.contains(".")) {
            throw new ConfigException(attribute, "attribute", attribute, "must be a non-blank name without dots");
        }
        this.attribute = attribute;
        this.root = ContentRecord.normalizePath(root);
        this.slug = resolveSlug(attribute, slug);
        this.template = isBlank(template) ? "groupby-" + attribute + ".html" : template.trim();
        this.split = split == null || split.isEmpty() ? null : split;
        this.replaceNoneKey = isBlank(replaceNoneKey) ? null : replaceNoneKey;
        this.keyObjFn = keyObjFn;
    }

    public static GroupByConfig of(String attribute) {
        return GroupByConfig.builder().attribute(attribute).build();
    }

    private static String resolveSlug(String attribute, String slug) {
        if (isBlank(slug)) {
            return attribute + "/{key}/index.html";
        }
        if (NO_SLUG.equalsIgnoreCase(slug.trim())) {
            return null;
        }
        return slug.trim();
    }

    // -------------------------------------------------------------------------
    // Mutable settings
    // -------------------------------------------------------------------------

    public void onChange(Runnable listener) {
        changeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void changed() {
        for (Runnable listener : changeListeners) {
            listener.run();
        }
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        changed();
    }

    /**
     * Each entry becomes a lazily evaluated property of every group.
     * String values are expressions, anything else is used as-is.
     */
    public void setFields(Map<String, ?> fields) {
        Map<String, FieldExpression> parsed = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> parsed.put(name, FieldExpression.of(value)));
        }
        this.fields = Collections.unmodifiableMap(parsed);
        changed();
    }

    /**
     * Replaces raw keys before slugify, e.g. {@code Blog -> News}.
     */
    public void setKeyMap(Map<String, String> keyMap) {
        this.keyMap = keyMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keyMap));
        changed();
    }

    public void setPagination(PaginationSettings pagination) {
        PaginationSettings value = pagination == null ? PaginationSettings.disabled() : pagination;
        if (value.getPerPage() <= 0) {
            throw new ConfigException(attribute, "pagination.per_page", value.getPerPage(), "must be > 0");
        }
        if (isBlank(value.getUrlSuffix()) || value.getUrlSuffix().contains("/")) {
            throw new ConfigException(attribute, "pagination.url_suffix", value.getUrlSuffix(),
                    "must be a non-blank path segment");
        }
        this.pagination = value;
        changed();
    }

    public void setOrderBy(List<SortKey> orderBy) {
        this.orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        changed();
    }

    /**
     * Comma separated sort keys, e.g. {@code "-date, title"}.
     */
    public void setOrderBy(String orderBy) {
        try {
            setOrderBy(SortKey.parseList(orderBy));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(attribute, "children.order_by", orderBy, e);
        }
    }

    public void addDependency(String identifier) {
        if (!isBlank(identifier)) {
            dependencies.add(identifier);
        }
    }

    public Set<String> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public boolean isAddressable() {
        return slug != null;
    }

    public ConfigView view() {
        return ConfigView.builder()
                .attribute(attribute)
                .root(root)
                .slug(slug)
                .template(template)
                .split(split)
                .replaceNoneKey(replaceNoneKey)
                .enabled(enabled)
                .dependencies(dependencies)
                .fieldNames(fields.keySet())
                .keyMap(keyMap)
                .pagination(pagination)
                .orderBy(orderBy)
                .build();
    }

    /**
     * Whether both configs would produce the same groups. Used to tell a
     * repeated registration apart from a conflicting one.
     */
    public boolean hasSameSettings(GroupByConfig other) {
        if (other == this) {
            return true;
        }
        return other != null
                && attribute.equals(other.attribute)
                && root.equals(other.root)
                && Objects.equals(slug, other.slug)
                && template.equals(other.template)
                && Objects.equals(split, other.split)
                && Objects.equals(replaceNoneKey, other.replaceNoneKey)
                && Objects.equals(keyObjFn, other.keyObjFn)
                && enabled == other.enabled
                && fields.equals(other.fields)
                && keyMap.equals(other.keyMap)
                && pagination.equals(other.pagination)
                && orderBy.equals(other.orderBy);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    /**
     * Build from a flat mapping using the same keys as the plugin config file:
     * root, slug, template, split, enabled, key_obj_fn, replace_none_key,
     * children.order_by, pagination.enabled|per_page|url_suffix|items,
     * plus nested maps under "fields" and "key_map".
     */
    public static GroupByConfig fromMap(String attribute, Map<String, ?> values) {
        Map<String, ?> cfg = values == null ? Map.of() : values;
        List<String> errors = new ArrayList<>();

        GroupByConfig config = GroupByConfig.builder()
                .attribute(attribute)
                .root(text(cfg.get("root")))
                .slug(text(cfg.get("slug")))
                .template(text(cfg.get("template")))
                .split(text(cfg.get("split")))
                .replaceNoneKey(text(cfg.get("replace_none_key")))
                .keyObjFn(cfg.get("key_obj_fn") == null ? null : FieldExpression.of(cfg.get("key_obj_fn")))
                .build();

        Boolean enabled = toBoolean(attribute, "enabled", cfg.get("enabled"), errors);
        if (enabled != null) {
            config.setEnabled(enabled);
        }
        if (cfg.get("fields") instanceof Map<?, ?> fields) {
            Map<String, Object> copy = new LinkedHashMap<>();
            fields.forEach((k, v) -> copy.put(String.valueOf(k), v));
            config.setFields(copy);
        }
        if (cfg.get("key_map") instanceof Map<?, ?> keyMap) {
            Map<String, String> copy = new LinkedHashMap<>();
            keyMap.forEach((k, v) -> copy.put(String.valueOf(k), String.valueOf(v)));
            config.setKeyMap(copy);
        }

        Boolean paginationEnabled = toBoolean(attribute, "pagination.enabled", cfg.get("pagination.enabled"), errors);
        Integer perPage = toInteger(attribute, "pagination.per_page", cfg.get("pagination.per_page"), errors);
        String urlSuffix = text(cfg.get("pagination.url_suffix"));
        String items = text(cfg.get("pagination.items"));
        if (paginationEnabled != null || perPage != null || urlSuffix != null || items != null) {
            PaginationSettings.PaginationSettingsBuilder pagination = PaginationSettings.builder()
                    .enabled(paginationEnabled != null ? paginationEnabled : perPage != null)
                    .items(items);
            if (perPage != null) {
                pagination.perPage(perPage);
            }
            if (urlSuffix != null) {
                pagination.urlSuffix(urlSuffix);
            }
            apply(errors, () -> config.setPagination(pagination.build()));
        }

        String orderBy = text(cfg.get("children.order_by"));
        if (orderBy != null) {
            apply(errors, () -> config.setOrderBy(orderBy));
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
        return config;
    }

    private static void apply(List<String> errors, Runnable setter) {
        try {
            setter.run();
        } catch (ConfigException e) {
            errors.addAll(e.getErrors());
        }
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    static Boolean toBoolean(String attribute, String field, Object value, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return switch (String.valueOf(value).trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on" -> Boolean.TRUE;
            case "false", "no", "0", "off" -> Boolean.FALSE;
            default -> {
                errors.add(ConfigException.format(attribute, field, value, "not a boolean"));
                yield null;
            }
        };
    }

    static Integer toInteger(String attribute, String field, Object value, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.valueOf(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            errors.add(ConfigException.format(attribute, field, value, "not an integer"));
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder txt = new StringBuilder("<GroupByConfig");
        txt.append(" enabled=\"").append(enabled).append('"');
        txt.append(" attribute=\"").append(attribute).append('"');
        txt.append(" root=\"").append(root).append('"');
        txt.append(" slug=\"").append(slug).append('"');
        txt.append(" template=\"").append(template).append('"');
        txt.append(" fields=\"").append(String.join(", ", fields.keySet())).append('"');
        if (!orderBy.isEmpty()) {
            txt.append(" order_by=\"").append(orderBy).append('"');
        }
        return txt.append('>').toString();
    }
}
