package com.sitebuild.groupby.group;

import com.sitebuild.groupby.config.ConfigView;
import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.config.PaginationSettings;
import com.sitebuild.groupby.config.SortKey;
import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.expression.ExpressionContext;
import com.sitebuild.groupby.expression.ExpressionEvaluator;
import com.sitebuild.groupby.expression.FieldExpression;
import com.sitebuild.groupby.expression.PropertySource;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.pagination.Paginator;
import com.sitebuild.groupby.scan.FieldKeyPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single group: every record that yielded the same resolved key for one
 * watched attribute below one root. Templates see it as {@code this}.
 *
 * Instances are created while a watcher scans and become read-only once
 * {@link #finish()} ran. Declared fields are evaluated on every access.
 */
public class GroupBySource implements VirtualNode, PropertySource, Comparable<GroupBySource> {
    public static final String KEY_TOKEN = "{key}";

    private final GroupByConfig config;
    private final ContentRecord rootRecord;
    private final String key;
    private final Object keyObj;
    private final ExpressionEvaluator evaluator;

    private final Map<ContentRecord, GroupChild> children = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> aliasKeys = new LinkedHashSet<>();
    private String slug;
    private List<GroupPage> pages = List.of();
    private volatile boolean finished;

    public GroupBySource(GroupByConfig config, ContentRecord rootRecord, String key, Object keyObj,
                         ExpressionEvaluator evaluator) {
        this.config = Objects.requireNonNull(config, "config");
        this.rootRecord = Objects.requireNonNull(rootRecord, "rootRecord");
        this.key = Objects.requireNonNull(key, "key");
        this.keyObj = keyObj;
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    // -------------------------------------------------------------------------
    // Building (single-threaded, owned by the watcher lock)
    // -------------------------------------------------------------------------

    public GroupChild addOccurrence(ContentRecord record, Object rawKey, FieldKeyPath fieldKey) {
        checkNotFinished();
        GroupChild child = children.computeIfAbsent(record, GroupChild::new);
        child.addOccurrence(rawKey, fieldKey);
        return child;
    }

    void putValue(String name, Object value) {
        checkNotFinished();
        values.put(name, value);
    }

    /**
     * Evaluate the slug: a literal {@code {key}} token is substituted, any
     * other template is evaluated as an expression with {@code this} bound to
     * this group.
     */
    public String computeSlug() {
        String template = config.getSlug();
        if (template == null) {
            slug = null;
        } else if (usesKeyToken(template)) {
            slug = template.replace(KEY_TOKEN, key);
        } else {
            Object value;
            try {
                value = evaluator.evaluate(template, context());
            } catch (IllegalArgumentException e) {
                throw new ConfigException(config.getAttribute(), "slug", template, e);
            }
            slug = value == null || String.valueOf(value).isBlank() ? null : String.valueOf(value);
        }
        return slug;
    }

    /**
     * Whether {@code template} is a plain slug with a {@code {key}} token
     * rather than a FreeMarker template such as {@code tags/${this.key}/}.
     */
    static boolean usesKeyToken(String template) {
        return template.contains(KEY_TOKEN) && !template.contains("${");
    }

    /**
     * Absorb a group whose slug collided with this one.
     */
    public void mergeFrom(GroupBySource other) {
        checkNotFinished();
        for (GroupChild theirs : other.children.values()) {
            GroupChild ours = children.get(theirs.getRecord());
            if (ours == null) {
                children.put(theirs.getRecord(), theirs);
            } else {
                ours.mergeFrom(theirs);
            }
        }
        other.values.forEach(values::putIfAbsent);
        aliasKeys.add(other.key);
        aliasKeys.addAll(other.aliasKeys);
    }

    public void sortChildren(List<SortKey> orderBy) {
        checkNotFinished();
        if (orderBy.isEmpty()) {
            return;
        }
        List<GroupChild> sorted = new ArrayList<>(children.values());
        sorted.sort((a, b) -> RecordOrdering.records(orderBy).compare(a.getRecord(), b.getRecord()));
        children.clear();
        sorted.forEach(child -> children.put(child.getRecord(), child));
    }

    /**
     * Freeze the group and split it into pages if pagination is enabled.
     */
    public void finish() {
        checkNotFinished();
        PaginationSettings settings = config.getPagination();
        if (settings.isEnabled()) {
            List<GroupChild> items = paginatedItems(settings);
            List<List<GroupChild>> split = Paginator.split(items, settings.getPerPage());
            List<GroupPage> result = new ArrayList<>(split.size());
            for (int i = 0; i < split.size(); i++) {
                result.add(new GroupPage(this, i + 1, split.size(), split.get(i), items.size(),
                        settings.getUrlSuffix()));
            }
            pages = Collections.unmodifiableList(result);
        }
        finished = true;
    }

    private List<GroupChild> paginatedItems(PaginationSettings settings) {
        List<GroupChild> all = new ArrayList<>(children.values());
        if (settings.getItems() == null || settings.getItems().isBlank()) {
            return all;
        }
        List<GroupChild> filtered = new ArrayList<>();
        for (GroupChild child : all) {
            ExpressionContext ctx = context().toBuilder()
                    .variable("item", child.getRecord())
                    .variable(ExpressionContext.RECORD, child.getRecord())
                    .build();
            Object value;
            try {
                value = evaluator.evaluate(settings.getItems(), ctx);
            } catch (IllegalArgumentException e) {
                throw new ConfigException(config.getAttribute(), "pagination.items", settings.getItems(), e);
            }
            if (isTruthy(value)) {
                filtered.add(child);
            }
        }
        return filtered;
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("Group " + getPath() + " is already finished");
        }
    }

    private void checkFinished() {
        if (!finished) {
            throw new IllegalStateException("Group " + getPath() + " is still being built");
        }
    }

    // -------------------------------------------------------------------------
    // Template surface
    // -------------------------------------------------------------------------

    public String getKey() {
        return key;
    }

    public Object getKeyObj() {
        return keyObj;
    }

    public String getAttribute() {
        return config.getAttribute();
    }

    /**
     * Other keys whose groups were merged into this one because their slugs collided.
     */
    public Set<String> getAliasKeys() {
        return Collections.unmodifiableSet(aliasKeys);
    }

    public ContentRecord getRootRecord() {
        return rootRecord;
    }

    public ConfigView getConfig() {
        return config.view();
    }

    public String getSlug() {
        return slug;
    }

    @Override
    public String getPath() {
        return rootRecord.getPath() + VIRTUAL_PATH_MARKER + "/" + config.getAttribute() + "/" + key;
    }

    @Override
    public String getUrlPath() {
        return slug == null ? null : UrlPaths.join(rootRecord.getUrlPath(), slug);
    }

    @Override
    public String getTemplate() {
        return config.getTemplate();
    }

    @Override
    public List<String> getSourceFilenames() {
        Set<String> result = new LinkedHashSet<>(config.getDependencies());
        for (ContentRecord record : children.keySet()) {
            result.addAll(record.getSourceFiles());
        }
        return List.copyOf(result);
    }

    public ChildQuery children() {
        checkFinished();
        return new ChildQuery(List.copyOf(children.values()));
    }

    public List<GroupChild> getChildren() {
        checkFinished();
        return List.copyOf(children.values());
    }

    public Optional<GroupChild> getChild(ContentRecord record) {
        return Optional.ofNullable(children.get(record));
    }

    public int size() {
        return children.size();
    }

    public ContentRecord getFirstChild() {
        return children.isEmpty() ? null : children.keySet().iterator().next();
    }

    public Object getFirstExtra() {
        return children.isEmpty() ? null : children.values().iterator().next().getFirstExtra();
    }

    public Object getValue(String name) {
        return values.get(name);
    }

    public boolean isPaginated() {
        return !pages.isEmpty();
    }

    public List<GroupPage> getPages() {
        checkFinished();
        return pages;
    }

    public int getPageCount() {
        return pages.isEmpty() ? 1 : pages.size();
    }

    public GroupPage getPage(int pageNum) {
        checkFinished();
        if (pageNum < 1 || pageNum > pages.size()) {
            throw new IndexOutOfBoundsException("Group " + getPath() + " has no page " + pageNum);
        }
        return pages.get(pageNum - 1);
    }

    public boolean hasField(String name) {
        return config.getFields().containsKey(name);
    }

    /**
     * Evaluate a declared field now. Nothing is cached, so the result may
     * depend on the current build context.
     */
    public Object getField(String name) {
        FieldExpression expression = config.getFields().get(name);
        if (expression == null) {
            throw new IllegalArgumentException("No field '" + name + "' declared for [" + config.getAttribute() + "]");
        }
        try {
            return expression.evaluate(context(), evaluator);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(config.getAttribute(), "fields." + name, expression.describe(), e);
        }
    }

    public Map<String, Object> getFields() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String name : config.getFields().keySet()) {
            result.put(name, getField(name));
        }
        return result;
    }

    @Override
    public Object getProperty(String name) {
        return switch (name) {
            case "key" -> key;
            case "key_obj" -> keyObj;
            case "attribute" -> getAttribute();
            case "slug" -> slug;
            case "url_path" -> getUrlPath();
            case "path", "_path" -> getPath();
            case "record" -> rootRecord;
            case "config" -> getConfig();
            case "template" -> getTemplate();
            case "children" -> finished ? children() : null;
            case "first_child" -> getFirstChild();
            case "first_extra" -> getFirstExtra();
            case "count", "size" -> size();
            case "page_count" -> getPageCount();
            default -> {
                if (hasField(name)) {
                    yield getField(name);
                }
                yield values.get(name);
            }
        };
    }

    ExpressionContext context() {
        return ExpressionContext.of(this, rootRecord, config.view());
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence s) {
            return !s.isEmpty();
        }
        return true;
    }

    // -------------------------------------------------------------------------
    // Identity
    // -------------------------------------------------------------------------

    @Override
    public int compareTo(GroupBySource other) {
        return String.valueOf(keyObj).compareTo(String.valueOf(other.keyObj));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof GroupBySource that
                && getPath().equals(that.getPath())
                && Objects.equals(slug, that.slug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPath(), slug);
    }

    @Override
    public String toString() {
        return "<GroupBySource path=\"" + getPath() + "\" children=" + children.size() + ">";
    }
}
