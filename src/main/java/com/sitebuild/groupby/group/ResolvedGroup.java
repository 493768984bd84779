package com.sitebuild.groupby.group;

/**
 * What a grouping callback gets back for each key it emits: the resolved
 * key, available immediately, and a handle on the group that is still being
 * built. Children and pages are not available through it.
 */
public final class ResolvedGroup {

    private final GroupBySource group;
    private final GroupChild child;

    public ResolvedGroup(GroupBySource group, GroupChild child) {
        this.group = group;
        this.child = child;
    }

    /**
     * Final slug-safe key of the group.
     */
    public String key() {
        return group.getKey();
    }

    public Object keyObj() {
        return group.getKeyObj();
    }

    public String attribute() {
        return group.getAttribute();
    }

    /**
     * Slug with {@code {key}} substituted, or {@code null} when the slug is an
     * expression that needs the finished group.
     */
    public String slugPreview() {
        String template = group.getConfig().getSlug();
        if (template == null || !GroupBySource.usesKeyToken(template)) {
            return null;
        }
        return template.replace(GroupBySource.KEY_TOKEN, group.getKey());
    }

    /**
     * Attach extra information to the current record's membership in this group.
     */
    public ResolvedGroup attachExtra(Object extra) {
        child.addExtra(extra);
        return this;
    }

    /**
     * Set a group-wide value, readable later through {@link GroupBySource#getValue(String)}.
     */
    public ResolvedGroup put(String name, Object value) {
        group.putValue(name, value);
        return this;
    }

    public Object get(String name) {
        return group.getValue(name);
    }
}
