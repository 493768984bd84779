package com.sitebuild.groupby.model;

import com.sitebuild.groupby.expression.PropertySource;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A page of the host content tree. Identity is its path.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContentRecord implements PropertySource {
    public static final String ROOT_PATH = "/";

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String path;

    @ToString.Include
    private final String modelId;

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final List<ContentRecord> children = new ArrayList<>();
    private final List<String> sourceFiles = new ArrayList<>();

    @Setter
    private ContentRecord parent;

    public ContentRecord(String path, String modelId) {
        this.path = normalizePath(path);
        this.modelId = modelId;
    }

    public ContentRecord(String path, String modelId, Map<String, ?> values) {
        this(path, modelId);
        if (values != null) {
            fields.putAll(values);
        }
    }

    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * Fields by name, plus {@code _path}, {@code _model} and {@code url_path}.
     */
    @Override
    public Object getProperty(String name) {
        return switch (name) {
            case "_path" -> path;
            case "_model" -> modelId;
            case "url_path" -> getUrlPath();
            default -> fields.get(name);
        };
    }

    /**
     * Callbacks may rewrite field contents (e.g. to link discovered keys).
     */
    public void set(String fieldName, Object value) {
        fields.put(fieldName, value);
    }

    public void addChild(ContentRecord child) {
        children.add(child);
        child.setParent(this);
    }

    public boolean removeChild(ContentRecord child) {
        boolean removed = children.remove(child);
        if (removed) {
            child.setParent(null);
        }
        return removed;
    }

    public List<ContentRecord> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public void addSourceFile(String filename) {
        sourceFiles.add(filename);
    }

    /**
     * Files this record was loaded from. Falls back to its path when the
     * host did not report any, so every record is trackable as a dependency.
     */
    public List<String> getSourceFiles() {
        if (sourceFiles.isEmpty()) {
            return List.of(path);
        }
        return Collections.unmodifiableList(sourceFiles);
    }

    /**
     * Browser-facing path of the record, always ending in a slash.
     */
    public String getUrlPath() {
        return ROOT_PATH.equals(path) ? ROOT_PATH : path + "/";
    }

    /**
     * Whether this record lies at or below {@code root}.
     */
    public boolean isUnder(String root) {
        return isUnder(path, root);
    }

    public static boolean isUnder(String path, String root) {
        String normalizedRoot = normalizePath(root);
        if (ROOT_PATH.equals(normalizedRoot)) {
            return true;
        }
        String normalized = normalizePath(path);
        return normalized.equals(normalizedRoot) || normalized.startsWith(normalizedRoot + "/");
    }

    public static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return ROOT_PATH;
        }
        String trimmed = path.trim();
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
