package com.sitebuild.groupby.model;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read access to the host's records and schemas.
 */
public class ContentTree {

    @Getter
    private final ContentRecord root;
    private final Map<String, DataModel> dataModels = new LinkedHashMap<>();
    private final Map<String, FlowBlockModel> flowBlockModels = new LinkedHashMap<>();

    public ContentTree(ContentRecord root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public ContentTree addDataModel(DataModel model) {
        dataModels.put(model.getId(), model);
        return this;
    }

    public ContentTree addFlowBlockModel(FlowBlockModel model) {
        flowBlockModels.put(model.getId(), model);
        return this;
    }

    public Optional<DataModel> getDataModel(String id) {
        return Optional.ofNullable(dataModels.get(id));
    }

    public Collection<DataModel> getDataModels() {
        return Collections.unmodifiableCollection(dataModels.values());
    }

    public Collection<FlowBlockModel> getFlowBlockModels() {
        return Collections.unmodifiableCollection(flowBlockModels.values());
    }

    /**
     * Find a record by path. Records that are not (yet) attached return empty.
     */
    public Optional<ContentRecord> get(String path) {
        String normalized = ContentRecord.normalizePath(path);
        for (ContentRecord record : walk(root)) {
            if (record.getPath().equals(normalized)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Pre-order traversal starting at {@code start}, children in insertion order.
     */
    public List<ContentRecord> walk(ContentRecord start) {
        List<ContentRecord> result = new ArrayList<>();
        if (start == null) {
            return result;
        }
        Deque<ContentRecord> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            ContentRecord current = stack.pop();
            result.add(current);
            List<ContentRecord> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }
}
