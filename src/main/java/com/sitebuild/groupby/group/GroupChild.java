package com.sitebuild.groupby.group;

import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.scan.FieldKeyPath;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One record inside a group, with every raw key object it yielded for that
 * group, the extras attached by the callback and where they were found.
 */
@ToString(onlyExplicitlyIncluded = true)
public class GroupChild {

    @Getter
    @ToString.Include
    private final ContentRecord record;
    private final List<Object> keyObjects = new ArrayList<>();
    private final List<Object> extras = new ArrayList<>();
    private final List<FieldKeyPath> fieldKeys = new ArrayList<>();

    GroupChild(ContentRecord record) {
        this.record = record;
    }

    void addOccurrence(Object rawKey, FieldKeyPath fieldKey) {
        keyObjects.add(rawKey);
        if (fieldKey != null && !fieldKeys.contains(fieldKey)) {
            fieldKeys.add(fieldKey);
        }
    }

    void addExtra(Object extra) {
        extras.add(extra);
    }

    void mergeFrom(GroupChild other) {
        keyObjects.addAll(other.keyObjects);
        extras.addAll(other.extras);
        for (FieldKeyPath key : other.fieldKeys) {
            if (!fieldKeys.contains(key)) {
                fieldKeys.add(key);
            }
        }
    }

    public List<Object> getKeyObjects() {
        return Collections.unmodifiableList(keyObjects);
    }

    public List<Object> getExtras() {
        return Collections.unmodifiableList(extras);
    }

    public List<FieldKeyPath> getFieldKeys() {
        return Collections.unmodifiableList(fieldKeys);
    }

    public Object getFirstExtra() {
        return extras.isEmpty() ? null : extras.get(0);
    }

    public boolean matchesField(String fieldKey) {
        return fieldKeys.stream().anyMatch(k -> k.fieldKey().equals(fieldKey));
    }

    public boolean matchesFlowKey(String flowKey) {
        return fieldKeys.stream().anyMatch(k -> flowKey.equals(k.flowKey()));
    }
}
