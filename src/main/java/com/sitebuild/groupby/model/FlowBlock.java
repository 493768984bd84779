package com.sitebuild.groupby.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One block of a flow field. Keys starting with an underscore are internal.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FlowBlock {
    public static final String BLOCK_TYPE_KEY = "_flowblock";

    private final String blockType;
    private final Map<String, Object> data = new LinkedHashMap<>();

    public FlowBlock(String blockType, Map<String, ?> values) {
        this.blockType = blockType;
        this.data.put(BLOCK_TYPE_KEY, blockType);
        if (values != null) {
            this.data.putAll(values);
        }
    }

    public Object get(String key) {
        return data.get(key);
    }

    public void set(String key, Object value) {
        data.put(key, value);
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }
}
