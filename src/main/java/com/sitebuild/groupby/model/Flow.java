package com.sitebuild.groupby.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Value of a {@link FieldType#FLOW} field.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Flow {
    private final List<FlowBlock> blocks;

    public Flow(List<FlowBlock> blocks) {
        this.blocks = blocks != null ? new ArrayList<>(blocks) : new ArrayList<>();
    }

    public static Flow of(FlowBlock... blocks) {
        return new Flow(List.of(blocks));
    }
}
