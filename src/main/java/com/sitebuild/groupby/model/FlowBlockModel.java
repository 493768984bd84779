package com.sitebuild.groupby.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Schema of one kind of nested block inside a flow field.
 */
@Value
@Builder
public class FlowBlockModel {

    @NonNull
    String id;

    @Singular
    List<FieldDefinition> fields;
}
