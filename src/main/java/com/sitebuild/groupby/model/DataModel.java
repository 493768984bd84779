package com.sitebuild.groupby.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Schema of a record type.
 */
@Value
@Builder
public class DataModel {

    @NonNull
    String id;

    @Singular
    List<FieldDefinition> fields;
}
