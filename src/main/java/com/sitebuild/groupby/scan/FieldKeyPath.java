package com.sitebuild.groupby.scan;

/**
 * Location of a watched value inside a record.
 *
 * @param fieldKey  name of the record field
 * @param flowIndex block index for flattened flow fields, otherwise {@code null}
 * @param flowKey   field name inside the block, otherwise {@code null}
 */
public record FieldKeyPath(String fieldKey, Integer flowIndex, String flowKey) {

    public static FieldKeyPath of(String fieldKey) {
        return new FieldKeyPath(fieldKey, null, null);
    }

    public boolean isFlowBlock() {
        return flowIndex != null;
    }
}
