package com.sitebuild.groupby.scan;

import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.Flow;
import com.sitebuild.groupby.model.FlowBlock;

/**
 * One place where a watched attribute was found. This is what a grouping callback receives.
 *
 * @param record the record holding the field
 * @param key    field (and block) location
 * @param field  the raw value, possibly {@code null}
 */
public record FieldOccurrence(ContentRecord record, FieldKeyPath key, Object field) {

    /**
     * Write a new value back to where this occurrence was read from. Lets
     * callbacks rewrite source text (e.g. to link discovered keys).
     */
    public void replaceValue(Object value) {
        if (!key.isFlowBlock()) {
            record.set(key.fieldKey(), value);
            return;
        }
        if (record.get(key.fieldKey()) instanceof Flow flow && key.flowIndex() < flow.getBlocks().size()) {
            FlowBlock block = flow.getBlocks().get(key.flowIndex());
            block.set(key.flowKey(), value);
            return;
        }
        throw new IllegalStateException("Flow block " + key + " no longer exists on " + record.getPath());
    }
}
