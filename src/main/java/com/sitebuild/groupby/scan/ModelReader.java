package com.sitebuild.groupby.scan;

import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.model.DataModel;
import com.sitebuild.groupby.model.FieldDefinition;
import com.sitebuild.groupby.model.Flow;
import com.sitebuild.groupby.model.FlowBlock;
import com.sitebuild.groupby.model.FlowBlockModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the data model fields and flow block fields that carry an attribute
 * flag and reads their values from records.
 *
 * A field flagged itself is read whole, or block by block when flattened.
 * A flow field without the flag is still read when one of its allowed block
 * types carries the flag; flattened, only those block fields are emitted.
 */
public class ModelReader {

    private enum Selection {
        /**
         * The field itself carries the attribute.
         */
        WHOLE_FIELD,

        /**
         * Only some flow blocks carry the attribute.
         */
        SOME_BLOCKS
    }

    private final boolean flatten;
    private final Map<String, Set<String>> flows = new LinkedHashMap<>();
    private final Map<String, Map<String, Selection>> models = new LinkedHashMap<>();

    public ModelReader(ContentTree tree, String attribute, boolean flatten) {
        this.flatten = flatten;

        for (FlowBlockModel flow : tree.getFlowBlockModels()) {
            Set<String> flagged = new LinkedHashSet<>();
            for (FieldDefinition field : flow.getFields()) {
                if (field.hasAttribute(attribute)) {
                    flagged.add(field.getName());
                }
            }
            if (!flagged.isEmpty()) {
                flows.put(flow.getId(), flagged);
            }
        }

        for (DataModel model : tree.getDataModels()) {
            Map<String, Selection> selected = new LinkedHashMap<>();
            for (FieldDefinition field : model.getFields()) {
                if (field.hasAttribute(attribute)) {
                    selected.put(field.getName(), Selection.WHOLE_FIELD);
                } else if (field.isFlow() && !flows.isEmpty() && allowsFlaggedBlock(field)) {
                    selected.put(field.getName(), Selection.SOME_BLOCKS);
                }
            }
            if (!selected.isEmpty()) {
                models.put(model.getId(), selected);
            }
        }
    }

    private boolean allowsFlaggedBlock(FieldDefinition field) {
        if (field.getFlowBlocks() == null) {
            return true;
        }
        return field.getFlowBlocks().stream().anyMatch(flows::containsKey);
    }

    /**
     * Whether any model of the tree can contain the attribute at all.
     */
    public boolean isEmpty() {
        return models.isEmpty();
    }

    /**
     * All occurrences of the attribute in one record, in schema field order.
     * Absent values are emitted too.
     */
    public List<FieldOccurrence> read(ContentRecord record) {
        List<FieldOccurrence> result = new ArrayList<>();
        Map<String, Selection> selected = models.get(record.getModelId());
        if (selected == null) {
            return result;
        }
        for (Map.Entry<String, Selection> entry : selected.entrySet()) {
            String fieldKey = entry.getKey();
            Object value = record.get(fieldKey);

            if (!flatten || !(value instanceof Flow flow)) {
                if (entry.getValue() == Selection.WHOLE_FIELD || !flatten) {
                    result.add(new FieldOccurrence(record, FieldKeyPath.of(fieldKey), value));
                }
                continue;
            }

            List<FlowBlock> blocks = flow.getBlocks();
            for (int i = 0; i < blocks.size(); i++) {
                FlowBlock block = blocks.get(i);
                if (entry.getValue() == Selection.WHOLE_FIELD) {
                    for (Map.Entry<String, Object> data : block.getData().entrySet()) {
                        if (data.getKey().startsWith("_")) {
                            continue;
                        }
                        result.add(new FieldOccurrence(record,
                                new FieldKeyPath(fieldKey, i, data.getKey()), data.getValue()));
                    }
                } else {
                    for (String flowKey : flows.getOrDefault(block.getBlockType(), Set.of())) {
                        result.add(new FieldOccurrence(record,
                                new FieldKeyPath(fieldKey, i, flowKey), block.get(flowKey)));
                    }
                }
            }
        }
        return result;
    }
}
