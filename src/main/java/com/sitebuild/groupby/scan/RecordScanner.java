package com.sitebuild.groupby.scan;

import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Stream;

/**
 * Walks the records below a root (pre-order, children in insertion order)
 * and yields every occurrence of a watched attribute. Produces no keys.
 */
public class RecordScanner {
    private static final Logger log = LoggerFactory.getLogger(RecordScanner.class);

    private final ContentTree tree;

    public RecordScanner(ContentTree tree) {
        this.tree = tree;
    }

    /**
     * Lazily scan {@code root}. A root that does not exist (yet) yields nothing.
     */
    public Stream<FieldOccurrence> scan(String root, String attribute, boolean flatten) {
        ModelReader reader = new ModelReader(tree, attribute, flatten);
        if (reader.isEmpty()) {
            log.debug("No model carries attribute [{}]", attribute);
            return Stream.empty();
        }
        return tree.get(root)
                .map(start -> tree.walk(start).stream()
                        .filter(record -> record.isUnder(root))
                        .flatMap(record -> reader.read(record).stream()))
                .orElseGet(() -> {
                    log.debug("Root {} for attribute [{}] not found", root, attribute);
                    return Stream.empty();
                });
    }

    public Stream<ContentRecord> records(String root) {
        return tree.get(root).map(start -> tree.walk(start).stream()).orElseGet(Stream::empty);
    }
}
