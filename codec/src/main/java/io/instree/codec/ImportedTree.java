package io.instree.codec;

import io.instree.core.InstanceId;
import io.instree.core.InstanceTree;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of reading a tree document.
 * <p>
 * Every instance read from a document is inserted with a fresh id;
 * {@code idMapping} maps the ids written in the document to those new ids.
 */
public record ImportedTree<P>(InstanceTree<P> tree, Map<InstanceId, InstanceId> idMapping) {

    public ImportedTree {
        Objects.requireNonNull(tree, "tree");
        idMapping = Map.copyOf(idMapping);
    }

    /** New id of the instance written as {@code documentId}, if the document had it. */
    public Optional<InstanceId> newId(InstanceId documentId) {
        return Optional.ofNullable(idMapping.get(documentId));
    }
}
