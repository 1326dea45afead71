package io.instree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An instance that is rooted in an {@link InstanceTree}: a payload plus its
 * place in the hierarchy.
 * <p>
 * Fields:
 *  - id:       unique identity, fixed at insertion time.
 *  - payload:  opaque per-instance data; callers may replace it freely.
 *  - parent:   id of the parent instance, null when this instance is a root.
 *  - children: ids of the child instances. Order is relevant and preserved.
 * <p>
 * Parent and children are owned by the tree. They are only changed by the
 * tree's structural operations, which keep both directions of every link
 * consistent.
 */
public final class RootedInstance<P> {
    private final InstanceId id;
    private P payload;
    private InstanceId parent;
    private final List<InstanceId> children = new ArrayList<>();

    RootedInstance(InstanceId id, P payload, InstanceId parent) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.parent = parent;
    }

    public InstanceId id() { return id; }

    public P payload() { return payload; }

    /** Replace the payload. Does not affect the structure of the tree. */
    public void setPayload(P payload) {
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    /** Parent id, or empty if this instance is a root. */
    public Optional<InstanceId> parentId() { return Optional.ofNullable(parent); }

    /** Read-only view of the ordered child ids. */
    public List<InstanceId> childIds() { return Collections.unmodifiableList(children); }

    public boolean isRoot() { return parent == null; }

    // ---------- structural state, owned by InstanceTree ----------

    InstanceId parent() { return parent; }

    void setParent(InstanceId parent) { this.parent = parent; }

    List<InstanceId> children() { return children; }

    @Override public String toString() {
        return "RootedInstance{id=" + id + ", parent=" + parent + ", children=" + children + ", payload=" + payload + "}";
    }
}
