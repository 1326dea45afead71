package io.instree.core;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Identity-indexed forest of {@link RootedInstance}s.
 * <p>
 * Responsibilities:
 *  - Own every instance: an instance lives exactly as long as it is in this map.
 *  - Track the ids of instances without a parent (roots).
 *  - Keep parent and child links consistent on every structural change.
 * <p>
 * Invariants (hold after every public operation):
 *  - a parent id always resolves, and the parent lists the child exactly once,
 *  - every listed child resolves and points back at its parent,
 *  - the root set is exactly the set of instances without a parent,
 *  - the parent graph is acyclic.
 * <p>
 * Not thread safe. A {@link Descendants} walk must not overlap a structural
 * change of the tree it walks; it fails fast with
 * {@link java.util.ConcurrentModificationException} when it detects one.
 *
 * @param <P> payload type, opaque to the tree
 */
public final class InstanceTree<P> {
    private static final Logger log = Logger.getLogger(InstanceTree.class.getName());

    private final Map<InstanceId, RootedInstance<P>> instances;

    // Insertion ordered so that roots enumerate (and serialize) stably.
    private final Set<InstanceId> rootIds;

    // Bumped on every structural change; checked by live Descendants walks.
    private int modCount;

    public InstanceTree() {
        this(new HashMap<>(), new LinkedHashSet<>());
    }

    private InstanceTree(Map<InstanceId, RootedInstance<P>> instances, Set<InstanceId> rootIds) {
        this.instances = instances;
        this.rootIds = rootIds;
    }

    /** Read-only view of the ids of all root instances. */
    public Set<InstanceId> getRootIds() {
        return Collections.unmodifiableSet(rootIds);
    }

    /**
     * Look up an instance by id.
     * The returned instance allows payload edits via {@link RootedInstance#setPayload};
     * its parent and children can only be changed through this tree.
     */
    public Optional<RootedInstance<P>> getInstance(InstanceId id) {
        return Optional.ofNullable(instances.get(id));
    }

    public boolean contains(InstanceId id) { return instances.containsKey(id); }

    /** Number of instances in the tree, across all roots. */
    public int size() { return instances.size(); }

    public boolean isEmpty() { return instances.isEmpty(); }

    /** Insert a new root instance and return its fresh id. */
    public InstanceId insertInstance(P payload) {
        return insertInstance(payload, null);
    }

    /**
     * Insert a new instance under {@code parentId}, or as a new root if
     * {@code parentId} is null. The new id is appended to the end of the
     * parent's child list.
     *
     * @throws IllegalArgumentException if {@code parentId} is not in this tree
     */
    public InstanceId insertInstance(P payload, InstanceId parentId) {
        Objects.requireNonNull(payload, "payload");
        if (parentId != null && !instances.containsKey(parentId)) {
            throw new IllegalArgumentException("Cannot insert into parent " + parentId + ": not in this tree");
        }

        var instance = new RootedInstance<>(InstanceId.newUnique(), payload, parentId);
        if (parentId != null) {
            instances.get(parentId).children().add(instance.id());
        } else {
            rootIds.add(instance.id());
        }
        instances.put(instance.id(), instance);
        modCount++;
        return instance.id();
    }

    /**
     * Remove the instance with the given id, along with all of its descendants,
     * and return them as a new tree whose only root is {@code rootId}.
     * <p>
     * The internal shape of the removed subtree is kept as is. Only the link
     * between {@code rootId} and its former parent is cut.
     *
     * @return the detached subtree, or empty (and no change) if {@code rootId} is unknown
     */
    public Optional<InstanceTree<P>> removeInstance(InstanceId rootId) {
        RootedInstance<P> root = instances.get(rootId);
        if (root == null) {
            return Optional.empty();
        }

        unlink(root);
        var detached = new InstanceTree<P>(new HashMap<>(), new LinkedHashSet<>());
        moveSubtree(this, rootId, detached);
        detached.rootIds.add(rootId);

        modCount++;
        log.log(Level.FINE, () -> "Removed subtree " + rootId + " (" + detached.size() + " instances)");
        return Optional.of(detached);
    }

    /**
     * Move the instance {@code sourceId} and all of its descendants out of
     * {@code sourceTree} and into this tree, under {@code newParentId}
     * (or as a new root if it is null).
     * <p>
     * Only the moved instance's parent changes; descendants keep their
     * parents and every child list keeps its order. {@code sourceTree} may be
     * this tree, which re-parents the subtree in place.
     *
     * @throws IllegalArgumentException if {@code sourceId} is not in {@code sourceTree},
     *         {@code newParentId} is not in this tree, or the move would make an
     *         instance its own ancestor. Neither tree is changed in that case.
     */
    public void transplant(InstanceTree<P> sourceTree, InstanceId sourceId, InstanceId newParentId) {
        Objects.requireNonNull(sourceTree, "sourceTree");
        Objects.requireNonNull(sourceId, "sourceId");

        RootedInstance<P> top = sourceTree.instances.get(sourceId);
        if (top == null) {
            throw new IllegalArgumentException("Cannot transplant " + sourceId + ": not in source tree");
        }
        if (newParentId != null && !instances.containsKey(newParentId)) {
            throw new IllegalArgumentException("Cannot transplant into parent " + newParentId + ": not in this tree");
        }
        if (sourceTree == this && newParentId != null && isSelfOrAncestor(sourceId, newParentId)) {
            throw new IllegalArgumentException(
                    "Cannot transplant " + sourceId + " under " + newParentId + ": would create a cycle");
        }

        sourceTree.unlink(top);
        int moved = moveSubtree(sourceTree, sourceId, this);

        top.setParent(newParentId);
        if (newParentId != null) {
            instances.get(newParentId).children().add(sourceId);
        } else {
            rootIds.add(sourceId);
        }

        sourceTree.modCount++;
        modCount++;
        log.log(Level.FINE, () -> "Transplanted " + sourceId + " (" + moved + " instances) under "
                + (newParentId == null ? "<root>" : newParentId));
    }

    /**
     * Walk the instance {@code id} and everything below it, the instance
     * itself first. Siblings come in reverse child-list order.
     */
    public Descendants<P> descendants(InstanceId id) {
        return descendants(id, TraversalOrder.REVERSE_CHILD_ORDER);
    }

    /** Walk the instance {@code id} and everything below it, in the given sibling order. */
    public Descendants<P> descendants(InstanceId id, TraversalOrder order) {
        return new Descendants<>(this, id, order);
    }

    // ---------- package-private hooks ----------

    RootedInstance<P> lookup(InstanceId id) { return instances.get(id); }

    int modCount() { return modCount; }

    /**
     * Verify the structural invariants.
     *
     * @throws IllegalStateException describing the first violation found
     */
    void checkInvariants() {
        for (var e : instances.entrySet()) {
            InstanceId id = e.getKey();
            RootedInstance<P> inst = e.getValue();
            if (!id.equals(inst.id())) throw new IllegalStateException("map key " + id + " holds " + inst.id());

            InstanceId parentId = inst.parent();
            if (parentId == null) {
                if (!rootIds.contains(id)) throw new IllegalStateException("parentless " + id + " missing from roots");
            } else {
                RootedInstance<P> parent = instances.get(parentId);
                if (parent == null) throw new IllegalStateException(id + " has dangling parent " + parentId);
                if (!parent.children().contains(id)) throw new IllegalStateException(parentId + " does not list child " + id);
                if (rootIds.contains(id)) throw new IllegalStateException("parented " + id + " listed as root");
            }

            Set<InstanceId> seen = new LinkedHashSet<>();
            for (InstanceId childId : inst.children()) {
                if (!seen.add(childId)) throw new IllegalStateException(id + " lists child " + childId + " twice");
                RootedInstance<P> child = instances.get(childId);
                if (child == null) throw new IllegalStateException(id + " lists dangling child " + childId);
                if (!id.equals(child.parent())) throw new IllegalStateException(childId + " does not point back at " + id);
            }
        }
        for (InstanceId rootId : rootIds) {
            if (!instances.containsKey(rootId)) throw new IllegalStateException("root " + rootId + " not in tree");
        }
        // Every parent chain must end at a root within size() steps.
        for (InstanceId id : instances.keySet()) {
            InstanceId cur = id;
            int steps = 0;
            while (cur != null) {
                if (steps++ > instances.size()) throw new IllegalStateException("cycle through " + id);
                cur = instances.get(cur).parent();
            }
        }
    }

    // ---------- helpers ----------

    /** Cut the link between an instance and its parent (or the root set). */
    private void unlink(RootedInstance<P> instance) {
        InstanceId parentId = instance.parent();
        if (parentId == null) {
            rootIds.remove(instance.id());
            return;
        }
        RootedInstance<P> parent = instances.get(parentId);
        if (parent == null) {
            throw new IllegalStateException("Parent " + parentId + " of " + instance.id() + " is not in this tree");
        }
        int index = parent.children().indexOf(instance.id());
        if (index < 0) {
            throw new IllegalStateException("Parent " + parentId + " does not list child " + instance.id());
        }
        parent.children().remove(index);
        instance.setParent(null);
    }

    /**
     * Move {@code rootId} and every instance reachable through child lists
     * from {@code from}'s map into {@code into}'s map.
     * <p>
     * Each instance's child list is read before the instance is handed over,
     * so the pending set of descendants is never lost. Ids that no longer
     * resolve are skipped, and an instance is moved at most once.
     *
     * @return number of instances moved
     */
    private static <P> int moveSubtree(InstanceTree<P> from, InstanceId rootId, InstanceTree<P> into) {
        Deque<InstanceId> toVisit = new ArrayDeque<>();
        toVisit.push(rootId);
        int moved = 0;

        while (!toVisit.isEmpty()) {
            InstanceId id = toVisit.pop();
            RootedInstance<P> instance = from.instances.remove(id);
            if (instance == null) {
                continue;
            }
            for (InstanceId childId : instance.children()) {
                toVisit.push(childId);
            }
            into.instances.put(id, instance);
            moved++;
        }
        return moved;
    }

    /** True if {@code candidate} is {@code id} itself or one of its ancestors. */
    private boolean isSelfOrAncestor(InstanceId candidate, InstanceId id) {
        for (InstanceId cur = id; cur != null; ) {
            if (cur.equals(candidate)) return true;
            RootedInstance<P> inst = instances.get(cur);
            cur = inst == null ? null : inst.parent();
        }
        return false;
    }
}
