package io.instree.core;

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass walk over an instance and all of its descendants.
 * <p>
 * Algorithm:
 *  - Keep an explicit stack of ids to visit, seeded with the start id.
 *  - Pop an id. If it resolves, push its children and yield it.
 *    If it does not resolve, skip it.
 *  - Stop when the stack is empty.
 * <p>
 * The start instance is always the first item when it exists. Sibling order
 * is controlled by {@link TraversalOrder}.
 * <p>
 * The walk reads the tree as it goes and does not copy it. Any structural
 * change of the tree after the walk was created makes the next call to
 * {@link #hasNext()} or {@link #next()} throw {@link ConcurrentModificationException}.
 */
public final class Descendants<P> implements Iterator<RootedInstance<P>> {
    private final InstanceTree<P> tree;
    private final TraversalOrder order;
    private final Deque<InstanceId> idsToVisit = new ArrayDeque<>();
    private final int expectedModCount;

    // Next instance to hand out, resolved ahead of time by hasNext().
    private RootedInstance<P> pending;

    Descendants(InstanceTree<P> tree, InstanceId startId, TraversalOrder order) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.order = Objects.requireNonNull(order, "order");
        this.idsToVisit.push(Objects.requireNonNull(startId, "startId"));
        this.expectedModCount = tree.modCount();
    }

    @Override
    public boolean hasNext() {
        checkForComodification();
        while (pending == null && !idsToVisit.isEmpty()) {
            InstanceId id = idsToVisit.pop();
            RootedInstance<P> instance = tree.lookup(id);
            if (instance == null) {
                continue;
            }
            pushChildren(instance.children());
            pending = instance;
        }
        return pending != null;
    }

    @Override
    public RootedInstance<P> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RootedInstance<P> out = pending;
        pending = null;
        return out;
    }

    /** One-shot stream view over the remaining items of this walk. */
    public Stream<RootedInstance<P>> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private void pushChildren(List<InstanceId> children) {
        if (order == TraversalOrder.REVERSE_CHILD_ORDER) {
            for (InstanceId childId : children) {
                idsToVisit.push(childId);
            }
        } else {
            for (int i = children.size() - 1; i >= 0; i--) {
                idsToVisit.push(children.get(i));
            }
        }
    }

    private void checkForComodification() {
        if (tree.modCount() != expectedModCount) {
            throw new ConcurrentModificationException("InstanceTree was structurally modified during traversal");
        }
    }
}
