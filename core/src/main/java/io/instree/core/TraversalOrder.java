package io.instree.core;

/**
 * Sibling visiting order of a {@link Descendants} walk.
 * <p>
 * Both orders are depth-first and yield a parent before any of its children:
 *  - REVERSE_CHILD_ORDER: children are pushed in list order and popped last in,
 *                         first out, so the last child is visited first.
 *                         This is the long-standing default.
 *  - CHILD_ORDER:         siblings are visited in child-list order
 *                         (plain pre-order).
 */
public enum TraversalOrder {
    REVERSE_CHILD_ORDER, CHILD_ORDER
}
