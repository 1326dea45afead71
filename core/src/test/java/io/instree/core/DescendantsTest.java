package io.instree.core;

import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DescendantsTest {

    /*
     *        root
     *       /    \
     *      a      b
     *     / \      \
     *   a1   a2     b1
     */
    private final InstanceTree<String> tree = new InstanceTree<>();
    private final InstanceId root = tree.insertInstance("root");
    private final InstanceId a = tree.insertInstance("a", root);
    private final InstanceId b = tree.insertInstance("b", root);
    private final InstanceId a1 = tree.insertInstance("a1", a);
    private final InstanceId a2 = tree.insertInstance("a2", a);
    private final InstanceId b1 = tree.insertInstance("b1", b);

    private static List<String> payloads(Descendants<String> walk) {
        return walk.stream().map(RootedInstance::payload).toList();
    }

    @Test
    void default_order_visits_last_child_first() {
        assertEquals(List.of("root", "b", "b1", "a", "a2", "a1"), payloads(tree.descendants(root)));
    }

    @Test
    void child_order_is_plain_preorder() {
        assertEquals(List.of("root", "a", "a1", "a2", "b", "b1"),
                payloads(tree.descendants(root, TraversalOrder.CHILD_ORDER)));
    }

    @Test
    void start_instance_comes_first_and_each_descendant_once() {
        var walk = tree.descendants(a);
        assertEquals(a, walk.next().id());

        var seen = new HashSet<InstanceId>();
        seen.add(a);
        walk.forEachRemaining(inst -> assertTrue(seen.add(inst.id()), "visited twice: " + inst.id()));
        assertEquals(Set.of(a, a1, a2), seen);
    }

    @Test
    void leaf_yields_only_itself() {
        assertEquals(List.of("b1"), payloads(tree.descendants(b1)));
    }

    @Test
    void unknown_start_yields_nothing() {
        var walk = tree.descendants(InstanceId.newUnique());
        assertFalse(walk.hasNext());
        assertThrows(NoSuchElementException.class, walk::next);
    }

    @Test
    void walk_is_single_pass() {
        var walk = tree.descendants(root);
        assertEquals(6, walk.stream().count());
        assertFalse(walk.hasNext());
    }

    @Test
    void structural_change_during_walk_fails_fast() {
        var walk = tree.descendants(root);
        walk.next();

        tree.insertInstance("late", root);

        assertThrows(ConcurrentModificationException.class, walk::hasNext);
        assertThrows(ConcurrentModificationException.class, walk::next);
    }

    @Test
    void removal_during_walk_fails_fast() {
        var walk = tree.descendants(root);
        tree.removeInstance(b);
        assertThrows(ConcurrentModificationException.class, walk::next);
    }

    @Test
    void payload_edit_during_walk_is_allowed() {
        var walk = tree.descendants(root, TraversalOrder.CHILD_ORDER);
        walk.next();
        tree.getInstance(b1).orElseThrow().setPayload("B1");

        assertEquals(List.of("a", "a1", "a2", "b", "B1"), payloads(walk));
    }
}
