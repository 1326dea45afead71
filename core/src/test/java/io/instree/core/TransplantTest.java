package io.instree.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TransplantTest {

    @Test
    void moves_whole_subtree_between_trees() {
        var source = new InstanceTree<String>();
        InstanceId top = source.insertInstance("top");
        InstanceId a = source.insertInstance("a", top);
        InstanceId b = source.insertInstance("b", top);
        InstanceId a1 = source.insertInstance("a1", a);
        InstanceId a2 = source.insertInstance("a2", a);
        InstanceId a1x = source.insertInstance("a1x", a1);

        var target = new InstanceTree<String>();
        InstanceId home = target.insertInstance("home");

        target.transplant(source, top, home);

        // Every descendant moved, not only the named instance.
        Set<InstanceId> moved = Set.of(top, a, b, a1, a2, a1x);
        for (InstanceId id : moved) {
            assertTrue(target.contains(id), "target should contain " + id);
            assertFalse(source.contains(id), "source should not contain " + id);
        }
        assertTrue(source.isEmpty());
        assertTrue(source.getRootIds().isEmpty());

        var reached = target.descendants(top).stream().map(RootedInstance::id).collect(Collectors.toSet());
        assertEquals(moved, reached);

        source.checkInvariants();
        target.checkInvariants();
    }

    @Test
    void only_moved_root_is_reparented_and_child_order_survives() {
        var source = new InstanceTree<String>();
        InstanceId top = source.insertInstance("top");
        InstanceId c1 = source.insertInstance("c1", top);
        InstanceId c2 = source.insertInstance("c2", top);
        InstanceId c3 = source.insertInstance("c3", top);
        InstanceId g = source.insertInstance("g", c2);

        var target = new InstanceTree<String>();
        InstanceId home = target.insertInstance("home");
        InstanceId existing = target.insertInstance("existing", home);

        target.transplant(source, top, home);

        assertEquals(List.of(existing, top), target.getInstance(home).orElseThrow().childIds());
        var moved = target.getInstance(top).orElseThrow();
        assertEquals(home, moved.parentId().orElseThrow());
        assertEquals("top", moved.payload());
        assertEquals(List.of(c1, c2, c3), moved.childIds());
        assertEquals(top, target.getInstance(c2).orElseThrow().parentId().orElseThrow());
        assertEquals(c2, target.getInstance(g).orElseThrow().parentId().orElseThrow());
        target.checkInvariants();
    }

    @Test
    void transplant_as_new_root() {
        var source = new InstanceTree<String>();
        InstanceId top = source.insertInstance("top");
        source.insertInstance("child", top);

        var target = new InstanceTree<String>();
        InstanceId existingRoot = target.insertInstance("existing");

        target.transplant(source, top, null);

        assertEquals(Set.of(existingRoot, top), target.getRootIds());
        assertTrue(target.getInstance(top).orElseThrow().isRoot());
        target.checkInvariants();
    }

    @Test
    void source_parent_no_longer_lists_moved_instance() {
        var source = new InstanceTree<String>();
        InstanceId root = source.insertInstance("root");
        InstanceId keep = source.insertInstance("keep", root);
        InstanceId leave = source.insertInstance("leave", root);
        source.insertInstance("leave-child", leave);

        var target = new InstanceTree<String>();
        target.transplant(source, leave, null);

        assertEquals(List.of(keep), source.getInstance(root).orElseThrow().childIds());
        assertEquals(2, source.size());
        source.checkInvariants();
        target.checkInvariants();
    }

    @Test
    void unknown_new_parent_is_rejected_before_anything_moves() {
        var source = new InstanceTree<String>();
        InstanceId top = source.insertInstance("top");
        source.insertInstance("child", top);
        var target = new InstanceTree<String>();

        assertThrows(IllegalArgumentException.class, () -> target.transplant(source, top, InstanceId.newUnique()));
        assertEquals(2, source.size());
        assertEquals(Set.of(top), source.getRootIds());
        assertTrue(target.isEmpty());
    }

    @Test
    void unknown_source_id_is_rejected() {
        var source = new InstanceTree<String>();
        var target = new InstanceTree<String>();

        assertThrows(IllegalArgumentException.class, () -> target.transplant(source, InstanceId.newUnique(), null));
    }

    @Test
    void reparent_within_same_tree() {
        var tree = new InstanceTree<String>();
        InstanceId root = tree.insertInstance("root");
        InstanceId a = tree.insertInstance("a", root);
        InstanceId b = tree.insertInstance("b", root);
        InstanceId a1 = tree.insertInstance("a1", a);

        tree.transplant(tree, a, b);

        assertEquals(List.of(b), tree.getInstance(root).orElseThrow().childIds());
        assertEquals(List.of(a), tree.getInstance(b).orElseThrow().childIds());
        assertEquals(List.of(a1), tree.getInstance(a).orElseThrow().childIds());
        assertEquals(4, tree.size());
        tree.checkInvariants();
    }

    @Test
    void moving_under_own_descendant_is_rejected() {
        var tree = new InstanceTree<String>();
        InstanceId root = tree.insertInstance("root");
        InstanceId a = tree.insertInstance("a", root);
        InstanceId a1 = tree.insertInstance("a1", a);

        assertThrows(IllegalArgumentException.class, () -> tree.transplant(tree, a, a1));
        assertThrows(IllegalArgumentException.class, () -> tree.transplant(tree, a, a));
        assertEquals(List.of(a), tree.getInstance(root).orElseThrow().childIds());
        tree.checkInvariants();
    }

    @Test
    void wide_and_deep_subtree_moves_completely() {
        var source = new InstanceTree<Integer>();
        InstanceId top = source.insertInstance(0);
        var all = new HashSet<InstanceId>();
        all.add(top);
        InstanceId chainTip = top;
        for (int i = 1; i <= 200; i++) {
            all.add(source.insertInstance(i, top));
            chainTip = source.insertInstance(-i, chainTip);
            all.add(chainTip);
        }

        var target = new InstanceTree<Integer>();
        target.transplant(source, top, null);

        assertEquals(all.size(), target.size());
        assertTrue(source.isEmpty());
        assertTrue(all.stream().allMatch(target::contains));
        target.checkInvariants();
    }
}
