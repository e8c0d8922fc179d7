package com.acl.ptree.engine;

import com.acl.ptree.api.*;
import com.acl.ptree.util.TreeExplain;
import com.acl.ptree.util.TreeInvariants;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class MoveSubtreeTest {

    private PermissionTree<Integer> tree;

    // 1(Public, root) -> 2(Public, important) -> 4, 5
    //                 -> 3(Private)
    @Before
    public void setUp() {
        tree = new PermissionTree<>();
        tree.addNode(1, Visibility.PUBLIC);
        tree.addNode(2, Visibility.PUBLIC);
        tree.addNode(3, Visibility.PRIVATE);
        tree.addNode(4, Visibility.PUBLIC);
        tree.addNode(5, Visibility.PUBLIC);
        tree.addTag(1, "root");
        tree.addTag(2, "important");
        tree.connectNodes(1, 2);
        tree.connectNodes(1, 3);
        tree.connectNodes(2, 4);
        tree.connectNodes(2, 5);
    }

    @Test
    public void testInitialScenarioState() {
        assertEquals(Set.of("root", "important"), tree.effectiveTags(4));
        assertEquals(Set.of("root", "important"), tree.effectiveTags(5));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(1));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(2));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(3));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(4));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(5));
    }

    @Test
    public void testMoveUnderPrivateNode() {
        tree.addTag(3, "secret");

        tree.moveSubtree(2, 3);

        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(2));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(4));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(5));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(1));

        assertEquals(List.of(3), tree.childrenOf(1));
        assertEquals(List.of(2), tree.childrenOf(3));
        assertEquals(Optional.of(3), tree.parentOf(2));

        assertTrue(tree.effectiveTags(2).contains("secret"));
        assertEquals(Set.of("root", "secret", "important"), tree.effectiveTags(4));
        TreeInvariants.check(tree);
    }

    @Test
    public void testMoveUnderOwnDescendantIsRejected() {
        String before = new TreeExplain<>(tree).dumpTree();
        try {
            tree.moveSubtree(1, 4);
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(ErrorKind.CYCLE_DETECTED, e.kind());
        }
        assertEquals(before, new TreeExplain<>(tree).dumpTree());
        assertEquals(Optional.empty(), tree.parentOf(1));
        assertEquals(List.of(2, 3), tree.childrenOf(1));
    }

    @Test
    public void testMoveUnderDirectChildIsRejected() {
        tree.addNode(6, Visibility.PUBLIC);
        tree.connectNodes(3, 6);

        try {
            tree.moveSubtree(3, 6);
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(3, e.nodeId());
        }
        assertEquals(List.of(2, 3), tree.childrenOf(1));
        assertFalse(tree.childrenOf(6).contains(3));
    }

    @Test(expected = CycleDetectedException.class)
    public void testMoveUnderItself() {
        tree.moveSubtree(2, 2);
    }

    @Test
    public void testMoveUnknownNodes() {
        try {
            tree.moveSubtree(2, 42);
            fail("Expected NodeNotFoundException");
        } catch (NodeNotFoundException e) {
            assertEquals(42, e.nodeId());
        }
        try {
            tree.moveSubtree(42, 2);
            fail("Expected NodeNotFoundException");
        } catch (NodeNotFoundException e) {
            assertEquals(42, e.nodeId());
        }
        assertEquals(List.of(4, 5), tree.childrenOf(2));
    }

    @Test
    public void testMoveToCurrentParentIsNoOp() {
        String before = new TreeExplain<>(tree).dumpTree();

        tree.moveSubtree(4, 2);

        // Order is untouched: 4 is not re-appended after 5
        assertEquals(List.of(4, 5), tree.childrenOf(2));
        assertEquals(before, new TreeExplain<>(tree).dumpTree());
    }

    @Test
    public void testMoveAppendsToNewParentChildren() {
        tree.moveSubtree(4, 1);

        assertEquals(List.of(2, 3, 4), tree.childrenOf(1));
        assertEquals(List.of(5), tree.childrenOf(2));
        assertEquals(Set.of("root"), tree.effectiveTags(4));
        TreeInvariants.check(tree);
    }

    @Test
    public void testMoveRootUnderAnotherTree() {
        tree.addNode(10, Visibility.PRIVATE);
        tree.addNode(11, Visibility.PUBLIC);
        tree.addTag(11, "orphan");

        tree.moveSubtree(11, 4);

        assertEquals(Optional.of(4), tree.parentOf(11));
        assertEquals(Set.of("root", "important", "orphan"), tree.effectiveTags(11));
        assertEquals(Visibility.PUBLIC, tree.effectiveVisibility(11));

        tree.moveSubtree(1, 10);
        for (int id : List.of(1, 2, 3, 4, 5, 11))
            assertEquals("node " + id, Visibility.PRIVATE, tree.effectiveVisibility(id));
        TreeInvariants.check(tree);
    }

    @Test
    public void testPrivateStaysPrivateWhenMovedUnderPublic() {
        tree.moveSubtree(2, 3);
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(4));

        tree.moveSubtree(2, 1);

        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(2));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(4));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(5));
    }

    @Test
    public void testTagsFollowNewAncestry() {
        tree.addNode(6, Visibility.PUBLIC);
        tree.addTag(6, "archive");

        tree.moveSubtree(2, 6);

        assertEquals(Set.of("archive", "important"), tree.effectiveTags(4));
        assertEquals(Set.of("important"), tree.getNode(2).ownTags());
        TreeInvariants.check(tree);
    }

    @Test
    public void testDetachKeepsVisibilityAndOwnTags() {
        tree.moveSubtree(2, 3);

        tree.detach(2);

        assertTrue(tree.getNode(2).isRoot());
        assertEquals(List.of(3), tree.childrenOf(1));
        assertTrue(tree.childrenOf(3).isEmpty());
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(2));
        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(4));
        assertEquals(Set.of("important"), tree.effectiveTags(2));
        assertEquals(Set.of("important"), tree.effectiveTags(5));
        assertEquals(List.of(1, 2), tree.roots());
        TreeInvariants.check(tree);
    }

    @Test
    public void testDetachRootIsNoOp() {
        tree.detach(1);

        assertEquals(List.of(1), tree.roots());
        assertEquals(List.of(2, 3), tree.childrenOf(1));
    }

    @Test(expected = NodeNotFoundException.class)
    public void testDetachUnknownNode() {
        tree.detach(99);
    }

    @Test
    public void testMoveThenConnectPreviouslyDetachedNode() {
        tree.detach(4);
        tree.connectNodes(3, 4);

        assertEquals(Visibility.PRIVATE, tree.effectiveVisibility(4));
        assertEquals(Set.of("root"), tree.effectiveTags(4));
    }
}
