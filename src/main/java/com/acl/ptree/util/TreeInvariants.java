package com.acl.ptree.util;

import com.acl.ptree.api.TreeNode;
import com.acl.ptree.engine.PermissionTree;

import java.util.*;

/**
 * Independent checker for the structural and propagation invariants of a
 * {@link PermissionTree}. Recomputes everything from the raw parent links and
 * own tags rather than trusting the tree's materialized state.
 *
 * Cost is O(n * depth); meant for tests and debugging.
 */
public final class TreeInvariants {

    private TreeInvariants() {
    }

    /** Returns a description of every violated invariant; empty if the tree is consistent. */
    public static <K> List<String> violations(PermissionTree<K> tree) {
        List<String> problems = new ArrayList<>();

        // Forest: parent/child links agree, every node reachable from exactly one root.
        for (TreeNode<K> node : tree.nodes()) {
            for (K child : node.children()) {
                if (!tree.contains(child)) {
                    problems.add("Node " + node.id() + " lists unknown child " + child);
                } else if (!node.id().equals(tree.getNode(child).parent())) {
                    problems.add("Child " + child + " of " + node.id() + " points at parent "
                            + tree.getNode(child).parent());
                }
            }
            if (!node.isRoot() && (!tree.contains(node.parent())
                    || !tree.getNode(node.parent()).children().contains(node.id()))) {
                problems.add("Parent " + node.parent() + " does not list child " + node.id());
            }
        }
        Set<K> seen = new HashSet<>();
        tree.forEachDepthFirst((node, depth) -> {
            if (!seen.add(node.id()))
                problems.add("Node " + node.id() + " reached twice");
        });
        if (seen.size() != tree.size())
            problems.add("Only " + seen.size() + " of " + tree.size() + " nodes reachable from a root");
        if (!problems.isEmpty())
            return problems;

        for (TreeNode<K> node : tree.nodes()) {
            // Eager privacy closure.
            if (!node.isRoot() && tree.getNode(node.parent()).visibility().isPrivate()
                    && !node.visibility().isPrivate()) {
                problems.add("Node " + node.id() + " is PUBLIC under PRIVATE parent " + node.parent());
            }
            // Tag union over the ancestor chain.
            Set<String> expected = new HashSet<>(node.ownTags());
            for (K a = node.parent(); a != null; a = tree.getNode(a).parent())
                expected.addAll(tree.getNode(a).ownTags());
            if (!expected.equals(new HashSet<>(node.effectiveTags())))
                problems.add("Node " + node.id() + " effective tags " + node.effectiveTags()
                        + " but ancestry gives " + expected);
        }
        return problems;
    }

    /**
     * @throws IllegalStateException listing every violation, if there are any.
     */
    public static <K> void check(PermissionTree<K> tree) {
        List<String> problems = violations(tree);
        if (!problems.isEmpty())
            throw new IllegalStateException("Tree invariants violated: " + String.join("; ", problems));
    }
}
