package com.acl.ptree.engine;

import com.acl.ptree.api.Visibility;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Downward propagation of effective state into a subtree.
 *
 * Given a subtree root and the baseline inherited from its position, every node
 * in the subtree is visited once:
 * 1. Visibility: stored visibility is joined with the inherited one. PRIVATE is
 * sticky, so a node never goes back to PUBLIC.
 * 2. Tags: the materialized effective tag set is rebuilt as own tags unioned
 * with the inherited set.
 * 3. Children inherit the node's updated state, so the effect compounds down
 * the chain.
 *
 * The traversal uses an explicit stack rather than recursion, so list-shaped
 * trees of any depth are handled without exhausting the call stack.
 */
final class Propagation {

    private Propagation() {
    }

    /**
     * Pushes the baseline into the subtree rooted at {@code root}.
     *
     * @param nodes         The tree's node store, used to resolve child ids.
     * @param root          Subtree root.
     * @param inheritedVis  Effective visibility of the root's new position.
     * @param inheritedTags Effective tags of the root's new position.
     * @param onMadePrivate Receives the id of every node flipped to PRIVATE, in
     *                      visiting order, while the pass is still running.
     * @return Number of nodes visited, root included.
     */
    static <K> int propagate(Map<K, TreeNodeState<K>> nodes, TreeNodeState<K> root,
            Visibility inheritedVis, Set<String> inheritedTags, Consumer<K> onMadePrivate) {
        apply(root, inheritedVis, inheritedTags, onMadePrivate);
        int visited = 1;

        Deque<TreeNodeState<K>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNodeState<K> parent = stack.pop();
            List<K> children = parent.childrenInternal();
            for (int i = children.size() - 1; i >= 0; i--) {
                TreeNodeState<K> child = nodes.get(children.get(i));
                apply(child, parent.visibility(), parent.effectiveTagsInternal(), onMadePrivate);
                visited++;
                stack.push(child);
            }
        }
        return visited;
    }

    private static <K> void apply(TreeNodeState<K> node, Visibility inheritedVis, Set<String> inheritedTags,
            Consumer<K> onMadePrivate) {
        Visibility joined = node.visibility().join(inheritedVis);
        if (joined != node.visibility()) {
            node.setVisibility(joined);
            onMadePrivate.accept(node.id());
        }
        node.rebuildEffectiveTags(inheritedTags);
    }
}
