package com.acl.ptree.api;

/**
 * Callback for depth-first traversal of a PermissionTree.
 *
 * Nodes are delivered parent before children, children in connection order.
 * Visitors must not mutate the tree they are visiting.
 *
 * @param <K> The identifier type.
 */
@FunctionalInterface
public interface TreeVisitor<K> {

    /**
     * @param node  The visited node.
     * @param depth Distance from the root the traversal started at (0 for that
     *              root).
     */
    void visit(TreeNode<K> node, int depth);
}
