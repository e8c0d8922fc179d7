package com.acl.ptree.api;

/**
 * Observability hook for structural changes of a PermissionTree.
 *
 * Callbacks run synchronously on the caller's thread after the mutation has
 * been applied and the invariants restored. Implementations should be cheap;
 * an exception thrown from a callback is logged by the tree and does not undo
 * the mutation.
 *
 * @param <K> The identifier type.
 */
public interface TreeListener<K> {

    /** Called after a node has been added to the store. */
    default void onNodeAdded(K id, Visibility visibility) {
    }

    /** Called after a new tag has been added to a node and pushed down. */
    default void onTagAdded(K id, String tag) {
    }

    /**
     * Called after a node has been attached to or moved under a parent.
     *
     * @param id          The subtree root.
     * @param oldParentId The previous parent, or null if the node was a root.
     * @param newParentId The new parent, or null if the node was detached.
     */
    default void onReparented(K id, K oldParentId, K newParentId) {
    }

    /**
     * Called once per node whose stored visibility flipped from PUBLIC to
     * PRIVATE, after the whole pass has finished. Descendants come in visiting
     * order; a node made private by markPrivate is reported after its subtree.
     */
    default void onMadePrivate(K id) {
    }

    /**
     * Called at the end of every propagation pass.
     *
     * @param rootId       The subtree root the pass started from.
     * @param visitedCount Number of nodes visited, including the root.
     */
    default void onPropagated(K rootId, int visitedCount) {
    }
}
