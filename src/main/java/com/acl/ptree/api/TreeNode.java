package com.acl.ptree.api;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a node owned by a PermissionTree.
 *
 * Views are live: they reflect later mutations of the owning tree. The
 * collections returned are unmodifiable; the only way to change a node is
 * through the tree's operations, so the invariants can never be bypassed.
 *
 * @param <K> The caller-supplied identifier type.
 */
public interface TreeNode<K> {

    /** Returns the caller-supplied identifier of this node. */
    K id();

    /**
     * Returns the stored visibility. Propagation is eager, so this is also the
     * effective visibility.
     */
    Visibility visibility();

    /** Tags added directly to this node, in insertion order. */
    Set<String> ownTags();

    /** Own tags plus the own tags of every ancestor. */
    Set<String> effectiveTags();

    /**
     * Returns the identifier of the parent.
     *
     * @return The parent id, or null if this node is a root.
     */
    K parent();

    /** Children identifiers in connection order. */
    List<K> children();

    default boolean isRoot() {
        return parent() == null;
    }
}
