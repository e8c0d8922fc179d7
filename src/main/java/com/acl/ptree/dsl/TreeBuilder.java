package com.acl.ptree.dsl;

import com.acl.ptree.api.Visibility;
import com.acl.ptree.engine.PermissionTree;

/**
 * Tree Builder -- fluent API for assembling a {@link PermissionTree} in code.
 *
 * Usage Pattern:
 * 1. Create a builder: TreeBuilder<Integer> b = TreeBuilder.create();
 * 2. Declare nodes: b.publicNode(1).privateNode(2);
 * 3. Tag and connect: b.tag(1, "root").connect(1, 2);
 * 4. Build: PermissionTree<Integer> tree = b.build();
 *
 * Each step is applied to the underlying tree immediately, so errors surface
 * at the offending call with the same exceptions the tree throws.
 */
public final class TreeBuilder<K> {
    private final PermissionTree<K> tree = new PermissionTree<>();

    // Flag to prevent modification after building
    private boolean built;

    private TreeBuilder() {
    }

    public static <K> TreeBuilder<K> create() {
        return new TreeBuilder<>();
    }

    public TreeBuilder<K> node(K id, Visibility visibility) {
        checkNotBuilt();
        tree.addNode(id, visibility);
        return this;
    }

    public TreeBuilder<K> publicNode(K id) {
        return node(id, Visibility.PUBLIC);
    }

    public TreeBuilder<K> privateNode(K id) {
        return node(id, Visibility.PRIVATE);
    }

    /** Adds one or more tags to a declared node. */
    public TreeBuilder<K> tag(K id, String... tags) {
        checkNotBuilt();
        for (String tag : tags)
            tree.addTag(id, tag);
        return this;
    }

    /** Connects each child under the parent, in argument order. */
    @SafeVarargs
    public final TreeBuilder<K> connect(K parentId, K... childIds) {
        checkNotBuilt();
        for (K child : childIds)
            tree.connectNodes(parentId, child);
        return this;
    }

    /**
     * Finishes construction.
     *
     * @throws IllegalStateException if called twice.
     */
    public PermissionTree<K> build() {
        checkNotBuilt();
        built = true;
        return tree;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Tree already built");
    }
}
