package com.acl.ptree.engine;

import com.acl.ptree.api.*;

import java.util.*;

/**
 * Mutable per-node record owned by a {@link PermissionTree}.
 *
 * Nodes never reference each other directly: the parent back-reference and the
 * child list hold identifiers that are resolved through the owning tree. The
 * public {@link TreeNode} accessors hand out unmodifiable views; mutation is
 * confined to this package.
 */
final class TreeNodeState<K> implements TreeNode<K> {
    private final K id;
    private Visibility visibility;
    private final Set<String> ownTags = new LinkedHashSet<>();

    // Materialized union of own tags and every ancestor's own tags.
    // Rebuilt by Propagation whenever the ancestor chain or a tag changes.
    private final Set<String> effectiveTags = new LinkedHashSet<>();

    private K parent;
    private final List<K> children = new ArrayList<>();

    TreeNodeState(K id, Visibility visibility) {
        this.id = id;
        this.visibility = visibility;
    }

    @Override
    public K id() {
        return id;
    }

    @Override
    public Visibility visibility() {
        return visibility;
    }

    @Override
    public Set<String> ownTags() {
        return Collections.unmodifiableSet(ownTags);
    }

    @Override
    public Set<String> effectiveTags() {
        return Collections.unmodifiableSet(effectiveTags);
    }

    @Override
    public K parent() {
        return parent;
    }

    @Override
    public List<K> children() {
        return Collections.unmodifiableList(children);
    }

    void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    boolean addOwnTag(String tag) {
        return ownTags.add(tag);
    }

    /** Replaces the materialized effective tags with own tags unioned with the inherited set. */
    void rebuildEffectiveTags(Set<String> inherited) {
        effectiveTags.clear();
        effectiveTags.addAll(inherited);
        effectiveTags.addAll(ownTags);
    }

    Set<String> effectiveTagsInternal() {
        return effectiveTags;
    }

    void setParent(K parent) {
        this.parent = parent;
    }

    void addChild(K child) {
        children.add(child);
    }

    void removeChild(K child) {
        children.remove(child);
    }

    List<K> childrenInternal() {
        return children;
    }

    @Override
    public String toString() {
        return "TreeNode{id=" + id + ", visibility=" + visibility + ", ownTags=" + ownTags
                + ", parent=" + parent + ", children=" + children + '}';
    }
}
