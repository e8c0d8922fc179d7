package com.acl.ptree.engine;

import com.acl.ptree.api.*;

import java.util.*;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Permission tree -- an arena of nodes carrying visibility and tags.
 *
 * The tree exclusively owns every node; parent and child links are identifiers
 * resolved through the store, never direct references. It may hold any number
 * of disconnected roots at once.
 *
 * Invariants restored before every public operation returns:
 * 1. Forest: the parent/child graph is acyclic and each node has at most one
 * parent.
 * 2. Sticky privacy: a PRIVATE node never becomes PUBLIC again.
 * 3. Eager closure: every descendant of a PRIVATE node is stored as PRIVATE.
 * 4. Tag union: a node's effective tags are its own tags plus the own tags of
 * every strict ancestor.
 *
 * Every structural operation validates completely before mutating anything, so
 * a rejected call (see {@link TreeOperationException}) leaves the tree exactly
 * as it was.
 *
 * Thread Safety:
 * Not thread-safe. The tree is designed for a single writer; callers sharing an
 * instance must guard every call, reads included, with one exclusive lock,
 * otherwise a reader can observe a partially propagated subtree.
 *
 * @param <K> Caller-supplied identifier type. Compared with equals/hashCode.
 */
@Log4j2
public final class PermissionTree<K> {
    private static final Set<String> NO_TAGS = Collections.emptySet();

    // Insertion-ordered so roots and dumps come out in creation order.
    private final Map<K, TreeNodeState<K>> nodes = new LinkedHashMap<>();

    private TreeListener<K> listener;

    public void setListener(TreeListener<K> listener) {
        this.listener = listener;
    }

    // ── Store ────────────────────────────────────────────────────

    /**
     * Creates a parentless, childless, untagged node.
     *
     * @param id         Unique identifier.
     * @param visibility Own visibility of the new node.
     * @return Read-only view of the created node.
     * @throws DuplicateNodeException if the id is already in use.
     */
    public TreeNode<K> addNode(K id, Visibility visibility) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(visibility, "visibility");
        if (nodes.containsKey(id)) {
            log.debug("Rejected addNode: node {} already exists", id);
            throw new DuplicateNodeException(id);
        }
        TreeNodeState<K> node = new TreeNodeState<>(id, visibility);
        nodes.put(id, node);
        log.debug("Node {} added with {} visibility", id, visibility);
        notifyListener(l -> l.onNodeAdded(id, visibility));
        return node;
    }

    /**
     * Returns a live, read-only view of a node.
     *
     * @throws NodeNotFoundException if the id is unknown.
     */
    public TreeNode<K> getNode(K id) {
        return require(id);
    }

    public boolean contains(K id) {
        return id != null && nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes in creation order. */
    public Collection<TreeNode<K>> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Identifiers of every parentless node, in creation order. */
    public List<K> roots() {
        List<K> roots = new ArrayList<>();
        for (TreeNodeState<K> node : nodes.values())
            if (node.parent() == null)
                roots.add(node.id());
        return roots;
    }

    // ── Tags and visibility ──────────────────────────────────────

    /**
     * Adds a tag to a node's own tag set. Idempotent.
     *
     * A new tag is pushed down immediately, so descendants that are already
     * attached see it in their effective tags as soon as this call returns.
     *
     * @throws NodeNotFoundException    if the id is unknown.
     * @throws IllegalArgumentException if the tag is blank.
     */
    public void addTag(K id, String tag) {
        TreeNodeState<K> node = require(id);
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank())
            throw new IllegalArgumentException("Tag must not be blank");
        if (!node.addOwnTag(tag))
            return;
        log.debug("Tag '{}' added to node {}", tag, id);
        repropagate(node);
        notifyListener(l -> l.onTagAdded(id, tag));
    }

    /**
     * Makes a node PRIVATE and pushes that down its subtree. Idempotent; there
     * is no inverse operation since PRIVATE is sticky.
     *
     * @throws NodeNotFoundException if the id is unknown.
     */
    public void markPrivate(K id) {
        TreeNodeState<K> node = require(id);
        if (node.visibility().isPrivate())
            return;
        node.setVisibility(Visibility.PRIVATE);
        log.debug("Node {} marked private", id);
        repropagate(node);
        notifyListener(l -> l.onMadePrivate(id));
    }

    // ── Structure ────────────────────────────────────────────────

    /**
     * Attaches {@code childId} as the last child of {@code parentId}.
     *
     * The child's subtree then inherits the parent's effective visibility and
     * effective tags.
     *
     * @throws NodeNotFoundException      if either id is unknown.
     * @throws AlreadyHasParentException  if the child is already attached;
     *                                    re-parenting goes through
     *                                    {@link #moveSubtree}.
     * @throws CycleDetectedException     if the parent is the child itself or
     *                                    one of its descendants.
     */
    public void connectNodes(K parentId, K childId) {
        TreeNodeState<K> parent = require(parentId);
        TreeNodeState<K> child = require(childId);
        if (child.parent() != null) {
            log.debug("Rejected connect {} -> {}: child already has parent {}", parentId, childId, child.parent());
            throw new AlreadyHasParentException(childId, child.parent());
        }
        checkNoCycle(child, parent);

        link(parent, child);
        log.debug("Node {} connected as child of {}", childId, parentId);
        propagateFrom(child, parent.visibility(), parent.effectiveTagsInternal());
        notifyListener(l -> l.onReparented(childId, null, parentId));
    }

    /**
     * Moves the subtree rooted at {@code nodeId} under {@code newParentId},
     * appending it to the new parent's children.
     *
     * Moving a node to its current parent is a no-op: nothing changes, not even
     * the order of the parent's children.
     *
     * @throws NodeNotFoundException  if either id is unknown.
     * @throws CycleDetectedException if the new parent is the node itself or
     *                                one of its descendants.
     */
    public void moveSubtree(K nodeId, K newParentId) {
        TreeNodeState<K> node = require(nodeId);
        TreeNodeState<K> newParent = require(newParentId);
        checkNoCycle(node, newParent);

        K oldParentId = node.parent();
        if (newParentId.equals(oldParentId)) {
            log.debug("Node {} is already a child of {}; move skipped", nodeId, newParentId);
            return;
        }
        if (oldParentId != null)
            nodes.get(oldParentId).removeChild(nodeId);
        link(newParent, node);
        log.debug("Moved subtree rooted at node {} from {} to {}", nodeId, oldParentId, newParentId);
        propagateFrom(node, newParent.visibility(), newParent.effectiveTagsInternal());
        notifyListener(l -> l.onReparented(nodeId, oldParentId, newParentId));
    }

    /**
     * Detaches the subtree rooted at {@code nodeId}, making the node a root.
     *
     * Stored visibility and own tags are left as they are; a PRIVATE subtree
     * stays PRIVATE. Effective tags are rebuilt for the subtree so they only
     * reflect the ancestors it still has. Detaching a root does nothing.
     *
     * @throws NodeNotFoundException if the id is unknown.
     */
    public void detach(K nodeId) {
        TreeNodeState<K> node = require(nodeId);
        K oldParentId = node.parent();
        if (oldParentId == null)
            return;
        nodes.get(oldParentId).removeChild(nodeId);
        node.setParent(null);
        log.debug("Detached subtree rooted at node {} from {}", nodeId, oldParentId);
        // PUBLIC is the identity of join: only the tag cache changes.
        propagateFrom(node, Visibility.PUBLIC, NO_TAGS);
        notifyListener(l -> l.onReparented(nodeId, oldParentId, null));
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * Returns the visibility the node exhibits once ancestors are taken into
     * account. Propagation is eager, so this is the stored value.
     */
    public Visibility effectiveVisibility(K id) {
        return require(id).visibility();
    }

    /** Own tags plus those of every ancestor, as an immutable copy. */
    public Set<String> effectiveTags(K id) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(require(id).effectiveTagsInternal()));
    }

    public Optional<K> parentOf(K id) {
        return Optional.ofNullable(require(id).parent());
    }

    public List<K> childrenOf(K id) {
        return require(id).children();
    }

    /**
     * Tests whether {@code ancestorId} is a strict ancestor of {@code nodeId}.
     * Walks parent links upwards, so it costs O(depth of nodeId).
     *
     * @throws NodeNotFoundException if either id is unknown.
     */
    public boolean isDescendant(K ancestorId, K nodeId) {
        TreeNodeState<K> ancestor = require(ancestorId);
        return isStrictAncestor(ancestor, require(nodeId));
    }

    // ── Traversal ────────────────────────────────────────────────

    /**
     * Visits every node depth-first: roots in creation order, children in
     * connection order, parents before children. Depth is relative to each
     * root.
     */
    public void forEachDepthFirst(TreeVisitor<K> visitor) {
        for (TreeNodeState<K> node : nodes.values())
            if (node.parent() == null)
                walk(node, visitor);
    }

    /**
     * Visits the subtree rooted at {@code rootId} depth-first; the root is
     * delivered at depth 0 even if it has a parent.
     *
     * @throws NodeNotFoundException if the id is unknown.
     */
    public void forEachDepthFirst(K rootId, TreeVisitor<K> visitor) {
        walk(require(rootId), visitor);
    }

    private void walk(TreeNodeState<K> root, TreeVisitor<K> visitor) {
        Deque<Frame<K>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, 0));
        while (!stack.isEmpty()) {
            Frame<K> frame = stack.pop();
            visitor.visit(frame.node(), frame.depth());
            List<K> children = frame.node().childrenInternal();
            for (int i = children.size() - 1; i >= 0; i--)
                stack.push(new Frame<>(nodes.get(children.get(i)), frame.depth() + 1));
        }
    }

    private record Frame<K>(TreeNodeState<K> node, int depth) {
    }

    // ── Internals ────────────────────────────────────────────────

    private TreeNodeState<K> require(K id) {
        Objects.requireNonNull(id, "id");
        TreeNodeState<K> node = nodes.get(id);
        if (node == null)
            throw new NodeNotFoundException(id);
        return node;
    }

    private void checkNoCycle(TreeNodeState<K> node, TreeNodeState<K> target) {
        if (node == target || isStrictAncestor(node, target)) {
            log.debug("Rejected placing node {} under {}: cycle", node.id(), target.id());
            throw new CycleDetectedException(node.id(), target.id());
        }
    }

    private boolean isStrictAncestor(TreeNodeState<K> ancestor, TreeNodeState<K> node) {
        K current = node.parent();
        while (current != null) {
            if (current.equals(ancestor.id()))
                return true;
            current = nodes.get(current).parent();
        }
        return false;
    }

    private void link(TreeNodeState<K> parent, TreeNodeState<K> child) {
        parent.addChild(child.id());
        child.setParent(parent.id());
    }

    /** Re-runs propagation from a node using its current position as baseline. */
    private void repropagate(TreeNodeState<K> node) {
        K parentId = node.parent();
        if (parentId == null) {
            propagateFrom(node, Visibility.PUBLIC, NO_TAGS);
        } else {
            TreeNodeState<K> parent = nodes.get(parentId);
            propagateFrom(node, parent.visibility(), parent.effectiveTagsInternal());
        }
    }

    private void propagateFrom(TreeNodeState<K> root, Visibility inheritedVis, Set<String> inheritedTags) {
        List<K> madePrivate = new ArrayList<>();
        int visited = Propagation.propagate(nodes, root, inheritedVis, inheritedTags, madePrivate::add);
        // Callbacks only once the whole subtree is consistent.
        for (K id : madePrivate)
            notifyListener(l -> l.onMadePrivate(id));
        log.debug("Propagated {} visibility into {} node(s) under {}", inheritedVis, visited, root.id());
        notifyListener(l -> l.onPropagated(root.id(), visited));
    }

    private void notifyListener(Consumer<TreeListener<K>> callback) {
        TreeListener<K> l = this.listener;
        if (l == null)
            return;
        try {
            callback.accept(l);
        } catch (RuntimeException e) {
            log.error("Tree listener failed; mutation already applied", e);
        }
    }
}
