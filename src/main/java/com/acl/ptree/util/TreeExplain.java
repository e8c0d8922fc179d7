package com.acl.ptree.util;

import com.acl.ptree.api.TreeNode;
import com.acl.ptree.engine.PermissionTree;

/**
 * Diagnostic utility for inspecting tree state.
 *
 * <p>
 * Generates human-readable text and Mermaid diagrams from the tree's
 * depth-first traversal. Intended for debugging and logging; every call walks
 * the tree and allocates strings.
 */
public final class TreeExplain<K> {
    private static final int INDENT_STEP = 4;

    private final PermissionTree<K> tree;

    public TreeExplain(PermissionTree<K> tree) {
        this.tree = tree;
    }

    /**
     * Renders one subtree, one line per node:
     * {@code "<indent>- node <id> (<Visibility>)"}, indented four spaces per
     * level.
     */
    public String printTree(K rootId) {
        StringBuilder sb = new StringBuilder(256);
        tree.forEachDepthFirst(rootId, (node, depth) -> appendLine(sb, node, depth));
        return sb.toString();
    }

    /** Same as {@link #printTree} for every root, in creation order. */
    public String printForest() {
        StringBuilder sb = new StringBuilder(256);
        tree.forEachDepthFirst((node, depth) -> appendLine(sb, node, depth));
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, TreeNode<?> node, int depth) {
        sb.append(" ".repeat(depth * INDENT_STEP))
                .append("- node ").append(node.id())
                .append(" (").append(node.visibility().displayName()).append(")\n");
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(K id) {
        TreeNode<K> node = tree.getNode(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.id()).append('\n')
                .append("  Visibility: ").append(node.visibility().displayName()).append('\n')
                .append("  Parent: ").append(node.isRoot() ? "(root)" : String.valueOf(node.parent())).append('\n')
                .append("  Own tags: ").append(node.ownTags()).append('\n')
                .append("  Effective tags: ").append(node.effectiveTags()).append('\n')
                .append("  Children (").append(node.children().size()).append("): ");
        sb.append(String.join(", ", node.children().stream().map(Object::toString).toList()));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole forest with visibility and effective tags.
     */
    public String dumpTree() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Tree (").append(tree.size()).append(" nodes, ")
                .append(tree.roots().size()).append(" roots):\n");
        tree.forEachDepthFirst((node, depth) -> sb.append("  ")
                .append(" ".repeat(depth * 2))
                .append(node.id())
                .append(node.visibility().isPrivate() ? " [PRIVATE]" : "")
                .append(node.effectiveTags().isEmpty() ? "" : " " + node.effectiveTags())
                .append('\n'));
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram. Private nodes are drawn with the
     * {@code private} class.
     */
    public String toMermaid() {
        StringBuilder nodes = new StringBuilder(1024);
        StringBuilder edges = new StringBuilder(1024);
        nodes.append("graph TD;\n");
        tree.forEachDepthFirst((node, depth) -> {
            String safeName = sanitize(node.id());
            nodes.append("  ").append(safeName).append("[\"").append(node.id())
                    .append("<br/>").append(node.visibility().displayName());
            if (!node.ownTags().isEmpty())
                nodes.append("<br/>").append(String.join(", ", node.ownTags()));
            nodes.append("\"];\n");
            if (node.visibility().isPrivate())
                nodes.append("  class ").append(safeName).append(" private;\n");
            if (!node.isRoot())
                edges.append("  ").append(sanitize(node.parent())).append(" --> ").append(safeName).append(";\n");
        });
        return nodes.append(edges).toString();
    }

    private static String sanitize(Object id) {
        return "n_" + String.valueOf(id).replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
