package com.acl.ptree;

import com.acl.ptree.api.TreeOperationException;
import com.acl.ptree.api.Visibility;
import com.acl.ptree.engine.PermissionTree;
import com.acl.ptree.util.TreeExplain;

import lombok.extern.log4j.Log4j2;

/**
 * Walks through connecting, moving and rejecting moves on a small tree.
 */
@Log4j2
public class PermissionTreeDemo {

    public static void main(String[] args) {
        log.info("Starting Permission Tree Demo...");

        PermissionTree<Integer> tree = new PermissionTree<>();
        var explain = new TreeExplain<>(tree);

        // 1. Nodes with their own visibility
        tree.addNode(1, Visibility.PUBLIC);
        tree.addNode(2, Visibility.PUBLIC);
        tree.addNode(3, Visibility.PRIVATE);
        tree.addNode(4, Visibility.PUBLIC);
        tree.addNode(5, Visibility.PUBLIC);
        tree.addNode(6, Visibility.PUBLIC);
        tree.addTag(1, "root");
        tree.addTag(2, "important");

        // 2. Wiring
        tree.connectNodes(1, 2);
        tree.connectNodes(1, 3);
        tree.connectNodes(2, 4);
        tree.connectNodes(2, 5);

        // Node 6 is public but lands under private node 3
        tree.connectNodes(3, 6);

        log.info("Initial tree:\n{}", explain.printTree(1));

        // 3. Move the public subtree 2 under private node 3
        tree.moveSubtree(2, 3);
        log.info("Tree after moving subtree rooted at node 2 under node 3:\n{}", explain.printTree(1));
        log.info("Effective tags of node 4: {}", tree.effectiveTags(4));

        // 4. Node 6 is a descendant of 3, so this must be rejected
        try {
            tree.moveSubtree(3, 6);
        } catch (TreeOperationException e) {
            log.warn("Move rejected ({}): {}", e.kind(), e.getMessage());
        }

        log.info("Final state:\n{}", explain.dumpTree());
        log.info("Demo complete.");
    }
}
