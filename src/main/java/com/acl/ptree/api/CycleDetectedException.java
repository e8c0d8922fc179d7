package com.acl.ptree.api;

/**
 * Thrown when a connect or move would place a node beneath itself or beneath
 * one of its own descendants.
 */
public final class CycleDetectedException extends TreeOperationException {
    private final Object nodeId;
    private final Object targetParentId;

    public CycleDetectedException(Object nodeId, Object targetParentId) {
        super(ErrorKind.CYCLE_DETECTED, nodeId.equals(targetParentId)
                ? "A node cannot be its own parent: " + nodeId
                : "Cannot place node " + nodeId + " under its own descendant " + targetParentId);
        this.nodeId = nodeId;
        this.targetParentId = targetParentId;
    }

    public Object nodeId() {
        return nodeId;
    }

    public Object targetParentId() {
        return targetParentId;
    }
}
