package com.acl.ptree.api;

/** Thrown by connectNodes when the child is already attached somewhere. */
public final class AlreadyHasParentException extends TreeOperationException {
    private final Object nodeId;
    private final Object currentParentId;

    public AlreadyHasParentException(Object nodeId, Object currentParentId) {
        super(ErrorKind.ALREADY_HAS_PARENT,
                "Node " + nodeId + " already has a parent (" + currentParentId + "); use moveSubtree");
        this.nodeId = nodeId;
        this.currentParentId = currentParentId;
    }

    public Object nodeId() {
        return nodeId;
    }

    public Object currentParentId() {
        return currentParentId;
    }
}
