package com.acl.ptree.api;

public final class DuplicateNodeException extends TreeOperationException {
    private final Object nodeId;

    public DuplicateNodeException(Object nodeId) {
        super(ErrorKind.DUPLICATE_ID, "Node with ID " + nodeId + " already exists");
        this.nodeId = nodeId;
    }

    public Object nodeId() {
        return nodeId;
    }
}
