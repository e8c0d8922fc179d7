package com.acl.ptree.api;

public final class NodeNotFoundException extends TreeOperationException {
    private final Object nodeId;

    public NodeNotFoundException(Object nodeId) {
        super(ErrorKind.NOT_FOUND, "Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public Object nodeId() {
        return nodeId;
    }
}
