package com.acl.ptree.api;

/**
 * Base class for rejected tree operations.
 *
 * A rejected operation never leaves a partial mutation behind: the tree is
 * validated completely before anything changes, so callers can retry, report
 * or ignore the failure.
 */
public abstract class TreeOperationException extends RuntimeException {
    private final ErrorKind kind;

    protected TreeOperationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
