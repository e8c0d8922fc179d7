package com.acl.ptree.api;

/** Classification of a rejected tree operation. */
public enum ErrorKind {
    /** addNode with an identifier that already exists. */
    DUPLICATE_ID,
    /** An operation referenced an unknown identifier. */
    NOT_FOUND,
    /** connectNodes on a node that already has a parent; use moveSubtree. */
    ALREADY_HAS_PARENT,
    /** The connection or move would make a node its own ancestor. */
    CYCLE_DETECTED
}
