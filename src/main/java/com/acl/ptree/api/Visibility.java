package com.acl.ptree.api;

/**
 * Two-level visibility lattice carried by every tree node.
 *
 * PRIVATE dominates PUBLIC: once any node on the path from a root is PRIVATE,
 * everything below it is PRIVATE as well.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE;

    /**
     * Least upper bound of the two values.
     *
     * @param other The inherited visibility.
     * @return PRIVATE if either operand is PRIVATE, PUBLIC otherwise.
     */
    public Visibility join(Visibility other) {
        return this == PRIVATE || other == PRIVATE ? PRIVATE : PUBLIC;
    }

    public boolean isPrivate() {
        return this == PRIVATE;
    }

    /** Display name used by tree dumps, e.g. "Private". */
    public String displayName() {
        return this == PRIVATE ? "Private" : "Public";
    }
}
