package org.ndlkit.network;

/**
 * What a node copy carries over.
 */
public enum CopyNodeFlags {
    /** Operation, attributes and gradient flag. */
    VALUE,
    /** Input connections only. */
    CHILDREN,
    /** Value and input connections. */
    ALL;

    public boolean copiesValue() {
        return this != CHILDREN;
    }

    public boolean copiesChildren() {
        return this != VALUE;
    }
}
