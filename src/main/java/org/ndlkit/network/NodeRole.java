package org.ndlkit.network;

/**
 * The role sets a network node can be a member of.
 */
public enum NodeRole {
    FEATURE,
    LABEL,
    FINAL_CRITERION,
    EVALUATION,
    OUTPUT
}
