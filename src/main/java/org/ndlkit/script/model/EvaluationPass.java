package org.ndlkit.script.model;

/**
 * The ordered evaluation passes.
 */
public enum EvaluationPass {
    /** Create nodes; forward references may stay unresolved. */
    INITIAL,
    /** Resolve references that were not yet defined during the initial pass. */
    RESOLVE,
    /** Final pass, after which the network is complete. */
    FINAL
}
