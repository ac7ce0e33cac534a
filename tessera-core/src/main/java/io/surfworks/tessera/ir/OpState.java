package io.surfworks.tessera.ir;

/**
 * Lifecycle of an {@link OperationNode}.
 */
public enum OpState {
    /** No slot bound */
    UNBOUND,
    /** Some, but not all, required slots bound */
    PARTIALLY_BOUND,
    /** Every required slot bound; outputs absent, or stale after a rebind */
    FULLY_BOUND,
    /** Outputs exist and agree with the current inputs */
    INFERRED,
    /** Removed from its container; terminal */
    DETACHED
}
