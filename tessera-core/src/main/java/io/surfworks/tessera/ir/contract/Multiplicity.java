package io.surfworks.tessera.ir.contract;

/**
 * How many value nodes an input slot binds.
 */
public enum Multiplicity {
    /** Exactly one value node */
    SINGLE,
    /** An ordered sequence of value nodes */
    TUPLE
}
