package io.surfworks.tessera.types;

/**
 * A value known at graph-build time. It may still contain {@link Symbol} elements,
 * in which case it is symbolic rather than fully materialized.
 */
public sealed interface ConstValue permits TensorValue, ListValue {

    /**
     * True if any element of this value is an unresolved symbol.
     */
    boolean isSymbolic();
}
