package io.surfworks.tessera.types;

/**
 * Predicates over types and values that may contain unresolved symbols.
 *
 * <p>The operation-node core only asks these three questions; richer symbolic
 * reasoning (simplification, constraint solving) lives behind this interface.
 */
public interface SymbolicAlgebra {

    /**
     * True if {@code x} is, or contains, an unresolved symbol. Accepts
     * {@link Symbol}, {@link Dim}, {@link SymbolicType} and {@link ConstValue};
     * anything else (including null) is concrete.
     */
    boolean isSymbolic(Object x);

    /**
     * True if a value of type {@code a} may stand where type {@code b} is declared.
     * Dimensions compare equal when either side is symbolic.
     */
    boolean typesCompatible(SymbolicType a, SymbolicType b);

    /**
     * Symbolic-tolerant array equality: same shape, and at every position either
     * side is a symbol or both elements are equal.
     */
    boolean arraysCompatible(ConstValue a, ConstValue b);
}
