package io.surfworks.tessera.ir.infer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * How much is known about an input at graph-build time.
 */
public enum InputClass {
    /** Carries a concrete value */
    MATERIALIZED,
    /** Its type or value contains an unresolved symbol */
    SYMBOLIC,
    /** Neither a value nor a symbol is available */
    ABSENT;

    /** Every class; the tolerance of a value inference that accepts anything. */
    public static final Set<InputClass> ALL = Collections.unmodifiableSet(EnumSet.allOf(InputClass.class));
}
