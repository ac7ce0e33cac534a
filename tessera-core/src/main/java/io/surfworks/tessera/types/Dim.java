package io.surfworks.tessera.types;

/**
 * One axis of a tensor shape: either a concrete size or an unresolved symbol.
 */
public sealed interface Dim permits Dim.Fixed, Dim.Symbolic {

    boolean isSymbolic();

    /**
     * A concrete, non-negative axis size.
     */
    record Fixed(long size) implements Dim {
        public Fixed {
            if (size < 0) {
                throw new IllegalArgumentException("Dimension size must be non-negative: " + size);
            }
        }

        @Override
        public boolean isSymbolic() {
            return false;
        }

        @Override
        public String toString() {
            return Long.toString(size);
        }
    }

    /**
     * An axis whose size is not known at graph-build time.
     */
    record Symbolic(Symbol symbol) implements Dim {
        @Override
        public boolean isSymbolic() {
            return true;
        }

        @Override
        public String toString() {
            return symbol.name();
        }
    }

    static Dim of(long size) {
        return new Fixed(size);
    }

    static Dim of(String symbolName) {
        return new Symbolic(new Symbol(symbolName));
    }

    static Dim fresh() {
        return new Symbolic(Symbol.fresh());
    }
}
