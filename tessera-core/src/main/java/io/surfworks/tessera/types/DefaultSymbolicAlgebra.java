package io.surfworks.tessera.types;

import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;

import java.util.List;

/**
 * Structural implementation of {@link SymbolicAlgebra}: a symbol is compatible
 * with anything at the same position, concrete parts must match exactly.
 */
public final class DefaultSymbolicAlgebra implements SymbolicAlgebra {

    public static final DefaultSymbolicAlgebra INSTANCE = new DefaultSymbolicAlgebra();

    private DefaultSymbolicAlgebra() {}

    @Override
    public boolean isSymbolic(Object x) {
        if (x instanceof Symbol) {
            return true;
        }
        if (x instanceof Dim dim) {
            return dim.isSymbolic();
        }
        if (x instanceof SymbolicType type) {
            return type.isSymbolic();
        }
        if (x instanceof ConstValue value) {
            return value.isSymbolic();
        }
        return false;
    }

    @Override
    public boolean typesCompatible(SymbolicType a, SymbolicType b) {
        if (a instanceof TensorType ta && b instanceof TensorType tb) {
            return ta.elementType() == tb.elementType() && shapesCompatible(ta.shape(), tb.shape());
        }
        if (a instanceof ListType la && b instanceof ListType lb) {
            return typesCompatible(la.elementTensorType(), lb.elementTensorType())
                    && dimsCompatible(la.initLength(), lb.initLength());
        }
        return false;
    }

    @Override
    public boolean arraysCompatible(ConstValue a, ConstValue b) {
        if (a instanceof TensorValue ta && b instanceof TensorValue tb) {
            if (!ta.shapeEquals(tb)) {
                return false;
            }
            for (int i = 0; i < ta.size(); i++) {
                Object x = ta.get(i);
                Object y = tb.get(i);
                if (x instanceof Symbol || y instanceof Symbol) {
                    continue;
                }
                if (!x.equals(y)) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof ListValue la && b instanceof ListValue lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            for (int i = 0; i < la.size(); i++) {
                if (!arraysCompatible(la.elements().get(i), lb.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Shapes are compatible when ranks agree and every dimension pair is compatible.
     */
    public boolean shapesCompatible(List<Dim> a, List<Dim> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!dimsCompatible(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean dimsCompatible(Dim a, Dim b) {
        return a.isSymbolic() || b.isSymbolic() || a.equals(b);
    }
}
