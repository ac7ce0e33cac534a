package io.surfworks.tessera.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * NumPy-style broadcasting over symbolic shapes.
 *
 * <p>Dimensions are compared from right to left; missing dimensions are treated
 * as size 1. Two dimensions are broadcastable when they are equal or one of them
 * is 1. A symbolic dimension against 1 keeps the symbol; two different symbols
 * produce a fresh symbol.
 */
public final class Broadcast {

    private Broadcast() {}

    /**
     * Broadcast shape of {@code a} and {@code b}, or empty if they are incompatible.
     */
    public static Optional<List<Dim>> shapes(List<Dim> a, List<Dim> b) {
        int maxRank = Math.max(a.size(), b.size());
        Dim[] out = new Dim[maxRank];
        for (int i = 0; i < maxRank; i++) {
            Dim da = i < a.size() ? a.get(a.size() - 1 - i) : Dim.of(1);
            Dim db = i < b.size() ? b.get(b.size() - 1 - i) : Dim.of(1);
            Dim merged = merge(da, db);
            if (merged == null) {
                return Optional.empty();
            }
            out[maxRank - 1 - i] = merged;
        }
        return Optional.of(List.of(out));
    }

    /**
     * Broadcast shape of two concrete shapes, or null if incompatible.
     */
    public static int[] shapes(int[] a, int[] b) {
        int maxRank = Math.max(a.length, b.length);
        int[] out = new int[maxRank];
        for (int i = 0; i < maxRank; i++) {
            int da = i < a.length ? a[a.length - 1 - i] : 1;
            int db = i < b.length ? b[b.length - 1 - i] : 1;
            if (da != db && da != 1 && db != 1) {
                return null;
            }
            out[maxRank - 1 - i] = da == 1 ? db : da;
        }
        return out;
    }

    /**
     * Expands {@code value} to {@code target} shape by repeating along broadcast axes.
     */
    public static List<Object> expand(TensorValue value, int[] target) {
        int[] src = value.shape();
        int offset = target.length - src.length;
        int count = (int) TensorValue.elementCount(target);
        List<Object> out = new ArrayList<>(count);
        int[] index = new int[target.length];
        for (int flat = 0; flat < count; flat++) {
            int srcFlat = 0;
            for (int axis = 0; axis < src.length; axis++) {
                int i = src[axis] == 1 ? 0 : index[axis + offset];
                srcFlat = srcFlat * src[axis] + i;
            }
            out.add(value.get(srcFlat));
            increment(index, target);
        }
        return out;
    }

    private static void increment(int[] index, int[] shape) {
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            if (++index[axis] < shape[axis]) {
                return;
            }
            index[axis] = 0;
        }
    }

    private static Dim merge(Dim a, Dim b) {
        if (a.equals(b)) {
            return a;
        }
        if (isOne(a)) {
            return b;
        }
        if (isOne(b)) {
            return a;
        }
        if (a.isSymbolic() && b.isSymbolic()) {
            return Dim.fresh();
        }
        if (a.isSymbolic()) {
            return b;
        }
        if (b.isSymbolic()) {
            return a;
        }
        return null;
    }

    private static boolean isOne(Dim d) {
        return d instanceof Dim.Fixed fixed && fixed.size() == 1;
    }
}
