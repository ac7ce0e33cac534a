package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OpKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The standard operation kinds.
 *
 * <p>Kinds are stateless and shared; every operation node resolves their contracts
 * against its own build context.
 */
public final class StandardOps {

    public static final OpKind CONST = new ConstKind();
    public static final OpKind ADD = new ElementwiseBinaryKind("add", TensorMath::add);
    public static final OpKind SUB = new ElementwiseBinaryKind("sub", TensorMath::subtract);
    public static final OpKind MUL = new ElementwiseBinaryKind("mul", TensorMath::multiply);
    public static final OpKind SHAPE = new ShapeKind();
    public static final OpKind CONCAT = new ConcatKind();
    public static final OpKind SPLIT = new SplitKind();
    public static final OpKind TOPK = new TopKKind();
    public static final OpKind COMPLEX = new ComplexKind();
    public static final OpKind MAKE_LIST = new MakeListKind();
    public static final OpKind COND = new CondKind();

    private static final Map<String, OpKind> BY_NAME = new LinkedHashMap<>();

    static {
        for (OpKind kind : List.of(CONST, ADD, SUB, MUL, SHAPE, CONCAT, SPLIT, TOPK, COMPLEX, MAKE_LIST, COND)) {
            BY_NAME.put(kind.name(), kind);
        }
    }

    private StandardOps() {}

    public static Optional<OpKind> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static List<OpKind> all() {
        return List.copyOf(BY_NAME.values());
    }
}
