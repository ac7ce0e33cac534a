package io.surfworks.tessera.ir;

import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.ConstValue;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Build-time evaluation of an operation kind.
 *
 * <p>{@link #tolerates()} declares which input classes the implementation can
 * handle; the operation node runs {@link #infer} only if every required input
 * falls into a tolerated class.
 */
@FunctionalInterface
public interface ValueInference {

    /**
     * One value per output. A null element means that output is unknown, in which
     * case the whole result is discarded.
     */
    List<ConstValue> infer(OperationNode op);

    default Set<InputClass> tolerates() {
        return InputClass.ALL;
    }

    static ValueInference tolerating(Set<InputClass> tolerated, Function<OperationNode, List<ConstValue>> fn) {
        Set<InputClass> copy = Set.copyOf(tolerated);
        return new ValueInference() {
            @Override
            public List<ConstValue> infer(OperationNode op) {
                return fn.apply(op);
            }

            @Override
            public Set<InputClass> tolerates() {
                return copy;
            }
        };
    }
}
