package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code topk}: the {@code k} largest (or smallest) entries of {@code x} along
 * {@code axis}, with their indices. Outputs are named {@code <op>_values} and
 * {@code <op>_indices}.
 */
final class TopKKind extends AbstractOpKind {

    TopKKind() {
        super("topk", InputSpec.of(
                InputType.tensor("x", "T"),
                InputType.tensor("k", "T_INT").withDefault(),
                InputType.tensor("axis", "T_INT").withDefault(),
                InputType.tensor("ascending", "T_BOOL").withDefault()));
    }

    @Override
    public Map<String, ConstValue> defaultInputs(OperationNode op) {
        return Map.of(
                "k", TensorValue.scalar(1L),
                "axis", TensorValue.scalar(-1L),
                "ascending", TensorValue.scalar(false));
    }

    @Override
    public Optional<List<String>> outputNames(OperationNode op) {
        return Optional.of(List.of("values", "indices"));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        TensorType x = tensorType(op, "x");
        int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), x.rank());
        long k = requireLong(op, "k");
        if (x.dim(axis) instanceof Dim.Fixed fixed && (k < 1 || k > fixed.size())) {
            throw invalid(op, "k", String.format("k=%d out of range for dimension of size %d", k, fixed.size()));
        }
        List<Dim> shape = new ArrayList<>(x.shape());
        shape.set(axis, Dim.of(k));
        return List.of(new TensorType(x.elementType(), shape), new TensorType(ElementType.INT32, shape));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED), op -> {
            TensorValue x = tensorValue(op, "x");
            int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), x.rank());
            int k = Math.toIntExact(requireLong(op, "k"));
            boolean ascending = Boolean.TRUE.equals(tensorValue(op, "ascending").get(0));

            int[] shape = x.shape();
            int n = shape[axis];
            int outer = TensorMath.outer(shape, axis);
            int inner = TensorMath.inner(shape, axis);
            int[] outShape = shape.clone();
            outShape[axis] = k;
            Object[] values = new Object[outer * k * inner];
            Object[] indices = new Object[outer * k * inner];

            for (int o = 0; o < outer; o++) {
                for (int j = 0; j < inner; j++) {
                    int base = o * n * inner + j;
                    Comparator<Integer> byValue = Comparator.comparingDouble(i -> x.doubleAt(base + i * inner));
                    Comparator<Integer> order = ascending ? byValue : byValue.reversed();
                    Integer[] positions = new Integer[n];
                    for (int i = 0; i < n; i++) {
                        positions[i] = i;
                    }
                    Arrays.sort(positions, order);
                    for (int i = 0; i < k; i++) {
                        int dst = (o * k + i) * inner + j;
                        values[dst] = x.get(base + positions[i] * inner);
                        indices[dst] = (long) positions[i];
                    }
                }
            }
            return List.of(TensorValue.of(outShape, Arrays.asList(values)), TensorValue.of(outShape, Arrays.asList(indices)));
        }));
    }
}
