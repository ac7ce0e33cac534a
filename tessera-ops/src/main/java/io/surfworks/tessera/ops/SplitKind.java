package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code split}: cuts {@code x} into {@code num_splits} equal parts along {@code axis}.
 * Outputs use default naming ({@code <op>_0}, {@code <op>_1}, ...).
 */
final class SplitKind extends AbstractOpKind {

    SplitKind() {
        super("split", InputSpec.of(
                InputType.tensor("x", "T_ALL"),
                InputType.tensor("num_splits", "T_INT"),
                InputType.tensor("axis", "T_INT").withDefault()));
    }

    @Override
    public Map<String, ConstValue> defaultInputs(OperationNode op) {
        return Map.of("axis", TensorValue.scalar(0L));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        TensorType x = tensorType(op, "x");
        int splits = numSplits(op);
        int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), x.rank());
        Dim part;
        if (x.dim(axis) instanceof Dim.Fixed fixed) {
            if (fixed.size() % splits != 0) {
                throw invalid(op, "num_splits", String.format("dimension %d of size %d is not divisible by %d",
                        axis, fixed.size(), splits));
            }
            part = Dim.of(fixed.size() / splits);
        } else {
            part = Dim.fresh();
        }
        List<Dim> shape = new ArrayList<>(x.shape());
        shape.set(axis, part);
        List<SymbolicType> out = new ArrayList<>(splits);
        for (int i = 0; i < splits; i++) {
            out.add(new TensorType(x.elementType(), shape));
        }
        return out;
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED, InputClass.SYMBOLIC), op -> {
            TensorValue x = tensorValue(op, "x");
            int splits = numSplits(op);
            List<ConstValue> out = new ArrayList<>(splits);
            if (x == null) {
                for (int i = 0; i < splits; i++) {
                    out.add(null);
                }
                return out;
            }
            int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), x.rank());
            int length = x.shape()[axis] / splits;
            for (int i = 0; i < splits; i++) {
                out.add(TensorMath.slice(x, axis, i * length, length));
            }
            return out;
        }));
    }

    private int numSplits(OperationNode op) {
        long splits = requireLong(op, "num_splits");
        if (splits < 1) {
            throw invalid(op, "num_splits", "num_splits must be positive, got " + splits);
        }
        return Math.toIntExact(splits);
    }
}
