package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.ValueNode;
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
 * {@code concat}: joins the tensors of tuple input {@code values} along {@code axis}.
 *
 * <p>Folding also runs over symbolic values, so shape vectors containing
 * unresolved dimensions can be concatenated at build time.
 */
final class ConcatKind extends AbstractOpKind {

    ConcatKind() {
        super("concat", InputSpec.of(
                InputType.tuple("values", "T_ALL"),
                InputType.tensor("axis", "T_INT"),
                InputType.tensor("interleave", "T_BOOL").withDefault()));
    }

    @Override
    public Map<String, ConstValue> defaultInputs(OperationNode op) {
        return Map.of("interleave", TensorValue.scalar(false));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        List<ValueNode> values = op.inputList("values");
        if (values.isEmpty()) {
            throw invalid(op, "values", "concat requires at least one input");
        }
        TensorType first = asTensorType(op, "values", values.get(0));
        int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), first.rank());

        List<Dim> shape = new ArrayList<>(first.shape());
        long concatSize = 0;
        boolean symbolicConcat = false;
        for (ValueNode v : values) {
            TensorType t = asTensorType(op, "values", v);
            if (t.elementType() != first.elementType() || t.rank() != first.rank()) {
                throw invalid(op, "values", String.format("all values must share element type and rank: %s vs %s",
                        first, t));
            }
            for (int i = 0; i < t.rank(); i++) {
                if (i == axis) {
                    continue;
                }
                Dim merged = mergeDim(shape.get(i), t.dim(i));
                if (merged == null) {
                    throw invalid(op, "values", String.format("dimension %d differs: %s vs %s", i, first, t));
                }
                shape.set(i, merged);
            }
            if (t.dim(axis) instanceof Dim.Fixed fixed) {
                concatSize += fixed.size();
            } else {
                symbolicConcat = true;
            }
        }
        shape.set(axis, symbolicConcat ? Dim.fresh() : Dim.of(concatSize));
        return List.of(new TensorType(first.elementType(), shape));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED, InputClass.SYMBOLIC), op -> {
            List<TensorValue> parts = new ArrayList<>();
            for (ValueNode v : op.inputList("values")) {
                if (!(v.value() instanceof TensorValue tv)) {
                    return nullList();
                }
                parts.add(tv);
            }
            int axis = TensorMath.normalizeAxis(requireLong(op, "axis"), parts.get(0).rank());
            boolean interleave = Boolean.TRUE.equals(tensorValue(op, "interleave").get(0));
            if (interleave) {
                int size = parts.get(0).shape()[axis];
                for (TensorValue p : parts) {
                    if (p.shape()[axis] != size) {
                        throw invalid(op, "interleave", "interleaved values must have equal size along the axis");
                    }
                }
            }
            ConstValue joined = TensorMath.concat(parts, axis, interleave);
            return List.of(joined);
        }));
    }

    private static Dim mergeDim(Dim a, Dim b) {
        if (a.equals(b) || b.isSymbolic()) {
            return a;
        }
        if (a.isSymbolic()) {
            return b;
        }
        return null;
    }

    private static List<ConstValue> nullList() {
        List<ConstValue> unknown = new ArrayList<>();
        unknown.add(null);
        return unknown;
    }
}
