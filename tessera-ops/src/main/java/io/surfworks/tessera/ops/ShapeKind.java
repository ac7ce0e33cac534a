package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code shape}: the dimensions of {@code x} as an int32 vector.
 *
 * <p>The value is always known from the type alone; unresolved dimensions
 * become {@link io.surfworks.tessera.types.Symbol} elements.
 */
final class ShapeKind extends AbstractOpKind {

    ShapeKind() {
        super("shape", InputSpec.of(InputType.tensor("x", "T_ALL")));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        return List.of(TensorType.of(ElementType.INT32, tensorType(op, "x").rank()));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(op -> {
            List<Object> dims = new ArrayList<>();
            for (Dim d : tensorType(op, "x").shape()) {
                if (d instanceof Dim.Fixed fixed) {
                    dims.add(fixed.size());
                } else {
                    dims.add(((Dim.Symbolic) d).symbol());
                }
            }
            ConstValue value = TensorValue.of(new int[]{dims.size()}, dims);
            return List.of(value);
        });
    }
}
