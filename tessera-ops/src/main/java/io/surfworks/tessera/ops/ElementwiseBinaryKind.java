package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.Broadcast;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Element-wise binary arithmetic ({@code add}, {@code sub}, {@code mul}) with
 * broadcasting. Values are folded only when both operands are materialized.
 */
final class ElementwiseBinaryKind extends AbstractOpKind {

    private final BinaryOperator<Object> op;

    ElementwiseBinaryKind(String name, BinaryOperator<Object> op) {
        super(name, InputSpec.of(
                InputType.tensor("x", "T_NUMERIC"),
                InputType.tensor("y", "T_NUMERIC")));
        this.op = op;
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode node) {
        TensorType x = tensorType(node, "x");
        TensorType y = tensorType(node, "y");
        if (x.elementType() != y.elementType()) {
            throw invalid(node, "y", String.format("element types must match: %s vs %s",
                    x.elementType(), y.elementType()));
        }
        List<Dim> shape = Broadcast.shapes(x.shape(), y.shape())
                .orElseThrow(() -> invalid(node, "y", String.format("shapes %s and %s are not broadcastable",
                        x.shape(), y.shape())));
        return List.of(new TensorType(x.elementType(), shape));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED), node -> {
            ConstValue result = TensorMath.elementwise(tensorValue(node, "x"), tensorValue(node, "y"), op,
                    tensorType(node, "x").elementType());
            return List.of(result);
        }));
    }
}
