package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.ComplexParts;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.Complex;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.DefaultSymbolicAlgebra;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code complex}: pairs {@code real_data} and {@code imag_data} into a complex tensor.
 * The output keeps both parts so complex lowering can read them back.
 */
final class ComplexKind extends AbstractOpKind {

    ComplexKind() {
        super("complex", InputSpec.of(
                InputType.tensor("real_data", "T_FLOAT"),
                InputType.tensor("imag_data", "T_FLOAT")));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        TensorType real = tensorType(op, "real_data");
        TensorType imag = tensorType(op, "imag_data");
        if (real.elementType() != imag.elementType()
                || !DefaultSymbolicAlgebra.INSTANCE.shapesCompatible(real.shape(), imag.shape())) {
            throw invalid(op, "imag_data", String.format("real and imaginary parts must match: %s vs %s", real, imag));
        }
        return List.of(real.withElementType(real.elementType().complexOf()));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED), op -> {
            TensorValue real = tensorValue(op, "real_data");
            TensorValue imag = tensorValue(op, "imag_data");
            List<Object> out = new ArrayList<>(real.size());
            for (int i = 0; i < real.size(); i++) {
                out.add(new Complex(real.doubleAt(i), imag.doubleAt(i)));
            }
            ConstValue value = TensorValue.of(real.shape(), out);
            return List.of(value);
        }));
    }

    @Override
    public Optional<ComplexParts> complexParts(OperationNode op, int outputIndex, ConstValue inferredValue) {
        return Optional.of(new ComplexParts(tensorValue(op, "real_data"), tensorValue(op, "imag_data")));
    }
}
