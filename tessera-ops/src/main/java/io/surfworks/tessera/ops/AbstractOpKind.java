package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.ContractViolationException;
import io.surfworks.tessera.ir.ContractViolationException.Reason;
import io.surfworks.tessera.ir.OpKind;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

/**
 * Common plumbing for the standard kinds: identity, contract, and typed access to inputs.
 */
abstract class AbstractOpKind implements OpKind {

    private final String name;
    private final InputSpec inputSpec;

    AbstractOpKind(String name, InputSpec inputSpec) {
        this.name = name;
        this.inputSpec = inputSpec;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final InputSpec inputSpec() {
        return inputSpec;
    }

    /**
     * Tensor type of single slot {@code slot}.
     */
    TensorType tensorType(OperationNode op, String slot) {
        return asTensorType(op, slot, op.input(slot));
    }

    TensorType asTensorType(OperationNode op, String slot, ValueNode node) {
        SymbolicType type = node.type();
        if (!(type instanceof TensorType tensorType)) {
            throw invalid(op, slot, "input " + slot + " must be a tensor, got " + type);
        }
        return tensorType;
    }

    /**
     * Value of slot {@code slot} (bound or defaulted) as a tensor, or null if unknown.
     */
    TensorValue tensorValue(OperationNode op, String slot) {
        ConstValue value = op.inputValue(slot);
        if (value != null && !(value instanceof TensorValue)) {
            throw invalid(op, slot, "input " + slot + " must be a tensor value, got " + value);
        }
        return (TensorValue) value;
    }

    /**
     * Scalar integer argument that must be known at build time.
     */
    long requireLong(OperationNode op, String slot) {
        TensorValue value = tensorValue(op, slot);
        if (value == null || value.size() != 1 || value.isSymbolic()) {
            throw invalid(op, slot, "input " + slot + " must be a build-time integer scalar");
        }
        return value.longAt(0);
    }

    ContractViolationException invalid(OperationNode op, String slot, String message) {
        return new ContractViolationException(Reason.TYPE_MISMATCH, op.name(), name, slot, message);
    }

    @Override
    public String toString() {
        return name;
    }
}
