package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

/**
 * A complex-typed tensor node carrying its real and imaginary parts separately.
 *
 * <p>Only kinds that originate complex data populate the parts. For every other
 * kind the node is a placeholder with both parts null, to be replaced when complex
 * operations are lowered to real arithmetic.
 */
public class ComplexValueNode extends ValueNode {

    private final TensorValue real;
    private final TensorValue imag;

    ComplexValueNode(String name, TensorType type, ConstValue value, OperationNode producer, int outputIndex,
                     TensorValue real, TensorValue imag) {
        super(name, type, value, producer, outputIndex);
        this.real = real;
        this.imag = imag;
    }

    @Override
    public TensorType type() {
        return (TensorType) super.type();
    }

    public TensorValue real() {
        return real;
    }

    public TensorValue imag() {
        return imag;
    }

    /**
     * True if this node still waits for the lowering pass to provide its parts.
     */
    public boolean isPlaceholder() {
        return real == null && imag == null;
    }
}
