package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.ComplexParts;
import io.surfworks.tessera.ir.InternalValueNode;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.types.Complex;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.ListValue;
import io.surfworks.tessera.types.Symbol;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code const}: introduces a build-time value into the graph.
 *
 * <p>The value travels in internal slot {@code _value}; {@code _dtype} optionally
 * fixes the element type, which is otherwise derived from the elements: integers
 * and symbols become int32, floating-point numbers fp32, complex numbers complex64.
 */
final class ConstKind extends AbstractOpKind {

    static final String VALUE = "_value";
    static final String DTYPE = "_dtype";

    ConstKind() {
        super("const", InputSpec.of(
                InputType.internal(VALUE),
                InputType.internal(DTYPE).asOptional()));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        ConstValue value = payload(op);
        ElementType dtype = dtype(op);
        if (value instanceof ListValue list) {
            if (list.size() == 0) {
                throw invalid(op, VALUE, "cannot infer the element type of an empty list");
            }
            TensorType elem = tensorTypeOf(list.elements().get(0), dtype);
            return List.of(new ListType(elem, Dim.of(list.size()), false));
        }
        return List.of(tensorTypeOf((TensorValue) value, dtype));
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(op -> List.of(payload(op)));
    }

    @Override
    public Optional<ComplexParts> complexParts(OperationNode op, int outputIndex, ConstValue inferredValue) {
        if (!(payload(op) instanceof TensorValue value)) {
            return Optional.empty();
        }
        List<Object> real = new ArrayList<>(value.size());
        List<Object> imag = new ArrayList<>(value.size());
        for (Object e : value.elements()) {
            if (e instanceof Complex c) {
                real.add(c.re());
                imag.add(c.im());
            } else {
                real.add(((Number) e).doubleValue());
                imag.add(0.0);
            }
        }
        return Optional.of(new ComplexParts(TensorValue.of(value.shape(), real), TensorValue.of(value.shape(), imag)));
    }

    private ConstValue payload(OperationNode op) {
        InternalValueNode node = op.internalInputs().get(VALUE);
        if (!(node.payload() instanceof ConstValue value)) {
            throw invalid(op, VALUE, "const payload must be a tensor or list value");
        }
        return value;
    }

    private static ElementType dtype(OperationNode op) {
        InternalValueNode node = op.internalInputs().get(DTYPE);
        return node == null ? null : node.payload(ElementType.class);
    }

    private static TensorType tensorTypeOf(TensorValue value, ElementType dtype) {
        List<Dim> shape = new ArrayList<>(value.rank());
        for (int d : value.shape()) {
            shape.add(Dim.of(d));
        }
        return new TensorType(dtype != null ? dtype : elementTypeOf(value), shape);
    }

    static ElementType elementTypeOf(TensorValue value) {
        ElementType result = null;
        for (Object e : value.elements()) {
            ElementType t;
            if (e instanceof Long || e instanceof Symbol) {
                t = ElementType.INT32;
            } else if (e instanceof Double) {
                t = ElementType.FP32;
            } else if (e instanceof Boolean) {
                t = ElementType.BOOL;
            } else if (e instanceof Complex) {
                t = ElementType.COMPLEX64;
            } else {
                t = ElementType.STRING;
            }
            result = result == null ? t : promote(result, t);
        }
        return result == null ? ElementType.FP32 : result;
    }

    private static ElementType promote(ElementType a, ElementType b) {
        if (a == b) {
            return a;
        }
        if (a == ElementType.COMPLEX64 || b == ElementType.COMPLEX64) {
            return ElementType.COMPLEX64;
        }
        if ((a == ElementType.FP32 && b == ElementType.INT32) || (a == ElementType.INT32 && b == ElementType.FP32)) {
            return ElementType.FP32;
        }
        throw new IllegalArgumentException("Mixed element types in const value: " + a + " and " + b);
    }
}
