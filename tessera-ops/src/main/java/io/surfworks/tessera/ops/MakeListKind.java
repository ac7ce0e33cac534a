package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.Symbol;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code make_list}: creates an empty list whose elements have shape
 * {@code elem_shape} and element type {@code dtype}. Has no value inference.
 */
final class MakeListKind extends AbstractOpKind {

    MakeListKind() {
        super("make_list", InputSpec.of(
                InputType.tensor("init_length", "T_INT").withDefault(),
                InputType.tensor("dynamic_length", "T_BOOL").withDefault(),
                InputType.tensor("elem_shape", "T_INT"),
                InputType.tensor("dtype", "T_STRING")));
    }

    @Override
    public Map<String, ConstValue> defaultInputs(OperationNode op) {
        return Map.of(
                "init_length", TensorValue.scalar(1L),
                "dynamic_length", TensorValue.scalar(true));
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        TensorValue elemShape = tensorValue(op, "elem_shape");
        if (elemShape == null || elemShape.rank() != 1) {
            throw invalid(op, "elem_shape", "elem_shape must be a build-time int vector");
        }
        List<Dim> dims = new ArrayList<>(elemShape.size());
        for (Object e : elemShape.elements()) {
            dims.add(e instanceof Symbol s ? new Dim.Symbolic(s) : Dim.of((Long) e));
        }
        TensorValue dtype = tensorValue(op, "dtype");
        if (dtype == null || dtype.size() != 1 || !(dtype.get(0) instanceof String dtypeName)) {
            throw invalid(op, "dtype", "dtype must be a build-time string");
        }
        ElementType elementType;
        try {
            elementType = ElementType.of(dtypeName);
        } catch (IllegalArgumentException e) {
            throw invalid(op, "dtype", e.getMessage());
        }
        TensorValue initLength = tensorValue(op, "init_length");
        Dim length = initLength == null || initLength.isSymbolic() ? Dim.fresh() : Dim.of(initLength.longAt(0));
        boolean dynamic = Boolean.TRUE.equals(tensorValue(op, "dynamic_length").get(0));
        return List.of(new ListType(new TensorType(elementType, dims), length, dynamic));
    }
}
