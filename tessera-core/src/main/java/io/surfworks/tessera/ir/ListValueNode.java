package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ListValue;
import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;

import java.util.List;

/**
 * A value node holding a list of tensors that share one element type.
 */
public class ListValueNode extends ValueNode {

    public ListValueNode(String name, ListType type) {
        this(name, type, null, null, -1);
    }

    ListValueNode(String name, ListType type, ListValue value, OperationNode producer, int outputIndex) {
        super(name, type, value, producer, outputIndex);
    }

    @Override
    public ListType type() {
        return (ListType) super.type();
    }

    @Override
    public ListValue value() {
        return (ListValue) super.value();
    }

    public TensorType elemType() {
        return type().elementTensorType();
    }

    public Dim initLength() {
        return type().initLength();
    }

    public boolean dynamicLength() {
        return type().dynamicLength();
    }

    /**
     * Shape of every list element.
     */
    public List<Dim> elemShape() {
        return elemType().shape();
    }
}
