package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.Block;
import io.surfworks.tessera.ir.OpKind;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.TensorValue;

import java.util.List;
import java.util.function.Function;

/**
 * Convenience front-end that appends standard operations to a block.
 *
 * <p>Scalar arguments such as axes are materialized as {@code const} operations.
 *
 * <pre>{@code
 * GraphBuilder g = new GraphBuilder(new Block("main", BuildContext.defaults()));
 * ValueNode x = g.constant(TensorValue.vector(1, 2));
 * ValueNode y = g.constant(TensorValue.vector(3, 4));
 * g.add(x, y).value();   // [4, 6]
 * }</pre>
 */
public final class GraphBuilder {

    private final Block block;

    public GraphBuilder(Block block) {
        this.block = block;
    }

    public Block block() {
        return block;
    }

    public ValueNode input(String name, SymbolicType type) {
        return block.addInput(name, type);
    }

    public ValueNode constant(ConstValue value) {
        return block.add(OperationNode.builder(StandardOps.CONST).internal(ConstKind.VALUE, value)).output();
    }

    public ValueNode constant(String name, ConstValue value) {
        return block.add(OperationNode.builder(StandardOps.CONST).name(name).internal(ConstKind.VALUE, value)).output();
    }

    public ValueNode constant(ConstValue value, ElementType dtype) {
        return block.add(OperationNode.builder(StandardOps.CONST)
                .internal(ConstKind.VALUE, value)
                .internal(ConstKind.DTYPE, dtype)).output();
    }

    public ValueNode add(ValueNode x, ValueNode y) {
        return binary(StandardOps.ADD, x, y);
    }

    public ValueNode sub(ValueNode x, ValueNode y) {
        return binary(StandardOps.SUB, x, y);
    }

    public ValueNode mul(ValueNode x, ValueNode y) {
        return binary(StandardOps.MUL, x, y);
    }

    public ValueNode shape(ValueNode x) {
        return block.add(OperationNode.builder(StandardOps.SHAPE).input("x", x)).output();
    }

    public ValueNode concat(List<ValueNode> values, long axis) {
        return block.add(OperationNode.builder(StandardOps.CONCAT)
                .input("values", values)
                .input("axis", scalar(axis))).output();
    }

    public List<ValueNode> split(ValueNode x, long numSplits, long axis) {
        return block.add(OperationNode.builder(StandardOps.SPLIT)
                .input("x", x)
                .input("num_splits", scalar(numSplits))
                .input("axis", scalar(axis))).outputs();
    }

    /**
     * Returns the {@code values} and {@code indices} outputs.
     */
    public List<ValueNode> topk(ValueNode x, long k) {
        return block.add(OperationNode.builder(StandardOps.TOPK)
                .input("x", x)
                .input("k", scalar(k))).outputs();
    }

    public ValueNode complex(ValueNode real, ValueNode imag) {
        return block.add(OperationNode.builder(StandardOps.COMPLEX)
                .input("real_data", real)
                .input("imag_data", imag)).output();
    }

    public ValueNode makeList(ValueNode elemShape, ElementType dtype) {
        return block.add(OperationNode.builder(StandardOps.MAKE_LIST)
                .input("elem_shape", elemShape)
                .input("dtype", constant(TensorValue.scalar(dtype.canonicalName())))).output();
    }

    /**
     * Appends a conditional. Each branch function fills its nested block and
     * returns the values that branch yields.
     */
    public List<ValueNode> cond(ValueNode pred,
                                Function<Block, List<ValueNode>> trueBranch,
                                Function<Block, List<ValueNode>> falseBranch) {
        return block.add(OperationNode.builder(StandardOps.COND)
                .input("pred", pred)
                .internal(CondKind.TRUE_FN, trueBranch)
                .internal(CondKind.FALSE_FN, falseBranch)).outputs();
    }

    private ValueNode binary(OpKind kind, ValueNode x, ValueNode y) {
        return block.add(OperationNode.builder(kind).input("x", x).input("y", y)).output();
    }

    private ValueNode scalar(long v) {
        return constant(TensorValue.scalar(v));
    }
}
