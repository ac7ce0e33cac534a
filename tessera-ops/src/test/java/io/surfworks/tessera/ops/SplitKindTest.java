package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.Block;
import io.surfworks.tessera.ir.BuildContext;
import io.surfworks.tessera.ir.ContractViolationException;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SplitKindTest {

    private Block main;
    private GraphBuilder g;

    @BeforeEach
    void setUp() {
        main = new Block("main", BuildContext.defaults());
        g = new GraphBuilder(main);
    }

    @Test
    void equalPartsWithIndexedNames() {
        ValueNode x = g.constant(TensorValue.vector(1, 2, 3, 4, 5, 6));
        OperationNode op = main.add(OperationNode.builder(StandardOps.SPLIT)
                .name("parts")
                .input("x", x)
                .input("num_splits", g.constant(TensorValue.scalar(3))));

        assertEquals(List.of("parts_0", "parts_1", "parts_2"), op.outputs().stream().map(ValueNode::name).toList());
        assertEquals(TensorValue.vector(3, 4), op.outputs().get(1).value());
        assertEquals(TensorType.of(ElementType.INT32, 2), op.outputs().get(2).type());
    }

    @Test
    void splitsAlongInnerAxis() {
        ValueNode x = g.constant(TensorValue.of(new int[]{2, 2}, List.of(1, 2, 3, 4)));
        List<ValueNode> parts = g.split(x, 2, 1);
        assertEquals(TensorValue.of(new int[]{2, 1}, List.of(1, 3)), parts.get(0).value());
        assertEquals(TensorValue.of(new int[]{2, 1}, List.of(2, 4)), parts.get(1).value());
    }

    @Test
    void indivisibleDimensionIsRejected() {
        ValueNode x = g.constant(TensorValue.vector(1, 2, 3));
        assertThrows(ContractViolationException.class, () -> g.split(x, 2, 0));
    }

    @Test
    void symbolicDimensionSplitsIntoSymbolicParts() {
        ValueNode x = g.input("x", TensorType.of(ElementType.FP32, Dim.of("n"), Dim.of(4)));
        List<ValueNode> parts = g.split(x, 2, 0);
        assertEquals(2, parts.size());
        assertTrue(((TensorType) parts.get(0).type()).dim(0).isSymbolic());
        assertNull(parts.get(0).value());
    }
}
