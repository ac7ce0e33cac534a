package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.Binding;
import io.surfworks.tessera.ir.Block;
import io.surfworks.tessera.ir.BuildContext;
import io.surfworks.tessera.ir.ContractViolationException;
import io.surfworks.tessera.ir.ContractViolationException.Reason;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueDriftException;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.types.Complex;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ElementwiseBinaryKindTest {

    private GraphBuilder g;

    @BeforeEach
    void setUp() {
        g = new GraphBuilder(new Block("main", BuildContext.defaults()));
    }

    @Nested
    class FoldingTests {

        @Test
        void materializedInputsAreFolded() {
            ValueNode sum = g.add(g.constant(TensorValue.vector(1, 2)), g.constant(TensorValue.vector(3, 4)));
            assertEquals(TensorValue.vector(4, 6), sum.value());
            assertEquals(TensorType.of(ElementType.INT32, 2), sum.type());
        }

        @Test
        void symbolicInputLeavesValueUnknown() {
            ValueNode x = g.input("x", TensorType.of(ElementType.INT32, Dim.of("n")));
            ValueNode sum = g.add(x, g.constant(TensorValue.vector(3, 4)));
            assertNull(sum.value());
            assertEquals(TensorType.of(ElementType.INT32, 2), sum.type());
        }

        @Test
        void rebindingToADifferentValueDrifts() {
            ValueNode x = g.constant(TensorValue.vector(1, 2));
            ValueNode y = g.constant(TensorValue.vector(3, 4));
            ValueNode sum = g.add(x, y);
            OperationNode add = sum.producer();
            ValueNode changed = g.constant(TensorValue.vector(1, 3));

            ValueDriftException e = assertThrows(ValueDriftException.class,
                    () -> add.rebind(Map.of("x", Binding.of(changed)), false, true));
            assertEquals(TensorValue.vector(4, 6), e.getExisting());
            assertEquals(TensorValue.vector(4, 7), e.getInferred());
            assertEquals(TensorValue.vector(4, 6), sum.value());

            add.infer(true);
            assertEquals(TensorValue.vector(4, 7), sum.value());
        }

        @Test
        void broadcastingFoldsAcrossShapes() {
            ValueNode column = g.constant(TensorValue.of(new int[]{2, 1}, List.of(10, 20)));
            ValueNode row = g.constant(TensorValue.vector(1, 2, 3));
            ValueNode sum = g.add(column, row);
            assertEquals(TensorType.of(ElementType.INT32, 2, 3), sum.type());
            assertEquals(TensorValue.of(new int[]{2, 3}, List.of(11, 12, 13, 21, 22, 23)), sum.value());
        }

        @Test
        void subtractAndMultiply() {
            ValueNode a = g.constant(TensorValue.vector(5.0, 6.0));
            ValueNode b = g.constant(TensorValue.vector(2.0, 4.0));
            assertEquals(TensorValue.vector(3.0, 2.0), g.sub(a, b).value());
            assertEquals(TensorValue.vector(10.0, 24.0), g.mul(a, b).value());
        }

        @Test
        void complexArithmetic() {
            ValueNode a = g.constant(TensorValue.vector(new Complex(1, 2)));
            ValueNode b = g.constant(TensorValue.vector(new Complex(3, -1)));
            assertEquals(TensorValue.vector(new Complex(5, 5)), g.mul(a, b).value());
        }

        @Test
        void integerResultsWrapAtTheOutputWidth() {
            ValueNode max = g.constant(TensorValue.vector(Integer.MAX_VALUE));
            ValueNode one = g.constant(TensorValue.vector(1));
            ValueNode sum = g.add(max, one);
            assertEquals(TensorType.of(ElementType.INT32, 1), sum.type());
            assertEquals(TensorValue.vector(Integer.MIN_VALUE), sum.value());

            ValueNode a = g.constant(TensorValue.vector(127, 250), ElementType.INT8);
            ValueNode b = g.constant(TensorValue.vector(1, 10), ElementType.INT8);
            assertEquals(TensorValue.vector(-128, 4), g.add(a, b).value());

            ValueNode c = g.constant(TensorValue.vector(250, 3), ElementType.UINT8);
            ValueNode d = g.constant(TensorValue.vector(10, 5), ElementType.UINT8);
            assertEquals(TensorValue.vector(4, 8), g.add(c, d).value());
            assertEquals(TensorValue.vector(16, 2), g.sub(d, c).value());
        }

        @Test
        void int64ResultsAreNotNarrowed() {
            ValueNode a = g.constant(TensorValue.vector(Integer.MAX_VALUE), ElementType.INT64);
            ValueNode b = g.constant(TensorValue.vector(2), ElementType.INT64);
            assertEquals(TensorValue.vector(2L * Integer.MAX_VALUE), g.mul(a, b).value());
        }

        @Test
        void floatResultsAreRoundedToTheOutputPrecision() {
            ValueNode a = g.constant(TensorValue.vector(0.1));
            ValueNode b = g.constant(TensorValue.vector(0.2));
            assertEquals(TensorValue.vector((double) (float) (0.1 + 0.2)), g.add(a, b).value());

            ValueNode h = g.constant(TensorValue.vector(1.0, 60000.0), ElementType.FP16);
            ValueNode k = g.constant(TensorValue.vector(0.0001, 10000.0), ElementType.FP16);
            assertEquals(TensorValue.vector(1.0, Double.POSITIVE_INFINITY), g.add(h, k).value());

            ValueNode w = g.constant(TensorValue.vector(0.1), ElementType.FP64);
            ValueNode z = g.constant(TensorValue.vector(0.2), ElementType.FP64);
            assertEquals(TensorValue.vector(0.1 + 0.2), g.add(w, z).value());
        }
    }

    @Nested
    class TypeTests {

        @Test
        void elementTypesMustMatch() {
            ValueNode i = g.constant(TensorValue.vector(1, 2));
            ValueNode f = g.constant(TensorValue.vector(1.0, 2.0));
            ContractViolationException e = assertThrows(ContractViolationException.class, () -> g.add(i, f));
            assertEquals(Reason.TYPE_MISMATCH, e.getReason());
        }

        @Test
        void shapesMustBroadcast() {
            ValueNode a = g.constant(TensorValue.vector(1, 2));
            ValueNode b = g.constant(TensorValue.vector(1, 2, 3));
            assertThrows(ContractViolationException.class, () -> g.add(a, b));
        }

        @Test
        void booleansAreOutsideTheNumericDomain() {
            ValueNode flag = g.constant(TensorValue.vector(true));
            ContractViolationException e = assertThrows(ContractViolationException.class, () -> g.add(flag, flag));
            assertEquals(Reason.TYPE_MISMATCH, e.getReason());
            assertEquals("x", e.getSlot());
        }

        @Test
        void incompatibleRebindIsRejectedUnlessSkipped() {
            ValueNode x = g.constant(TensorValue.vector(1, 2));
            OperationNode add = g.add(x, x).producer();
            ValueNode longer = g.constant(TensorValue.vector(1, 2, 3));

            ContractViolationException e = assertThrows(ContractViolationException.class,
                    () -> add.rebind(Map.of("y", Binding.of(longer)), false));
            assertEquals(Reason.INCOMPATIBLE_REBIND, e.getReason());

            add.rebind(Map.of("y", Binding.of(longer)), true);
            assertEquals(longer, add.input("y"));
        }
    }
}
