package io.surfworks.tessera.ir.infer;

import io.surfworks.tessera.ir.Binding;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.types.DefaultSymbolicAlgebra;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.Symbol;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClassificationGateTest {

    private static final Set<ElementType> ANY = Set.of(ElementType.values());

    private final ClassificationGate gate = new ClassificationGate(DefaultSymbolicAlgebra.INSTANCE);

    private static ValueNode valued(Object... elements) {
        return new ValueNode("v", TensorType.of(ElementType.INT32, elements.length), TensorValue.vector(elements));
    }

    private static ValueNode unvalued() {
        return new ValueNode("u", TensorType.of(ElementType.INT32, 2));
    }

    @Nested
    class NodeTests {

        @Test
        void concreteValueIsMaterialized() {
            assertEquals(InputClass.MATERIALIZED, gate.classify(valued(1, 2)));
        }

        @Test
        void symbolicElementIsSymbolic() {
            assertEquals(InputClass.SYMBOLIC, gate.classify(valued(1, new Symbol("n"))));
        }

        @Test
        void symbolicTypeWinsOverValue() {
            ValueNode node = new ValueNode("s", TensorType.of(ElementType.INT32, Dim.of("n")), TensorValue.vector(1));
            assertEquals(InputClass.SYMBOLIC, gate.classify(node));
        }

        @Test
        void noValueIsAbsent() {
            assertEquals(InputClass.ABSENT, gate.classify(unvalued()));
        }
    }

    @Nested
    class AccumulationTests {

        private final InputSpec spec = InputSpec.of(
                InputType.tuple("values", ANY),
                InputType.tensor("axis", ANY),
                InputType.tensor("flag", ANY).asOptional(),
                InputType.internal("_fn"));

        @Test
        void tuplesContributeEveryElement() {
            Classification c = gate.classify(spec, Map.of(
                    "values", Binding.of(List.of(valued(1), valued(new Symbol("n")))),
                    "axis", Binding.of(valued(0))));
            assertEquals(Set.of(InputClass.MATERIALIZED, InputClass.SYMBOLIC), c.present());
        }

        @Test
        void optionalInputsAreIgnored() {
            Classification c = gate.classify(spec, Map.of(
                    "values", Binding.of(List.of(valued(1))),
                    "axis", Binding.of(valued(0)),
                    "flag", Binding.of(unvalued())));
            assertEquals(Set.of(InputClass.MATERIALIZED), c.present());
        }

        @Test
        void unboundRequiredInputCountsAsAbsent() {
            Classification c = gate.classify(spec, Map.of("values", Binding.of(List.of(valued(1)))));
            assertEquals(new Classification(true, false, true), c);
        }
    }

    @Nested
    class CheckTests {

        @Test
        void toleratedClassesPass() {
            Classification c = Classification.EMPTY.with(InputClass.MATERIALIZED).with(InputClass.SYMBOLIC);
            assertDoesNotThrow(() -> gate.check("concat", c, Set.of(InputClass.MATERIALIZED, InputClass.SYMBOLIC)));
            assertDoesNotThrow(() -> gate.check("shape", c, InputClass.ALL));
        }

        @Test
        void firstUntoleratedClassIsReported() {
            Classification c = Classification.EMPTY.with(InputClass.ABSENT).with(InputClass.SYMBOLIC);
            InferenceUnavailableException e = assertThrows(InferenceUnavailableException.class,
                    () -> gate.check("add", c, Set.of(InputClass.MATERIALIZED)));
            assertEquals(InputClass.SYMBOLIC, e.getOffending());
            assertEquals("add", e.getKind());
        }

        @Test
        void missingCapabilityHasNoOffendingClass() {
            assertNull(new InferenceUnavailableException("make_list", null).getOffending());
        }
    }
}
