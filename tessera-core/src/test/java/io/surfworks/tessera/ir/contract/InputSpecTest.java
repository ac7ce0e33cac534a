package io.surfworks.tessera.ir.contract;

import io.surfworks.tessera.ir.Binding;
import io.surfworks.tessera.ir.ContractViolationException;
import io.surfworks.tessera.ir.ContractViolationException.Reason;
import io.surfworks.tessera.ir.InternalValueNode;
import io.surfworks.tessera.ir.UnresolvedDomainException;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputSpecTest {

    private static final TypeDomainRegistry REGISTRY = TypeDomainRegistry.builder()
            .domain("T_FLOAT", ElementType.FP16, ElementType.FP32)
            .domain("T_INT", ElementType.INT32, ElementType.INT64)
            .build();

    private static final InputSpec CONCAT_LIKE = InputSpec.of(
            InputType.tuple("values", "T_FLOAT"),
            InputType.tensor("axis", "T_INT"),
            InputType.tensor("interleave", Set.of(ElementType.BOOL)).withDefault(),
            InputType.internal("_hint").asOptional());

    private static ValueNode node(String name, ElementType type) {
        return new ValueNode(name, TensorType.of(type, 2));
    }

    private static ContractViolationException violation(InputSpec spec, Map<String, Binding> bindings) {
        return assertThrows(ContractViolationException.class, () -> spec.validate("op", "concat", bindings));
    }

    @Nested
    class ResolutionTests {

        @Test
        void domainIdsAreReplacedByElementTypes() {
            InputSpec resolved = CONCAT_LIKE.resolve(REGISTRY, "op", "concat");
            assertTrue(resolved.isResolved());
            assertEquals(Set.of(ElementType.FP16, ElementType.FP32), resolved.get("values").orElseThrow().domain());
            assertEquals(Set.of(ElementType.BOOL), resolved.get("interleave").orElseThrow().domain());
            assertFalse(CONCAT_LIKE.isResolved());
        }

        @Test
        void resolvedSpecIsReturnedAsIs() {
            InputSpec resolved = CONCAT_LIKE.resolve(REGISTRY, "op", "concat");
            assertSame(resolved, resolved.resolve(REGISTRY, "op", "concat"));
        }

        @Test
        void missingDomainIsUnresolved() {
            InputSpec spec = InputSpec.of(InputType.tensor("x", "T_MISSING"));
            UnresolvedDomainException e = assertThrows(UnresolvedDomainException.class,
                    () -> spec.resolve(REGISTRY, "op", "k"));
            assertEquals("T_MISSING", e.getDomainId());
            assertEquals("x", e.getSlot());
        }

        @Test
        void duplicateNamesAreRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> InputSpec.of(InputType.tensor("x", "T"), InputType.tensor("x", "T")));
        }

        @Test
        void internalFlagFollowsTheNamePrefix() {
            assertTrue(InputType.internal("_fn").internal());
            assertThrows(IllegalArgumentException.class, () -> InputType.internal("fn"));
            assertThrows(IllegalArgumentException.class, () -> InputType.tensor("_x", "T"));
            assertThrows(IllegalStateException.class, () -> InputType.tensor("x", "T").length(2));
        }
    }

    @Nested
    class ValidationTests {

        private final InputSpec spec = CONCAT_LIKE.resolve(REGISTRY, "op", "concat");

        @Test
        void wellFormedBindingsPass() {
            Map<String, Binding> bindings = Map.of(
                    "values", Binding.of(List.of(node("a", ElementType.FP32), node("b", ElementType.FP16))),
                    "axis", Binding.of(node("axis", ElementType.INT32)),
                    "_hint", Binding.of(new InternalValueNode("_hint", "payload")));
            assertDoesNotThrow(() -> spec.validate("op", "concat", bindings));
        }

        @Test
        void unknownNameIsRejected() {
            ContractViolationException e = violation(spec, Map.of("axes", Binding.of(node("a", ElementType.INT32))));
            assertEquals(Reason.UNKNOWN_INPUT, e.getReason());
            assertEquals("axes", e.getSlot());
        }

        @Test
        void tupleElementsAreCheckedOneByOne() {
            ContractViolationException e = violation(spec, Map.of("values",
                    Binding.of(List.of(node("a", ElementType.FP32), node("b", ElementType.INT32)))));
            assertEquals(Reason.TYPE_MISMATCH, e.getReason());
            assertTrue(e.getMessage().contains("int32"), e.getMessage());
        }

        @Test
        void multiplicityMustMatch() {
            assertEquals(Reason.MULTIPLICITY_MISMATCH,
                    violation(spec, Map.of("values", Binding.of(node("a", ElementType.FP32)))).getReason());
            assertEquals(Reason.MULTIPLICITY_MISMATCH,
                    violation(spec, Map.of("axis", Binding.of(List.of(node("a", ElementType.INT32))))).getReason());
        }

        @Test
        void internalSlotsOnlyTakeInternalNodes() {
            assertEquals(Reason.TYPE_MISMATCH,
                    violation(spec, Map.of("_hint", Binding.of(node("a", ElementType.INT32)))).getReason());
            assertEquals(Reason.TYPE_MISMATCH,
                    violation(spec, Map.of("axis", Binding.of(new InternalValueNode("axis", 1)))).getReason());
        }

        @Test
        void messagesCarryOperationContext() {
            ContractViolationException e = violation(spec, Map.of("axis", Binding.of(node("a", ElementType.FP32))));
            assertEquals("op", e.getOpName());
            assertEquals("concat", e.getKind());
            assertTrue(e.getMessage().startsWith("Op \"op\" (kind: concat)"), e.getMessage());
        }
    }
}
