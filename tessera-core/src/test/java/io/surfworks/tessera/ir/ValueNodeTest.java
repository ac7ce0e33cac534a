package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueNodeTest {

    private static final TensorType I32 = TensorType.of(ElementType.INT32, 2);

    private Block main;

    @BeforeEach
    void setUp() {
        main = new Block("main", BuildContext.defaults());
    }

    private OperationNode echo(ValueNode in) {
        return main.add(OperationNode.builder(TestKinds.ECHO).input("x", in));
    }

    @Test
    void graphInputHasNoProducer() {
        ValueNode x = new ValueNode("x", I32, TensorValue.vector(1, 2));
        assertNull(x.producer());
        assertEquals(-1, x.outputIndex());
        assertTrue(x.hasValue());
        assertEquals("%x: int32[2]", x.describe());
    }

    @Test
    void consumersAreACopyInAttachOrder() {
        ValueNode x = main.addInput("x", I32);
        OperationNode a = echo(x);
        OperationNode b = echo(x);

        List<OperationNode> consumers = x.consumers();
        assertEquals(List.of(a, b), consumers);
        assertThrows(UnsupportedOperationException.class, () -> consumers.add(a));
    }

    @Test
    void detachingAnUnknownConsumerIsAStaleEdge() {
        ValueNode x = main.addInput("x", I32);
        ValueNode y = main.addInput("y", I32);
        OperationNode a = echo(x);
        assertThrows(IllegalStateException.class, () -> y.detachConsumer(a));
    }

    @Nested
    class ReplaceabilityTests {

        @Test
        void pinPropagatesDownstream() {
            ValueNode x = main.addInput("x", I32);
            ValueNode first = echo(x).output();
            ValueNode second = echo(first).output();

            x.setReplaceable(false);

            assertFalse(x.isReplaceable());
            assertEquals(Set.of(x), x.nonReplaceableUpstream());
            assertEquals(Set.of(x), first.nonReplaceableUpstream());
            assertEquals(Set.of(x), second.nonReplaceableUpstream());
            assertTrue(first.isReplaceable());
        }

        @Test
        void releasingAPinClearsDownstream() {
            ValueNode x = main.addInput("x", I32);
            ValueNode out = echo(x).output();
            x.setReplaceable(false);

            x.setReplaceable(true);

            assertTrue(x.nonReplaceableUpstream().isEmpty());
            assertTrue(out.nonReplaceableUpstream().isEmpty());
        }

        @Test
        void outputsCreatedAfterThePinInheritIt() {
            ValueNode x = main.addInput("x", I32);
            x.setReplaceable(false);
            ValueNode out = echo(x).output();
            assertEquals(Set.of(x), out.nonReplaceableUpstream());
        }

        @Test
        void pinsFromSeveralInputsAccumulate() {
            ValueNode x = main.addInput("x", I32);
            ValueNode y = main.addInput("y", I32);
            x.setReplaceable(false);
            y.setReplaceable(false);
            OperationNode join = main.add(OperationNode.builder(TestKinds.JOIN).input("values", List.of(x, y)));
            assertEquals(Set.of(x, y), join.output().nonReplaceableUpstream());
        }

        @Test
        void releasingAPinSettlesPathsOfDifferentLength() {
            ValueNode a = main.addInput("a", I32);
            a.setReplaceable(false);
            ValueNode b = echo(a).output();
            ValueNode c = echo(a).output();
            ValueNode e = echo(c).output();
            ValueNode d = main.add(OperationNode.builder(TestKinds.JOIN).input("values", List.of(b, e))).output();
            assertEquals(Set.of(a), d.nonReplaceableUpstream());

            a.setReplaceable(true);

            assertTrue(b.nonReplaceableUpstream().isEmpty());
            assertTrue(e.nonReplaceableUpstream().isEmpty());
            assertTrue(d.nonReplaceableUpstream().isEmpty());
            assertTrue(d.canBeReplacedBy(main.addInput("free", I32)));
        }

        @Test
        void replacementMustCoverEveryPinnedDependency() {
            ValueNode x = main.addInput("x", I32);
            ValueNode free = main.addInput("free", I32);
            x.setReplaceable(false);
            ValueNode a = echo(x).output();
            ValueNode b = echo(x).output();

            assertTrue(a.canBeReplacedBy(b));
            assertFalse(a.canBeReplacedBy(free));
            assertTrue(free.canBeReplacedBy(a));
        }
    }
}
