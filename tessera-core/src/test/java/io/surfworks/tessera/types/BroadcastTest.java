package io.surfworks.tessera.types;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastTest {

    @Nested
    class SymbolicShapeTests {

        @Test
        void trailingDimensionsAlign() {
            Optional<List<Dim>> shape = Broadcast.shapes(List.of(Dim.of(4), Dim.of(1)), List.of(Dim.of(3)));
            assertEquals(Optional.of(List.of(Dim.of(4), Dim.of(3))), shape);
        }

        @Test
        void symbolAgainstOneKeepsSymbol() {
            Dim n = Dim.of("n");
            assertEquals(Optional.of(List.of(n)), Broadcast.shapes(List.of(n), List.of(Dim.of(1))));
        }

        @Test
        void symbolAgainstFixedSizeTakesTheSize() {
            assertEquals(Optional.of(List.of(Dim.of(5))), Broadcast.shapes(List.of(Dim.of("n")), List.of(Dim.of(5))));
        }

        @Test
        void differentSymbolsGiveAFreshSymbol() {
            List<Dim> shape = Broadcast.shapes(List.of(Dim.of("n")), List.of(Dim.of("m"))).orElseThrow();
            assertTrue(shape.get(0).isSymbolic());
            assertNotEquals(Dim.of("n"), shape.get(0));
            assertNotEquals(Dim.of("m"), shape.get(0));
        }

        @Test
        void mismatchedSizesAreIncompatible() {
            assertTrue(Broadcast.shapes(List.of(Dim.of(2)), List.of(Dim.of(3))).isEmpty());
        }
    }

    @Nested
    class ConcreteTests {

        @Test
        void concreteShapes() {
            assertArrayEquals(new int[]{2, 3}, Broadcast.shapes(new int[]{2, 1}, new int[]{3}));
            assertNull(Broadcast.shapes(new int[]{2}, new int[]{3}));
        }

        @Test
        void expandRepeatsAlongBroadcastAxes() {
            TensorValue column = TensorValue.of(new int[]{2, 1}, List.of(1, 2));
            assertEquals(List.of(1L, 1L, 1L, 2L, 2L, 2L), Broadcast.expand(column, new int[]{2, 3}));

            TensorValue row = TensorValue.vector(1, 2, 3);
            assertEquals(List.of(1L, 2L, 3L, 1L, 2L, 3L), Broadcast.expand(row, new int[]{2, 3}));
        }

        @Test
        void scalarExpandsToEveryPosition() {
            assertEquals(List.of(7L, 7L, 7L), Broadcast.expand(TensorValue.scalar(7), new int[]{3}));
        }
    }
}
