package io.surfworks.tessera.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declared type of a value in the graph. Shapes may contain unresolved symbols.
 */
public sealed interface SymbolicType permits SymbolicType.TensorType, SymbolicType.ListType {

    /**
     * The element type checked against input contracts.
     */
    ElementType elementType();

    /**
     * True if any dimension of this type is unresolved.
     */
    boolean isSymbolic();

    String toTypeString();

    /**
     * Tensor type: {@code fp32[4,is0]}. A rank-0 shape is a scalar.
     */
    record TensorType(ElementType elementType, List<Dim> shape) implements SymbolicType {

        public TensorType {
            Objects.requireNonNull(elementType, "elementType");
            shape = List.copyOf(shape);
        }

        public static TensorType of(ElementType elementType, long... dims) {
            List<Dim> shape = new ArrayList<>(dims.length);
            for (long d : dims) {
                shape.add(Dim.of(d));
            }
            return new TensorType(elementType, shape);
        }

        public static TensorType of(ElementType elementType, Dim... dims) {
            return new TensorType(elementType, List.of(dims));
        }

        public static TensorType scalar(ElementType elementType) {
            return new TensorType(elementType, List.of());
        }

        public int rank() {
            return shape.size();
        }

        public Dim dim(int i) {
            return shape.get(i);
        }

        public boolean isScalar() {
            return shape.isEmpty();
        }

        @Override
        public boolean isSymbolic() {
            for (Dim d : shape) {
                if (d.isSymbolic()) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Concrete shape, or null if any dimension is symbolic.
         */
        public int[] concreteShape() {
            int[] out = new int[shape.size()];
            for (int i = 0; i < shape.size(); i++) {
                if (!(shape.get(i) instanceof Dim.Fixed fixed)) {
                    return null;
                }
                out[i] = Math.toIntExact(fixed.size());
            }
            return out;
        }

        public TensorType withElementType(ElementType newElementType) {
            return new TensorType(newElementType, shape);
        }

        @Override
        public String toTypeString() {
            StringBuilder sb = new StringBuilder(elementType.canonicalName());
            sb.append("[");
            for (int i = 0; i < shape.size(); i++) {
                if (i > 0) sb.append(",");
                sb.append(shape.get(i));
            }
            sb.append("]");
            return sb.toString();
        }

        @Override
        public String toString() {
            return toTypeString();
        }
    }

    /**
     * List of tensors sharing one element type: {@code list[fp32[2,3], 1, dynamic]}.
     */
    record ListType(TensorType elementTensorType, Dim initLength, boolean dynamicLength) implements SymbolicType {

        public ListType {
            Objects.requireNonNull(elementTensorType, "elementTensorType");
            Objects.requireNonNull(initLength, "initLength");
        }

        @Override
        public ElementType elementType() {
            return elementTensorType.elementType();
        }

        @Override
        public boolean isSymbolic() {
            return elementTensorType.isSymbolic() || initLength.isSymbolic();
        }

        @Override
        public String toTypeString() {
            return "list[" + elementTensorType.toTypeString() + ", " + initLength
                    + (dynamicLength ? ", dynamic]" : "]");
        }

        @Override
        public String toString() {
            return toTypeString();
        }
    }
}
