package io.surfworks.tessera.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A dense tensor value in row-major order.
 *
 * <p>Elements are {@code Long}, {@code Double}, {@code Boolean}, {@code String},
 * {@link Complex} or {@link Symbol}. {@code Integer}, {@code Short} and {@code Byte}
 * are widened to {@code Long}, {@code Float} to {@code Double}.
 */
public record TensorValue(int[] shape, List<Object> elements) implements ConstValue {

    public TensorValue {
        shape = shape.clone();
        List<Object> normalized = new ArrayList<>(elements.size());
        for (Object e : elements) {
            normalized.add(normalize(e));
        }
        elements = List.copyOf(normalized);
        long expected = elementCount(shape);
        if (expected != elements.size()) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape)
                    + " requires " + expected + " elements, got " + elements.size());
        }
    }

    public static TensorValue scalar(Object element) {
        return new TensorValue(new int[0], List.of(element));
    }

    public static TensorValue vector(Object... elements) {
        return new TensorValue(new int[]{elements.length}, Arrays.asList(elements));
    }

    public static TensorValue of(int[] shape, List<?> elements) {
        return new TensorValue(shape, new ArrayList<>(elements));
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return elements.size();
    }

    public Object get(int flatIndex) {
        return elements.get(flatIndex);
    }

    public long longAt(int flatIndex) {
        Object e = elements.get(flatIndex);
        if (e instanceof Long l) {
            return l;
        }
        if (e instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        throw new IllegalStateException("Element " + flatIndex + " is not an integer: " + e);
    }

    public double doubleAt(int flatIndex) {
        Object e = elements.get(flatIndex);
        if (e instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalStateException("Element " + flatIndex + " is not numeric: " + e);
    }

    @Override
    public boolean isSymbolic() {
        for (Object e : elements) {
            if (e instanceof Symbol) {
                return true;
            }
        }
        return false;
    }

    public boolean shapeEquals(TensorValue other) {
        return Arrays.equals(shape, other.shape);
    }

    /**
     * A view with the same elements under a new shape of equal element count.
     */
    public TensorValue reshape(int... newShape) {
        return new TensorValue(newShape, elements);
    }

    static long elementCount(int[] shape) {
        long count = 1;
        for (int d : shape) {
            count *= d;
        }
        return count;
    }

    private static Object normalize(Object e) {
        if (e == null) {
            throw new IllegalArgumentException("Tensor elements must not be null");
        }
        if (e instanceof Integer || e instanceof Short || e instanceof Byte) {
            return ((Number) e).longValue();
        }
        if (e instanceof Float f) {
            return f.doubleValue();
        }
        if (e instanceof Long || e instanceof Double || e instanceof Boolean
                || e instanceof String || e instanceof Complex || e instanceof Symbol) {
            return e;
        }
        throw new IllegalArgumentException("Unsupported tensor element: " + e.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorValue that)) return false;
        return Arrays.equals(shape, that.shape) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + elements.hashCode();
    }

    @Override
    public String toString() {
        if (shape.length == 0) {
            return String.valueOf(elements.get(0));
        }
        return "TensorValue[shape=" + Arrays.toString(shape) + ", elements=" + elements + "]";
    }
}
