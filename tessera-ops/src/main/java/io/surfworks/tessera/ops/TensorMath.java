package io.surfworks.tessera.ops;

import io.surfworks.tessera.types.Broadcast;
import io.surfworks.tessera.types.Complex;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Build-time evaluation helpers over {@link TensorValue}.
 *
 * <p>Axis-wise helpers view a tensor as {@code [outer, n, inner]} around the axis:
 * the element at (o, i, j) is at flat index {@code (o * n + i) * inner + j}.
 */
final class TensorMath {

    private TensorMath() {}

    static int normalizeAxis(long axis, int rank) {
        long normalized = axis < 0 ? axis + rank : axis;
        if (normalized < 0 || normalized >= rank) {
            throw new IllegalArgumentException("Axis " + axis + " out of range for rank " + rank);
        }
        return (int) normalized;
    }

    static int outer(int[] shape, int axis) {
        int count = 1;
        for (int i = 0; i < axis; i++) {
            count *= shape[i];
        }
        return count;
    }

    static int inner(int[] shape, int axis) {
        int count = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            count *= shape[i];
        }
        return count;
    }

    /**
     * Element-wise {@code op} after broadcasting both operands. Results are
     * narrowed to {@code out}: integers wrap at its width, floats are rounded to
     * its precision.
     */
    static TensorValue elementwise(TensorValue a, TensorValue b, BinaryOperator<Object> op, ElementType out) {
        int[] shape = Broadcast.shapes(a.shape(), b.shape());
        if (shape == null) {
            throw new IllegalArgumentException("Shapes " + Arrays.toString(a.shape()) + " and "
                    + Arrays.toString(b.shape()) + " are not broadcastable");
        }
        List<Object> left = Broadcast.expand(a, shape);
        List<Object> right = Broadcast.expand(b, shape);
        List<Object> elements = new ArrayList<>(left.size());
        for (int i = 0; i < left.size(); i++) {
            elements.add(narrow(op.apply(left.get(i), right.get(i)), out));
        }
        return TensorValue.of(shape, elements);
    }

    static Object add(Object x, Object y) {
        if (x instanceof Complex || y instanceof Complex) {
            return complex(x).plus(complex(y));
        }
        if (x instanceof Long a && y instanceof Long b) {
            return a + b;
        }
        return number(x) + number(y);
    }

    static Object subtract(Object x, Object y) {
        if (x instanceof Complex || y instanceof Complex) {
            return complex(x).minus(complex(y));
        }
        if (x instanceof Long a && y instanceof Long b) {
            return a - b;
        }
        return number(x) - number(y);
    }

    static Object multiply(Object x, Object y) {
        if (x instanceof Complex || y instanceof Complex) {
            return complex(x).times(complex(y));
        }
        if (x instanceof Long a && y instanceof Long b) {
            return a * b;
        }
        return number(x) * number(y);
    }

    static Object narrow(Object x, ElementType type) {
        if (x instanceof Long v) {
            long n = v;
            return switch (type) {
                case INT8 -> (long) (byte) n;
                case INT16 -> (long) (short) n;
                case INT32 -> (long) (int) n;
                case UINT8 -> n & 0xFFL;
                default -> n;
            };
        }
        if (x instanceof Double v) {
            return round(v, type);
        }
        if (x instanceof Complex c && type == ElementType.COMPLEX64) {
            return new Complex(round(c.re(), ElementType.FP32), round(c.im(), ElementType.FP32));
        }
        return x;
    }

    private static double round(double v, ElementType type) {
        if (type == ElementType.FP32) {
            return (float) v;
        }
        if (type == ElementType.FP16) {
            return toHalfPrecision(v);
        }
        return v;
    }

    /**
     * Rounds to the nearest fp16 value, ties to even; beyond the largest finite
     * fp16 (65504) the result is infinite.
     */
    static double toHalfPrecision(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v) || v == 0.0) {
            return v;
        }
        double magnitude = Math.abs(v);
        // Spacing of fp16 values around magnitude; fixed at 2^-24 in the subnormal range.
        int exponent = Math.max(Math.getExponent(magnitude), -14);
        double ulp = Math.scalb(1.0, exponent - 10);
        double rounded = Math.rint(magnitude / ulp) * ulp;
        if (rounded > 65504.0) {
            rounded = Double.POSITIVE_INFINITY;
        }
        return Math.copySign(rounded, v);
    }

    /**
     * Joins {@code parts} along {@code axis}. With {@code interleave}, parts of equal
     * size are merged element by element along the axis instead of back to back.
     */
    static TensorValue concat(List<TensorValue> parts, int axis, boolean interleave) {
        int[] first = parts.get(0).shape();
        int[] shape = first.clone();
        int[] sizes = new int[parts.size()];
        shape[axis] = 0;
        for (int p = 0; p < parts.size(); p++) {
            sizes[p] = parts.get(p).shape()[axis];
            shape[axis] += sizes[p];
        }
        int outer = outer(first, axis);
        int inner = inner(first, axis);
        List<Object> out = new ArrayList<>();
        for (int o = 0; o < outer; o++) {
            if (interleave) {
                for (int i = 0; i < sizes[0]; i++) {
                    for (int p = 0; p < parts.size(); p++) {
                        copyRow(parts.get(p), o, i, sizes[p], inner, out);
                    }
                }
            } else {
                for (int p = 0; p < parts.size(); p++) {
                    for (int i = 0; i < sizes[p]; i++) {
                        copyRow(parts.get(p), o, i, sizes[p], inner, out);
                    }
                }
            }
        }
        return TensorValue.of(shape, out);
    }

    /**
     * The sub-tensor {@code [start, start + length)} along {@code axis}.
     */
    static TensorValue slice(TensorValue value, int axis, int start, int length) {
        int[] shape = value.shape().clone();
        int n = shape[axis];
        shape[axis] = length;
        int outer = outer(value.shape(), axis);
        int inner = inner(value.shape(), axis);
        List<Object> out = new ArrayList<>();
        for (int o = 0; o < outer; o++) {
            for (int i = start; i < start + length; i++) {
                copyRow(value, o, i, n, inner, out);
            }
        }
        return TensorValue.of(shape, out);
    }

    private static void copyRow(TensorValue value, int o, int i, int n, int inner, List<Object> out) {
        int base = (o * n + i) * inner;
        for (int j = 0; j < inner; j++) {
            out.add(value.get(base + j));
        }
    }

    private static double number(Object x) {
        if (x instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Not a numeric element: " + x);
    }

    private static Complex complex(Object x) {
        if (x instanceof Complex c) {
            return c;
        }
        return new Complex(number(x), 0.0);
    }
}
