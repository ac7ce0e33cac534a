package io.surfworks.tessera.types;

import java.util.Locale;

/**
 * Element types a tensor in the graph may carry.
 *
 * <p>Each constant has a canonical lower-case name ({@code fp32}, {@code int32}, ...)
 * used by the type-domain configuration and in diagnostics.
 */
public enum ElementType {
    BOOL("bool", 1, false, false, false),
    INT8("int8", 1, true, false, false),
    INT16("int16", 2, true, false, false),
    INT32("int32", 4, true, false, false),
    INT64("int64", 8, true, false, false),
    UINT8("uint8", 1, true, false, false),
    FP16("fp16", 2, false, true, false),
    FP32("fp32", 4, false, true, false),
    FP64("fp64", 8, false, true, false),
    COMPLEX64("complex64", 8, false, false, true),
    COMPLEX128("complex128", 16, false, false, true),
    STRING("string", 0, false, false, false);

    private final String canonicalName;
    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;
    private final boolean isComplex;

    ElementType(String canonicalName, int byteSize, boolean isInteger, boolean isFloating, boolean isComplex) {
        this.canonicalName = canonicalName;
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
        this.isComplex = isComplex;
    }

    public String canonicalName() {
        return canonicalName;
    }

    /**
     * Size of one element in bytes; 0 for variable-width types.
     */
    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    public boolean isComplex() {
        return isComplex;
    }

    /**
     * The floating-point type holding one component of a complex type.
     */
    public ElementType componentType() {
        return switch (this) {
            case COMPLEX64 -> FP32;
            case COMPLEX128 -> FP64;
            default -> throw new IllegalStateException(this + " is not a complex type");
        };
    }

    /**
     * The complex type whose components are of this floating-point type.
     */
    public ElementType complexOf() {
        return switch (this) {
            case FP16, FP32 -> COMPLEX64;
            case FP64 -> COMPLEX128;
            default -> throw new IllegalStateException(this + " has no complex counterpart");
        };
    }

    /**
     * Look up an element type by canonical name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ElementType of(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (ElementType type : values()) {
            if (type.canonicalName.equals(lower)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown element type: " + name);
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
