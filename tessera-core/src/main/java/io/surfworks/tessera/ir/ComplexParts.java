package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.TensorValue;

/**
 * Real and imaginary parts of a complex tensor, either of which may be unknown.
 */
public record ComplexParts(TensorValue real, TensorValue imag) {}
