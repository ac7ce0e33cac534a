package io.surfworks.tessera.ir;

/**
 * Re-inference produced an output value whose shape differs from the existing value.
 */
public class ShapeMismatchException extends TesseraException {

    private final String output;

    public ShapeMismatchException(String opName, String kind, String output, String existingShape, String inferredShape) {
        super(String.format("inferred value shape for output %s changes: %s -> %s", output, existingShape, inferredShape),
                opName, kind);
        this.output = output;
    }

    public String getOutput() {
        return output;
    }
}
