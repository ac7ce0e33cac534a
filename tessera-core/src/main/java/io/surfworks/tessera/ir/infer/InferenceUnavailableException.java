package io.surfworks.tessera.ir.infer;

/**
 * Value inference cannot run for the current inputs.
 *
 * <p>This is an expected outcome, not a failure: the caller treats every output
 * value as unknown and carries on.
 */
public class InferenceUnavailableException extends Exception {

    private final String kind;
    private final InputClass offending;

    public InferenceUnavailableException(String kind, InputClass offending) {
        super(offending == null
                ? "Value inference is not implemented by kind " + kind
                : "Value inference of kind " + kind + " does not support " + offending + " inputs");
        this.kind = kind;
        this.offending = offending;
    }

    public String getKind() {
        return kind;
    }

    /**
     * The input class that was not tolerated, or null if the kind has no value inference.
     */
    public InputClass getOffending() {
        return offending;
    }
}
