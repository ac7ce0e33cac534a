package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.ConstValue;

/**
 * Re-inference produced an output value that genuinely differs from the existing one.
 */
public class ValueDriftException extends TesseraException {

    private final String output;
    private final ConstValue existing;
    private final ConstValue inferred;

    public ValueDriftException(String opName, String kind, String output, ConstValue existing, ConstValue inferred) {
        super(String.format("value inference differs for output %s: %s -> %s", output, existing, inferred),
                opName, kind);
        this.output = output;
        this.existing = existing;
        this.inferred = inferred;
    }

    public String getOutput() {
        return output;
    }

    public ConstValue getExisting() {
        return existing;
    }

    public ConstValue getInferred() {
        return inferred;
    }
}
