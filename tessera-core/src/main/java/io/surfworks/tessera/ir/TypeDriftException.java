package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.SymbolicType;

/**
 * Re-inference produced an output type incompatible with the existing output.
 */
public class TypeDriftException extends TesseraException {

    private final String output;
    private final SymbolicType existing;
    private final SymbolicType inferred;

    public TypeDriftException(String opName, String kind, String output, SymbolicType existing, SymbolicType inferred) {
        super(String.format("output %s type changes with new inputs: %s -> %s", output, existing, inferred),
                opName, kind);
        this.output = output;
        this.existing = existing;
        this.inferred = inferred;
    }

    public TypeDriftException(String opName, String kind, int existingCount, int inferredCount) {
        super(String.format("output count changes with new inputs: %d -> %d", existingCount, inferredCount),
                opName, kind);
        this.output = null;
        this.existing = null;
        this.inferred = null;
    }

    public String getOutput() {
        return output;
    }

    public SymbolicType getExisting() {
        return existing;
    }

    public SymbolicType getInferred() {
        return inferred;
    }
}
