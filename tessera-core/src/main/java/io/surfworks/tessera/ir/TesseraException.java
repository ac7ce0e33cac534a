package io.surfworks.tessera.ir;

/**
 * Base class for hard failures raised while building or rewriting a graph.
 *
 * <p>Every failure names the operation and its kind so that callers can report a
 * precise diagnostic. None of these are retried by the core.
 */
public class TesseraException extends RuntimeException {

    private final String opName;
    private final String kind;

    public TesseraException(String message) {
        super(message);
        this.opName = null;
        this.kind = null;
    }

    public TesseraException(String message, String opName, String kind) {
        super(prefix(opName, kind) + message);
        this.opName = opName;
        this.kind = kind;
    }

    /**
     * Name of the offending operation, or null if raised outside an operation.
     */
    public String getOpName() {
        return opName;
    }

    /**
     * Kind of the offending operation, or null if raised outside an operation.
     */
    public String getKind() {
        return kind;
    }

    private static String prefix(String opName, String kind) {
        if (opName == null && kind == null) {
            return "";
        }
        return String.format("Op \"%s\" (kind: %s) ", opName, kind);
    }
}
