package io.surfworks.tessera.ir;

/**
 * A binding does not satisfy the operation kind's input contract.
 */
public class ContractViolationException extends TesseraException {

    /**
     * Which part of the contract was violated.
     */
    public enum Reason {
        /** The input name is neither a contract slot nor a system parameter */
        UNKNOWN_INPUT,
        /** The bound value's element type is outside the slot's domain */
        TYPE_MISMATCH,
        /** A single value was bound to a tuple slot, or vice versa */
        MULTIPLICITY_MISMATCH,
        /** A tuple slot received a sequence of the wrong length */
        TUPLE_LENGTH_MISMATCH,
        /** A rebind supplied a value whose type is incompatible with the one it replaces */
        INCOMPATIBLE_REBIND
    }

    private final Reason reason;
    private final String slot;

    public ContractViolationException(Reason reason, String opName, String kind, String slot, String message) {
        super(message, opName, kind);
        this.reason = reason;
        this.slot = slot;
    }

    public Reason getReason() {
        return reason;
    }

    public String getSlot() {
        return slot;
    }
}
