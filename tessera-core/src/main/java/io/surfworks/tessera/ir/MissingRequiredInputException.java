package io.surfworks.tessera.ir;

/**
 * A required input slot is unbound after construction or rebinding.
 */
public class MissingRequiredInputException extends TesseraException {

    private final String slot;

    public MissingRequiredInputException(String opName, String kind, String slot) {
        super("Required input " + slot + " is missing", opName, kind);
        this.slot = slot;
    }

    public String getSlot() {
        return slot;
    }
}
