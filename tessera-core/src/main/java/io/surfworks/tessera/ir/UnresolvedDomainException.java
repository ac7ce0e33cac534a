package io.surfworks.tessera.ir;

/**
 * A contract refers to a type domain the registry does not define.
 *
 * <p>This indicates a misconfigured operation kind rather than bad user input.
 */
public class UnresolvedDomainException extends TesseraException {

    private final String domainId;
    private final String slot;

    public UnresolvedDomainException(String domainId) {
        super("Type domain " + domainId + " not defined");
        this.domainId = domainId;
        this.slot = null;
    }

    public UnresolvedDomainException(String opName, String kind, String slot, String domainId) {
        super("input " + slot + " refers to type domain " + domainId + " which is not defined", opName, kind);
        this.domainId = domainId;
        this.slot = slot;
    }

    public String getDomainId() {
        return domainId;
    }

    public String getSlot() {
        return slot;
    }
}
