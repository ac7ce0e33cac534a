package io.surfworks.tessera.ir.contract;

import io.surfworks.tessera.types.ElementType;

import java.util.Objects;
import java.util.Set;

/**
 * Contract entry for one named input of an operation kind.
 *
 * <p>Entries are immutable; the {@code asOptional()}, {@code withDefault()} and
 * {@code length(int)} methods return modified copies:
 * <pre>{@code
 * InputType.tensor("x", "T");                       // required, domain "T"
 * InputType.tensor("axis", "T_INT").withDefault();  // optional, kind computes a default
 * InputType.tuple("values", "T").length(2);         // exactly two nodes
 * InputType.internal("_true_fn");                   // opaque payload
 * }</pre>
 *
 * @param name            slot name; names starting with {@code _} are internal
 * @param multiplicity    single node or tuple of nodes
 * @param optional        whether the slot may stay unbound
 * @param domainId        named domain resolved against a {@link TypeDomainRegistry}, or null
 * @param domain          accepted element types; empty until resolved
 * @param internal        slot takes an opaque payload and has no element type
 * @param computedDefault absence means the kind computes a default value
 * @param tupleLength     required tuple length, or -1 for any length
 */
public record InputType(
        String name,
        Multiplicity multiplicity,
        boolean optional,
        String domainId,
        Set<ElementType> domain,
        boolean internal,
        boolean computedDefault,
        int tupleLength
) {

    public InputType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(multiplicity, "multiplicity");
        domain = Set.copyOf(domain);
        if (internal != isInternalName(name)) {
            throw new IllegalArgumentException("Internal slot names must start with '_': " + name);
        }
    }

    public static InputType tensor(String name, String domainId) {
        return new InputType(name, Multiplicity.SINGLE, false, domainId, Set.of(), false, false, -1);
    }

    public static InputType tensor(String name, Set<ElementType> domain) {
        return new InputType(name, Multiplicity.SINGLE, false, null, domain, false, false, -1);
    }

    public static InputType tuple(String name, String domainId) {
        return new InputType(name, Multiplicity.TUPLE, false, domainId, Set.of(), false, false, -1);
    }

    public static InputType tuple(String name, Set<ElementType> domain) {
        return new InputType(name, Multiplicity.TUPLE, false, null, domain, false, false, -1);
    }

    public static InputType internal(String name) {
        return new InputType(name, Multiplicity.SINGLE, false, null, Set.of(), true, false, -1);
    }

    public InputType asOptional() {
        return new InputType(name, multiplicity, true, domainId, domain, internal, computedDefault, tupleLength);
    }

    /**
     * Optional slot whose absence makes the kind compute a default.
     */
    public InputType withDefault() {
        return new InputType(name, multiplicity, true, domainId, domain, internal, true, tupleLength);
    }

    public InputType length(int expected) {
        if (multiplicity != Multiplicity.TUPLE) {
            throw new IllegalStateException("Only tuple inputs have a length: " + name);
        }
        return new InputType(name, multiplicity, optional, domainId, domain, internal, computedDefault, expected);
    }

    InputType withDomain(Set<ElementType> resolved) {
        return new InputType(name, multiplicity, optional, domainId, resolved, internal, computedDefault, tupleLength);
    }

    /**
     * True once the accepted element types are known.
     */
    public boolean isResolved() {
        return internal || !domain.isEmpty();
    }

    public boolean accepts(ElementType elementType) {
        return internal || domain.contains(elementType);
    }

    public boolean isTuple() {
        return multiplicity == Multiplicity.TUPLE;
    }

    public static boolean isInternalName(String name) {
        return name.startsWith("_");
    }
}
