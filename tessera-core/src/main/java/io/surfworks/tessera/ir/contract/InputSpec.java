package io.surfworks.tessera.ir.contract;

import io.surfworks.tessera.ir.Binding;
import io.surfworks.tessera.ir.ContractViolationException;
import io.surfworks.tessera.ir.ContractViolationException.Reason;
import io.surfworks.tessera.ir.InternalValueNode;
import io.surfworks.tessera.ir.UnresolvedDomainException;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.types.ElementType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The input contract of one operation kind: its named slots, in declaration order.
 *
 * <p>Validation checks that bound names exist, that tuple and single slots receive
 * the right shape of binding, and that every bound node's element type lies in the
 * slot's domain. It does not check completeness; required slots are verified by
 * the operation node once all bindings are applied.
 */
public final class InputSpec {

    private final Map<String, InputType> inputTypes;

    private InputSpec(Map<String, InputType> inputTypes) {
        this.inputTypes = Collections.unmodifiableMap(inputTypes);
    }

    public static InputSpec of(InputType... types) {
        Map<String, InputType> map = new LinkedHashMap<>();
        for (InputType type : types) {
            if (map.put(type.name(), type) != null) {
                throw new IllegalArgumentException("Duplicate input name: " + type.name());
            }
        }
        return new InputSpec(map);
    }

    public Map<String, InputType> inputTypes() {
        return inputTypes;
    }

    public Optional<InputType> get(String name) {
        return Optional.ofNullable(inputTypes.get(name));
    }

    public boolean contains(String name) {
        return inputTypes.containsKey(name);
    }

    public boolean isResolved() {
        return inputTypes.values().stream().allMatch(InputType::isResolved);
    }

    /**
     * Returns a copy whose named domains are replaced by the element types the
     * registry accepts for them. Entries that are already resolved are kept as is.
     *
     * @throws UnresolvedDomainException if an entry names a domain the registry lacks
     */
    public InputSpec resolve(TypeDomainRegistry registry, String opName, String kind) {
        if (isResolved()) {
            return this;
        }
        Map<String, InputType> resolved = new LinkedHashMap<>();
        for (InputType type : inputTypes.values()) {
            if (type.isResolved()) {
                resolved.put(type.name(), type);
                continue;
            }
            if (type.domainId() == null) {
                throw new UnresolvedDomainException(opName, kind, type.name(), "<none>");
            }
            Set<ElementType> domain = registry.find(type.domainId())
                    .orElseThrow(() -> new UnresolvedDomainException(opName, kind, type.name(), type.domainId()));
            resolved.put(type.name(), type.withDomain(domain));
        }
        return new InputSpec(resolved);
    }

    /**
     * Checks {@code bindings} against this contract.
     *
     * @throws ContractViolationException on the first violation found
     */
    public void validate(String opName, String kind, Map<String, Binding> bindings) {
        for (String name : bindings.keySet()) {
            if (!inputTypes.containsKey(name)) {
                throw new ContractViolationException(Reason.UNKNOWN_INPUT, opName, kind, name,
                        "Unknown input '" + name + "'");
            }
        }
        for (Map.Entry<String, Binding> entry : bindings.entrySet()) {
            InputType type = inputTypes.get(entry.getKey());
            Binding binding = entry.getValue();
            if (type.isTuple() != binding.isTuple()) {
                throw new ContractViolationException(Reason.MULTIPLICITY_MISMATCH, opName, kind, type.name(),
                        String.format("input %s expects a %s binding", type.name(),
                                type.isTuple() ? "tuple" : "single"));
            }
            if (type.tupleLength() >= 0 && binding.nodes().size() != type.tupleLength()) {
                throw new ContractViolationException(Reason.TUPLE_LENGTH_MISMATCH, opName, kind, type.name(),
                        String.format("input %s expects %d values, got %d",
                                type.name(), type.tupleLength(), binding.nodes().size()));
            }
            for (ValueNode node : binding.nodes()) {
                checkElementType(opName, kind, type, node);
            }
        }
    }

    private static void checkElementType(String opName, String kind, InputType type, ValueNode node) {
        boolean isInternalNode = node instanceof InternalValueNode;
        if (type.internal() != isInternalNode) {
            throw new ContractViolationException(Reason.TYPE_MISMATCH, opName, kind, type.name(),
                    String.format("input %s %s an internal value, got %s", type.name(),
                            type.internal() ? "expects" : "does not accept", node.describe()));
        }
        if (type.internal()) {
            return;
        }
        if (!type.isResolved()) {
            throw new IllegalStateException("Input " + type.name() + " of " + kind + " has an unresolved domain");
        }
        ElementType elementType = node.type().elementType();
        if (!type.accepts(elementType)) {
            throw new ContractViolationException(Reason.TYPE_MISMATCH, opName, kind, type.name(),
                    String.format("input %s has element type %s, expected one of %s",
                            type.name(), elementType, type.domain()));
        }
    }

    @Override
    public String toString() {
        return "InputSpec" + inputTypes.keySet();
    }
}
