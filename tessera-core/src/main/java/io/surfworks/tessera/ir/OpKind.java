package io.surfworks.tessera.ir;

import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.SymbolicType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The per-kind behavior of an operation: its input contract and its inference rules.
 *
 * <p>Only {@link #name()}, {@link #inputSpec()} and {@link #inferTypes} are mandatory.
 * The remaining capabilities default to "not implemented", which the operation
 * node treats as a normal branch: no value inference means every output value is
 * unknown, no output names means default naming, no nested blocks means a flat
 * operation.
 */
public interface OpKind {

    /**
     * Kind identifier, e.g. {@code "add"}.
     */
    String name();

    /**
     * The input contract. Named domains are resolved by each operation node against
     * its build context's registry.
     */
    InputSpec inputSpec();

    /**
     * One output type per declared output.
     */
    List<SymbolicType> inferTypes(OperationNode op);

    default Optional<ValueInference> valueInference() {
        return Optional.empty();
    }

    /**
     * Suffixes for output names; output {@code i} is named {@code <op>_<suffix i>}.
     */
    default Optional<List<String>> outputNames(OperationNode op) {
        return Optional.empty();
    }

    /**
     * Values of optional inputs the caller left unbound. Called once all required
     * inputs are bound, and again after every rebind.
     */
    default Map<String, ConstValue> defaultInputs(OperationNode op) {
        return Map.of();
    }

    /**
     * Builds nested blocks for structural kinds (conditionals, loops). Called by the
     * enclosing block after construction and before the first inference.
     */
    default void buildNestedBlocks(OperationNode op) {}

    /**
     * Real and imaginary parts of complex output {@code outputIndex}. Only kinds that
     * originate complex data implement this; other complex outputs are placeholders.
     */
    default Optional<ComplexParts> complexParts(OperationNode op, int outputIndex, ConstValue inferredValue) {
        return Optional.empty();
    }
}
