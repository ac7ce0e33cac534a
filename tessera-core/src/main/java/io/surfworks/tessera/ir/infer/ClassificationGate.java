package io.surfworks.tessera.ir.infer;

import io.surfworks.tessera.ir.Binding;
import io.surfworks.tessera.ir.InternalValueNode;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.types.SymbolicAlgebra;

import java.util.Map;
import java.util.Set;

/**
 * Decides whether a value inference may run for an operation's current inputs.
 *
 * <p>Only required inputs are classified; tuples are expanded element-wise and
 * optional or internal slots are skipped. A node is {@link InputClass#SYMBOLIC}
 * if its type or value contains an unresolved symbol, otherwise
 * {@link InputClass#MATERIALIZED} if it has a value, otherwise
 * {@link InputClass#ABSENT}.
 */
public final class ClassificationGate {

    private final SymbolicAlgebra algebra;

    public ClassificationGate(SymbolicAlgebra algebra) {
        this.algebra = algebra;
    }

    public InputClass classify(ValueNode node) {
        if (algebra.isSymbolic(node.type()) || algebra.isSymbolic(node.value())) {
            return InputClass.SYMBOLIC;
        }
        return node.hasValue() ? InputClass.MATERIALIZED : InputClass.ABSENT;
    }

    /**
     * Accumulates the classes of every required input bound in {@code bindings}.
     * Unbound required slots count as absent.
     */
    public Classification classify(InputSpec spec, Map<String, Binding> bindings) {
        Classification acc = Classification.EMPTY;
        for (InputType type : spec.inputTypes().values()) {
            if (type.optional() || type.internal()) {
                continue;
            }
            Binding binding = bindings.get(type.name());
            if (binding == null) {
                acc = acc.with(InputClass.ABSENT);
                continue;
            }
            for (ValueNode node : binding.nodes()) {
                if (node instanceof InternalValueNode) {
                    continue;
                }
                acc = acc.with(classify(node));
            }
        }
        return acc;
    }

    /**
     * Passes if every class present in {@code classification} is tolerated.
     *
     * @throws InferenceUnavailableException naming the first untolerated class,
     *         checked in the order materialized, symbolic, absent
     */
    public void check(String kind, Classification classification, Set<InputClass> tolerated)
            throws InferenceUnavailableException {
        for (InputClass c : InputClass.values()) {
            if (classification.has(c) && !tolerated.contains(c)) {
                throw new InferenceUnavailableException(kind, c);
            }
        }
    }
}
