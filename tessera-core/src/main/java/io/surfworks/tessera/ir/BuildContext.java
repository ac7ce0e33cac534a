package io.surfworks.tessera.ir;

import io.surfworks.tessera.ir.contract.TypeDomainRegistry;
import io.surfworks.tessera.ir.infer.ClassificationGate;
import io.surfworks.tessera.types.DefaultSymbolicAlgebra;
import io.surfworks.tessera.types.SymbolicAlgebra;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration shared by every operation of one graph-building session: the
 * type-domain registry, the symbolic algebra, and the name generator.
 *
 * <p>Like the graph it builds, a context is confined to a single writer.
 */
public final class BuildContext {

    private final TypeDomainRegistry registry;
    private final SymbolicAlgebra algebra;
    private final ClassificationGate gate;
    private final Map<String, Integer> nameCounters = new HashMap<>();

    public BuildContext(TypeDomainRegistry registry, SymbolicAlgebra algebra) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.algebra = Objects.requireNonNull(algebra, "algebra");
        this.gate = new ClassificationGate(algebra);
    }

    /**
     * Context with the bundled type domains and the structural symbolic algebra.
     */
    public static BuildContext defaults() {
        return new BuildContext(TypeDomainRegistry.defaults(), DefaultSymbolicAlgebra.INSTANCE);
    }

    public TypeDomainRegistry registry() {
        return registry;
    }

    public SymbolicAlgebra algebra() {
        return algebra;
    }

    public ClassificationGate gate() {
        return gate;
    }

    /**
     * Generates {@code prefix_0}, {@code prefix_1}, ... in call order.
     */
    public String uniqueName(String prefix) {
        int n = nameCounters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + "_" + n;
    }
}
