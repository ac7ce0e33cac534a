package io.surfworks.tessera.ir;

import io.surfworks.tessera.ir.ContractViolationException.Reason;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.Classification;
import io.surfworks.tessera.ir.infer.InferenceUnavailableException;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.ListValue;
import io.surfworks.tessera.types.SymbolicAlgebra;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * One operation of the dataflow graph.
 *
 * <p>An operation binds value nodes to the named slots of its kind's
 * {@link InputSpec}, infers its output types and (where possible) values, and owns
 * the consumer edges from its inputs to itself. Bindings may be replaced by
 * {@link #rebind}; outputs are then re-checked by {@link #infer}.
 *
 * <p>Example:
 * <pre>{@code
 * Block main = new Block("main", BuildContext.defaults());
 * ValueNode x = main.addInput("x", TensorType.of(ElementType.INT32, 2));
 * OperationNode add = main.add(OperationNode.builder(StandardOps.ADD)
 *         .input("x", x)
 *         .input("y", y));
 * ValueNode sum = add.output();
 * }</pre>
 */
public final class OperationNode {

    private static final Logger LOG = Logger.getLogger(OperationNode.class.getName());

    /** Names accepted by {@link Builder#arguments} in addition to the contract slots. */
    public static final Set<String> SYSTEM_PARAMETERS = Set.of("name", "enclosing_block", "before_op", "skip_type_check");

    private final String name;
    private final OpKind kind;
    private final BuildContext context;
    private final InputSpec inputSpec;
    private final Map<String, Binding> inputs = new LinkedHashMap<>();
    private final List<Block> blocks = new ArrayList<>();
    private Map<String, ConstValue> defaults = Map.of();
    private List<ValueNode> outputs;
    private Block enclosingBlock;
    private OpState state = OpState.UNBOUND;

    private OperationNode(Builder builder) {
        this.kind = builder.kind;
        this.context = builder.context;
        this.name = builder.name != null ? builder.name : context.uniqueName(kind.name());
        this.enclosingBlock = builder.enclosingBlock;

        for (String slot : kind.inputSpec().inputTypes().keySet()) {
            inputs.put(slot, null);
        }
        for (String supplied : builder.bindings.keySet()) {
            if (!inputs.containsKey(supplied)) {
                throw new ContractViolationException(Reason.UNKNOWN_INPUT, name, kind.name(), supplied,
                        "Unknown input '" + supplied + "'");
            }
        }
        this.inputSpec = kind.inputSpec().resolve(context.registry(), name, kind.name());

        validateAndSetInputs(builder.bindings, builder.skipTypeCheck);
        refreshDefaults();
    }

    public static Builder builder(OpKind kind) {
        return new Builder(kind);
    }

    // ==================== Accessors ====================

    public String name() {
        return name;
    }

    public OpKind kind() {
        return kind;
    }

    public OpState state() {
        return state;
    }

    public BuildContext context() {
        return context;
    }

    /**
     * The contract with all named domains resolved.
     */
    public InputSpec inputSpec() {
        return inputSpec;
    }

    /**
     * Bound inputs in contract order, excluding internal slots and unbound slots.
     */
    public Map<String, Binding> inputs() {
        Map<String, Binding> out = new LinkedHashMap<>();
        for (Map.Entry<String, Binding> e : inputs.entrySet()) {
            if (e.getValue() != null && !InputType.isInternalName(e.getKey())) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Bound internal slots and their payload carriers.
     */
    public Map<String, InternalValueNode> internalInputs() {
        Map<String, InternalValueNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, Binding> e : inputs.entrySet()) {
            if (e.getValue() != null && InputType.isInternalName(e.getKey())) {
                out.put(e.getKey(), (InternalValueNode) e.getValue().nodes().get(0));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * The binding of {@code slot}, or null if unbound.
     */
    public Binding binding(String slot) {
        requireSlot(slot);
        return inputs.get(slot);
    }

    /**
     * The node bound to single slot {@code slot}, or null if unbound.
     */
    public ValueNode input(String slot) {
        Binding b = binding(slot);
        if (b == null) {
            return null;
        }
        if (b.isTuple()) {
            throw new IllegalArgumentException("Input " + slot + " of " + name + " is a tuple");
        }
        return b.nodes().get(0);
    }

    /**
     * The nodes bound to {@code slot}; empty if unbound.
     */
    public List<ValueNode> inputList(String slot) {
        Binding b = binding(slot);
        return b == null ? List.of() : b.nodes();
    }

    /**
     * Build-time value of a single slot: the bound node's value, else the kind's
     * computed default, else null.
     */
    public ConstValue inputValue(String slot) {
        ValueNode node = input(slot);
        if (node != null) {
            return node.value();
        }
        return defaults.get(slot);
    }

    /**
     * Defaults computed by the kind for optional slots left unbound.
     */
    public Map<String, ConstValue> defaultInputs() {
        return defaults;
    }

    /**
     * All bound input nodes with tuples expanded, excluding internal slots.
     */
    public List<ValueNode> flattenedInputs() {
        List<ValueNode> flat = new ArrayList<>();
        for (Binding b : inputs().values()) {
            flat.addAll(b.nodes());
        }
        return flat;
    }

    /**
     * Output nodes; empty until the first {@link #infer}.
     */
    public List<ValueNode> outputs() {
        return outputs == null ? List.of() : Collections.unmodifiableList(outputs);
    }

    /**
     * The only output of a single-output operation.
     */
    public ValueNode output() {
        if (outputs == null || outputs.size() != 1) {
            throw new IllegalStateException("Op " + name + " does not have exactly one output");
        }
        return outputs.get(0);
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Creates a nested block owned by this operation.
     */
    public Block newBlock(String blockName) {
        Block block = new Block(name + "/" + blockName, this);
        blocks.add(block);
        return block;
    }

    public Block enclosingBlock() {
        return enclosingBlock;
    }

    void setEnclosingBlock(Block block) {
        this.enclosingBlock = block;
    }

    // ==================== Rebinding ====================

    /**
     * Replaces bindings without re-inference.
     *
     * @see #rebind(Map, boolean, boolean)
     */
    public void rebind(Map<String, Binding> newBindings, boolean skipTypeCheck) {
        rebind(newBindings, skipTypeCheck, false);
    }

    /**
     * Replaces the bindings of the named slots.
     *
     * <p>Each new node must have a type compatible with the node it replaces unless
     * {@code skipTypeCheck} is set. Consumer edges are moved from the old nodes to the
     * new ones before this method returns. Tuple slots are paired positionally.
     *
     * @param reinfer re-run {@link #infer} afterwards; ignored when {@code skipTypeCheck} is set
     * @throws ContractViolationException if a binding violates the contract or a type check fails
     * @throws MissingRequiredInputException if a required slot ends up unbound
     */
    public void rebind(Map<String, Binding> newBindings, boolean skipTypeCheck, boolean reinfer) {
        requireAttached();
        validateAndSetInputs(newBindings, skipTypeCheck);
        refreshDefaults();
        if (reinfer && !skipTypeCheck) {
            infer(false);
        }
    }

    private void validateAndSetInputs(Map<String, Binding> newBindings, boolean skipTypeCheck) {
        inputSpec.validate(name, kind.name(), newBindings);

        // Check every pair before mutating anything.
        if (!skipTypeCheck) {
            for (Map.Entry<String, Binding> e : newBindings.entrySet()) {
                Binding existing = inputs.get(e.getKey());
                if (existing != null) {
                    checkReplacement(e.getKey(), existing.nodes(), e.getValue().nodes());
                }
            }
        }
        ensureRequiredInputs(newBindings);

        Set<ValueNode> previous = identitySet();
        for (Map.Entry<String, Binding> e : newBindings.entrySet()) {
            Binding existing = inputs.put(e.getKey(), e.getValue());
            if (existing != null) {
                previous.addAll(existing.nodes());
            }
        }
        Set<ValueNode> current = identitySet();
        for (Binding b : inputs.values()) {
            if (b != null) {
                current.addAll(b.nodes());
            }
        }
        for (ValueNode old : previous) {
            if (!current.contains(old)) {
                old.detachConsumer(this);
            }
        }
        for (ValueNode node : current) {
            node.attachConsumer(this);
        }
        updateBindingState();
    }

    private void checkReplacement(String slot, List<ValueNode> oldNodes, List<ValueNode> newNodes) {
        SymbolicAlgebra algebra = context.algebra();
        int n = Math.min(oldNodes.size(), newNodes.size());
        for (int i = 0; i < n; i++) {
            ValueNode oldNode = oldNodes.get(i);
            ValueNode newNode = newNodes.get(i);
            if (oldNode instanceof InternalValueNode || newNode instanceof InternalValueNode) {
                continue;
            }
            if (!algebra.typesCompatible(newNode.type(), oldNode.type())) {
                throw new ContractViolationException(Reason.INCOMPATIBLE_REBIND, name, kind.name(), slot,
                        String.format("new value %s is not compatible with existing value %s",
                                newNode.describe(), oldNode.describe()));
            }
        }
    }

    private void ensureRequiredInputs(Map<String, Binding> newBindings) {
        for (InputType type : inputSpec.inputTypes().values()) {
            boolean bound = newBindings.get(type.name()) != null || inputs.get(type.name()) != null;
            if (!type.optional() && !bound) {
                throw new MissingRequiredInputException(name, kind.name(), type.name());
            }
        }
    }

    private void refreshDefaults() {
        Map<String, ConstValue> computed = kind.defaultInputs(this);
        Map<String, ConstValue> kept = new LinkedHashMap<>();
        for (Map.Entry<String, ConstValue> e : computed.entrySet()) {
            InputType type = inputSpec.get(e.getKey()).orElseThrow(() -> new IllegalStateException(
                    "Kind " + kind.name() + " supplies a default for unknown input " + e.getKey()));
            if (type.computedDefault() && inputs.get(e.getKey()) == null) {
                kept.put(e.getKey(), e.getValue());
            }
        }
        defaults = Collections.unmodifiableMap(kept);
    }

    private void updateBindingState() {
        boolean any = false;
        boolean allRequired = true;
        for (InputType type : inputSpec.inputTypes().values()) {
            boolean bound = inputs.get(type.name()) != null;
            any |= bound;
            if (!type.optional() && !bound) {
                allRequired = false;
            }
        }
        if (allRequired) {
            state = OpState.FULLY_BOUND;
        } else {
            state = any ? OpState.PARTIALLY_BOUND : OpState.UNBOUND;
        }
    }

    // ==================== Inference ====================

    /**
     * Infers output types and values without overwriting existing outputs.
     *
     * @see #infer(boolean)
     */
    public void infer() {
        infer(false);
    }

    /**
     * Runs type inference and, through the classification gate, value inference.
     *
     * <p>On the first call the output nodes are created. Later calls check the
     * fresh results against the existing outputs: compatible types and
     * symbolic-compatible values are accepted, anything else is an error unless
     * {@code overwriteExisting} is set, in which case the outputs take the new
     * type and value.
     *
     * @throws TypeDriftException if an output type changes incompatibly
     * @throws ValueDriftException if an output value genuinely changes
     * @throws ShapeMismatchException if an output value changes shape
     * @throws UnsupportedRankException if a list output's element rank exceeds the limit
     */
    public void infer(boolean overwriteExisting) {
        requireAttached();
        ensureRequiredInputs(Map.of());

        List<SymbolicType> types = kind.inferTypes(this);
        List<ConstValue> values = inferValues(types.size());

        if (outputs == null) {
            outputs = createOutputs(types, values);
        } else {
            reconcileOutputs(types, values, overwriteExisting);
        }
        for (ValueNode out : outputs) {
            out.refreshNonReplaceableDownstream();
        }
        state = OpState.INFERRED;
    }

    private List<ConstValue> inferValues(int outputCount) {
        List<ConstValue> unknown = Arrays.asList(new ConstValue[outputCount]);
        try {
            ValueInference inference = kind.valueInference()
                    .orElseThrow(() -> new InferenceUnavailableException(kind.name(), null));
            Classification classification = context.gate().classify(inputSpec, inputs);
            context.gate().check(kind.name(), classification, inference.tolerates());

            List<ConstValue> values = inference.infer(this);
            if (values.size() != outputCount) {
                throw new IllegalStateException(String.format(
                        "Kind %s inferred %d values for %d outputs", kind.name(), values.size(), outputCount));
            }
            for (ConstValue v : values) {
                if (v == null) {
                    return unknown;
                }
            }
            return values;
        } catch (InferenceUnavailableException e) {
            LOG.fine(() -> "op " + name + ": " + e.getMessage() + "; output values unknown");
            return unknown;
        }
    }

    private List<String> outputNames(int outputCount) {
        Optional<List<String>> named = kind.outputNames(this);
        if (named.isPresent()) {
            if (named.get().size() != outputCount) {
                throw new IllegalStateException(String.format(
                        "Kind %s names %d outputs but infers %d", kind.name(), named.get().size(), outputCount));
            }
            List<String> out = new ArrayList<>();
            for (String suffix : named.get()) {
                out.add(suffix.isEmpty() ? name : name + "_" + suffix);
            }
            return out;
        }
        if (outputCount == 1) {
            return List.of(name);
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < outputCount; i++) {
            out.add(name + "_" + i);
        }
        return out;
    }

    private List<ValueNode> createOutputs(List<SymbolicType> types, List<ConstValue> values) {
        List<String> names = outputNames(types.size());
        for (int i = 0; i < types.size(); i++) {
            if (types.get(i) instanceof ListType listType
                    && listType.elementTensorType().rank() > UnsupportedRankException.MAX_LIST_ELEMENT_RANK) {
                throw new UnsupportedRankException(name, kind.name(), names.get(i),
                        listType.elementTensorType().rank());
            }
        }

        List<ValueNode> created = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            SymbolicType type = types.get(i);
            ConstValue value = values.get(i);
            String outName = names.get(i);
            if (type instanceof ListType listType) {
                ListValue listValue = value instanceof ListValue lv ? lv : null;
                created.add(new ListValueNode(outName, listType, listValue, this, i));
            } else if (type instanceof TensorType tensorType && tensorType.elementType().isComplex()) {
                ComplexParts parts = kind.complexParts(this, i, value).orElse(new ComplexParts(null, null));
                created.add(new ComplexValueNode(outName, tensorType, value, this, i, parts.real(), parts.imag()));
            } else {
                created.add(new ValueNode(outName, type, value, this, i));
            }
        }
        LOG.fine(() -> "op " + name + " created outputs " + created);
        return created;
    }

    private void reconcileOutputs(List<SymbolicType> types, List<ConstValue> values, boolean overwrite) {
        if (types.size() != outputs.size()) {
            throw new TypeDriftException(name, kind.name(), outputs.size(), types.size());
        }
        SymbolicAlgebra algebra = context.algebra();
        for (int i = 0; i < types.size(); i++) {
            ValueNode out = outputs.get(i);
            SymbolicType type = types.get(i);
            ConstValue value = values.get(i);

            if (overwrite) {
                out.overwriteType(type);
            } else if (!algebra.typesCompatible(type, out.type())) {
                throw new TypeDriftException(name, kind.name(), out.name(), out.type(), type);
            }

            if (overwrite) {
                out.overwriteValue(value);
            } else if (value != null && out.value() != null && !value.equals(out.value())) {
                String existingShape = shapeOf(out.value());
                String inferredShape = shapeOf(value);
                if (!existingShape.equals(inferredShape)) {
                    throw new ShapeMismatchException(name, kind.name(), out.name(), existingShape, inferredShape);
                }
                if (!algebra.arraysCompatible(value, out.value())) {
                    throw new ValueDriftException(name, kind.name(), out.name(), out.value(), value);
                }
            }
        }
    }

    private static String shapeOf(ConstValue value) {
        if (value instanceof TensorValue tv) {
            return Arrays.toString(tv.shape());
        }
        ListValue lv = (ListValue) value;
        List<String> shapes = new ArrayList<>();
        for (TensorValue e : lv.elements()) {
            shapes.add(Arrays.toString(e.shape()));
        }
        return "list" + shapes;
    }

    // ==================== Removal ====================

    /**
     * Detaches this operation from the graph.
     *
     * <p>Consumer edges are cleared from every input first, then the enclosing
     * container (if any) drops the operation. The operation cannot be used afterwards.
     *
     * @throws IllegalStateException if an output is still read by another operation
     */
    public void remove() {
        requireAttached();
        for (ValueNode out : outputs()) {
            if (!out.consumers().isEmpty()) {
                throw new IllegalStateException(String.format(
                        "Cannot remove op %s: output %s is still consumed by %s",
                        name, out.name(), out.consumers().stream().map(OperationNode::name).toList()));
            }
        }
        for (Block block : blocks) {
            block.clearOperations();
        }
        detachInputs();
        if (enclosingBlock != null) {
            enclosingBlock.detach(this);
        }
        LOG.fine(() -> "op " + name + " detached");
    }

    /**
     * Clears this operation's consumer edges and marks it detached without
     * consulting the container.
     */
    void detachInputs() {
        Set<ValueNode> bound = identitySet();
        for (Binding b : inputs.values()) {
            if (b != null) {
                bound.addAll(b.nodes());
            }
        }
        for (ValueNode node : bound) {
            node.detachConsumer(this);
        }
        state = OpState.DETACHED;
    }

    private void requireAttached() {
        if (state == OpState.DETACHED) {
            throw new IllegalStateException("Op " + name + " has been removed from its block");
        }
    }

    private void requireSlot(String slot) {
        if (!inputs.containsKey(slot)) {
            throw new IllegalArgumentException("Kind " + kind.name() + " has no input " + slot);
        }
    }

    private static Set<ValueNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (outputs != null) {
            sb.append(String.join(", ", outputs.stream().map(ValueNode::describe).toList()));
        }
        sb.append(" = ").append(kind.name()).append("(");
        List<String> args = new ArrayList<>();
        for (Map.Entry<String, Binding> e : inputs().entrySet()) {
            List<String> refs = e.getValue().nodes().stream().map(n -> "%" + n.name()).toList();
            args.add(e.getKey() + "=" + (e.getValue().isTuple() ? "(" + String.join(", ", refs) + ")" : refs.get(0)));
        }
        sb.append(String.join(", ", args)).append(", name=\"").append(name).append("\")");
        return sb.toString();
    }

    // ==================== Builder ====================

    /**
     * Collects the kind, name, bindings and system parameters of a new operation.
     */
    public static final class Builder {
        private final OpKind kind;
        private final Map<String, Binding> bindings = new LinkedHashMap<>();
        private BuildContext context;
        private String name;
        private Block enclosingBlock;
        private OperationNode beforeOp;
        private boolean skipTypeCheck;

        private Builder(OpKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder context(BuildContext context) {
            this.context = context;
            return this;
        }

        public Builder enclosingBlock(Block block) {
            this.enclosingBlock = block;
            return this;
        }

        /**
         * Insert position used by {@link Block#add}: directly before {@code op}.
         */
        public Builder beforeOp(OperationNode op) {
            this.beforeOp = op;
            return this;
        }

        public Builder skipTypeCheck(boolean skip) {
            this.skipTypeCheck = skip;
            return this;
        }

        /**
         * Binds a single node. A null node leaves the slot unbound.
         */
        public Builder input(String slot, ValueNode node) {
            if (node != null) {
                bindings.put(slot, Binding.of(node));
            }
            return this;
        }

        /**
         * Binds a tuple of nodes. A null list leaves the slot unbound.
         */
        public Builder input(String slot, List<? extends ValueNode> nodes) {
            if (nodes != null) {
                bindings.put(slot, Binding.of(nodes));
            }
            return this;
        }

        /**
         * Binds an opaque payload to internal slot {@code slot}.
         */
        public Builder internal(String slot, Object payload) {
            bindings.put(slot, Binding.of(new InternalValueNode(slot, payload)));
            return this;
        }

        /**
         * Applies keyword-style arguments, as produced by front-ends. Keys are either
         * {@link #SYSTEM_PARAMETERS} or input slots; slot values are a
         * {@link ValueNode}, a list of them, or null for unbound.
         *
         * @throws ContractViolationException if a key is neither a system parameter nor a slot
         */
        public Builder arguments(Map<String, ?> arguments) {
            for (Map.Entry<String, ?> e : arguments.entrySet()) {
                String key = e.getKey();
                Object v = e.getValue();
                switch (key) {
                    case "name" -> name((String) v);
                    case "enclosing_block" -> enclosingBlock((Block) v);
                    case "before_op" -> beforeOp((OperationNode) v);
                    case "skip_type_check" -> skipTypeCheck(Boolean.TRUE.equals(v));
                    default -> bindArgument(key, v);
                }
            }
            return this;
        }

        private void bindArgument(String key, Object v) {
            if (!kind.inputSpec().contains(key)) {
                throw new ContractViolationException(Reason.UNKNOWN_INPUT, name, kind.name(), key,
                        "Unknown input '" + key + "'");
            }
            if (v == null) {
                return;
            }
            if (v instanceof ValueNode node) {
                input(key, node);
            } else if (v instanceof List<?> list) {
                List<ValueNode> nodes = new ArrayList<>(list.size());
                for (Object o : list) {
                    nodes.add((ValueNode) o);
                }
                input(key, nodes);
            } else if (InputType.isInternalName(key)) {
                internal(key, v);
            } else {
                throw new ContractViolationException(Reason.TYPE_MISMATCH, name, kind.name(), key,
                        "Input '" + key + "' must be a value node or a list of value nodes");
            }
        }

        OperationNode beforeOp() {
            return beforeOp;
        }

        Block enclosingBlock() {
            return enclosingBlock;
        }

        /**
         * Constructs the operation: binds and validates inputs and checks that every
         * required slot is bound. Outputs are created by the first {@link OperationNode#infer}.
         */
        public OperationNode build() {
            if (context == null) {
                context = enclosingBlock != null ? enclosingBlock.context() : BuildContext.defaults();
            }
            return new OperationNode(this);
        }
    }
}
