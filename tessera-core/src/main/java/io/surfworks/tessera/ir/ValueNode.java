package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.SymbolicType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A typed vertex of the dataflow graph.
 *
 * <p>A ValueNode is produced by at most one {@link OperationNode} (none for block
 * inputs) and read by any number of consumers. The consumer set is edge
 * bookkeeping only: it is mutated exclusively through the paired
 * attach/detach calls that {@link OperationNode} issues on construction, rebinding
 * and removal.
 *
 * <p>Example:
 * <pre>{@code
 * ValueNode x = new ValueNode("x", TensorType.of(ElementType.INT32, 2), TensorValue.vector(1, 2));
 * x.consumers();      // operations currently reading x
 * x.producer();       // null: x is a graph input
 * }</pre>
 */
public class ValueNode {

    private static final Logger LOG = Logger.getLogger(ValueNode.class.getName());

    private final String name;
    private SymbolicType type;
    private ConstValue value;
    private final OperationNode producer;
    private final int outputIndex;
    private final Set<OperationNode> consumers = new LinkedHashSet<>();
    private boolean replaceable = true;
    private Set<ValueNode> nonReplaceableUpstream = Set.of();

    /**
     * Creates a graph input without a known value.
     */
    public ValueNode(String name, SymbolicType type) {
        this(name, type, null, null, -1);
    }

    /**
     * Creates a graph input, optionally carrying a value known at build time.
     */
    public ValueNode(String name, SymbolicType type, ConstValue value) {
        this(name, type, value, null, -1);
    }

    protected ValueNode(String name, SymbolicType type, ConstValue value, OperationNode producer, int outputIndex) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.value = value;
        this.producer = producer;
        this.outputIndex = outputIndex;
    }

    public String name() {
        return name;
    }

    public SymbolicType type() {
        return type;
    }

    /**
     * The value known at graph-build time, or null if it is not computable.
     */
    public ConstValue value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * The operation that produced this node, or null for a block input.
     */
    public OperationNode producer() {
        return producer;
    }

    /**
     * Position of this node in its producer's outputs, or -1 for a block input.
     */
    public int outputIndex() {
        return outputIndex;
    }

    /**
     * Operations currently reading this node, in attach order.
     */
    public List<OperationNode> consumers() {
        return List.copyOf(consumers);
    }

    public boolean isConsumedBy(OperationNode op) {
        return consumers.contains(op);
    }

    public boolean isReplaceable() {
        return replaceable;
    }

    /**
     * Pins this node against substitution (or releases it). The change is pushed to
     * every downstream dependent's {@link #nonReplaceableUpstream()} set.
     */
    public void setReplaceable(boolean replaceable) {
        if (this.replaceable == replaceable) {
            return;
        }
        this.replaceable = replaceable;
        refreshNonReplaceableDownstream();
    }

    /**
     * Non-replaceable nodes this node depends on, itself included when pinned.
     */
    public Set<ValueNode> nonReplaceableUpstream() {
        return nonReplaceableUpstream;
    }

    /**
     * True if every non-replaceable dependency of this node is also a dependency
     * of {@code other}, so substituting {@code other} loses no pinned value.
     */
    public boolean canBeReplacedBy(ValueNode other) {
        return other.nonReplaceableUpstream.containsAll(nonReplaceableUpstream);
    }

    void attachConsumer(OperationNode op) {
        if (consumers.add(op)) {
            LOG.fine(() -> "attach " + op.name() + " as consumer of " + name);
        }
    }

    void detachConsumer(OperationNode op) {
        if (!consumers.remove(op)) {
            throw new IllegalStateException(
                    "Op " + op.name() + " is not a consumer of " + name + "; consumer edges are stale");
        }
        LOG.fine(() -> "detach " + op.name() + " from consumers of " + name);
    }

    void overwriteType(SymbolicType newType) {
        this.type = newType;
    }

    void overwriteValue(ConstValue newValue) {
        this.value = newValue;
    }

    /**
     * Recomputes the non-replaceable marker here and at every node reachable
     * through consumer edges. A node's dependents are revisited whenever its set
     * changes, so nodes reached along paths of different length settle on the
     * final sets of all their inputs.
     */
    void refreshNonReplaceableDownstream() {
        Deque<ValueNode> work = new ArrayDeque<>();
        recomputeNonReplaceableUpstream();
        enqueueDependents(work);
        while (!work.isEmpty()) {
            ValueNode node = work.poll();
            if (node.recomputeNonReplaceableUpstream()) {
                node.enqueueDependents(work);
            }
        }
    }

    private void enqueueDependents(Deque<ValueNode> work) {
        for (OperationNode consumer : consumers) {
            work.addAll(consumer.outputs());
        }
    }

    /**
     * @return true if the set changed
     */
    private boolean recomputeNonReplaceableUpstream() {
        Set<ValueNode> upstream = Collections.newSetFromMap(new IdentityHashMap<>());
        if (!replaceable) {
            upstream.add(this);
        }
        if (producer != null) {
            for (ValueNode input : producer.flattenedInputs()) {
                upstream.addAll(input.nonReplaceableUpstream);
            }
        }
        if (sameMembers(upstream, nonReplaceableUpstream)) {
            return false;
        }
        nonReplaceableUpstream = upstream.isEmpty() ? Set.of() : Collections.unmodifiableSet(upstream);
        return true;
    }

    private static boolean sameMembers(Set<ValueNode> a, Set<ValueNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (ValueNode node : b) {
            if (!a.contains(node)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Short form used in diagnostics: {@code %name: fp32[2,is0]}.
     */
    public String describe() {
        return "%" + name + ": " + (type == null ? "internal" : type.toTypeString());
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add(describe());
        if (value != null) {
            parts.add("value=" + value);
        }
        return String.join(" ", parts);
    }
}
