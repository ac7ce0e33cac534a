package io.surfworks.tessera.ir;

import io.surfworks.tessera.types.SymbolicType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * An ordered sequence of operations with block inputs and block outputs.
 *
 * <p>A root block starts a graph-building session and carries its
 * {@link BuildContext}; nested blocks belong to a structural operation (for
 * instance the branches of a conditional) and share its context. Operations in a
 * nested block may read values defined in enclosing blocks.
 */
public class Block implements OperationContainer {

    private static final Logger LOG = Logger.getLogger(Block.class.getName());

    private final String name;
    private final BuildContext context;
    private final OperationNode owner;
    private final List<ValueNode> inputs = new ArrayList<>();
    private final List<OperationNode> operations = new ArrayList<>();
    private final List<ValueNode> outputs = new ArrayList<>();

    public Block(String name, BuildContext context) {
        this.name = name;
        this.context = context;
        this.owner = null;
    }

    Block(String name, OperationNode owner) {
        this.name = name;
        this.context = owner.context();
        this.owner = owner;
    }

    public String name() {
        return name;
    }

    public BuildContext context() {
        return context;
    }

    /**
     * The structural operation this block is nested in, or null for a root block.
     */
    public OperationNode owner() {
        return owner;
    }

    public ValueNode addInput(String inputName, SymbolicType type) {
        return addInput(new ValueNode(inputName, type));
    }

    public ValueNode addInput(ValueNode input) {
        if (input.producer() != null) {
            throw new IllegalArgumentException("Block input " + input.name() + " must not have a producer");
        }
        inputs.add(input);
        return input;
    }

    public List<ValueNode> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<OperationNode> operations() {
        return Collections.unmodifiableList(operations);
    }

    public List<ValueNode> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public void setOutputs(List<ValueNode> newOutputs) {
        outputs.clear();
        outputs.addAll(newOutputs);
    }

    /**
     * Builds the operation inside this block, lets its kind build nested blocks,
     * infers its outputs and inserts it, at the end or before the builder's
     * {@code beforeOp}.
     */
    public OperationNode add(OperationNode.Builder builder) {
        if (builder.enclosingBlock() != null && builder.enclosingBlock() != this) {
            throw new IllegalArgumentException("Builder is bound to block " + builder.enclosingBlock().name());
        }
        OperationNode op = builder.enclosingBlock(this).context(context).build();
        try {
            op.kind().buildNestedBlocks(op);
            op.infer(false);
        } catch (RuntimeException e) {
            for (Block nested : op.blocks()) {
                nested.clearOperations();
            }
            op.detachInputs();
            throw e;
        }

        OperationNode before = builder.beforeOp();
        if (before == null) {
            operations.add(op);
        } else {
            int index = operations.indexOf(before);
            if (index < 0) {
                throw new IllegalArgumentException("Op " + before.name() + " is not in block " + name);
            }
            operations.add(index, op);
        }
        LOG.fine(() -> "block " + name + " added " + op);
        return op;
    }

    /**
     * Removes {@code ops}, last first, so that operations consuming each other's
     * outputs can be removed together.
     *
     * @throws IllegalStateException if an output of a removed op is still read
     *         outside the removed set, or is an output of this block
     */
    public void removeOperations(List<OperationNode> ops) {
        List<OperationNode> ordered = new ArrayList<>(ops);
        ordered.sort((a, b) -> Integer.compare(operations.indexOf(b), operations.indexOf(a)));
        for (OperationNode op : ordered) {
            for (ValueNode out : op.outputs()) {
                if (outputs.contains(out)) {
                    throw new IllegalStateException(String.format(
                            "Cannot remove op %s: output %s is an output of block %s", op.name(), out.name(), name));
                }
            }
            op.remove();
        }
    }

    /**
     * Rewires every consumer of {@code oldNode} in this block, and this block's
     * outputs, to read {@code newNode} instead.
     *
     * @return the number of operations rewired; 0 if {@code oldNode} depends on a
     *         pinned value that {@code newNode} does not
     */
    public int replaceUses(ValueNode oldNode, ValueNode newNode) {
        if (!oldNode.canBeReplacedBy(newNode)) {
            LOG.fine(() -> "not replacing " + oldNode.name() + " with " + newNode.name()
                    + ": non-replaceable upstream values would be lost");
            return 0;
        }
        int rewired = 0;
        for (OperationNode consumer : oldNode.consumers()) {
            if (!operations.contains(consumer)) {
                continue;
            }
            Map<String, Binding> updates = new LinkedHashMap<>();
            for (Map.Entry<String, Binding> e : consumer.inputs().entrySet()) {
                List<ValueNode> nodes = e.getValue().nodes();
                if (!nodes.contains(oldNode)) {
                    continue;
                }
                List<ValueNode> replaced = new ArrayList<>(nodes.size());
                for (ValueNode n : nodes) {
                    replaced.add(n == oldNode ? newNode : n);
                }
                updates.put(e.getKey(), e.getValue().isTuple() ? Binding.of(replaced) : Binding.of(replaced.get(0)));
            }
            consumer.rebind(updates, false);
            rewired++;
        }
        outputs.replaceAll(n -> n == oldNode ? newNode : n);
        return rewired;
    }

    /**
     * Removes every operation, last first, together with this block's outputs.
     */
    void clearOperations() {
        outputs.clear();
        for (int i = operations.size() - 1; i >= 0; i--) {
            operations.get(i).remove();
        }
    }

    @Override
    public void detach(OperationNode op) {
        for (ValueNode input : op.flattenedInputs()) {
            if (input.isConsumedBy(op)) {
                throw new IllegalStateException(String.format(
                        "Op %s still consumes %s; clear its input edges before detaching", op.name(), input.name()));
            }
        }
        if (!operations.remove(op)) {
            throw new IllegalArgumentException("Op " + op.name() + " is not in block " + name);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("block ").append(name).append("(");
        sb.append(String.join(", ", inputs.stream().map(ValueNode::describe).toList())).append(") {\n");
        for (OperationNode op : operations) {
            sb.append("  ").append(op).append("\n");
        }
        sb.append("} -> (").append(String.join(", ", outputs.stream().map(n -> "%" + n.name()).toList())).append(")");
        return sb.toString();
    }
}
