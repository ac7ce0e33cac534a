package io.surfworks.tessera.ops;

import io.surfworks.tessera.ir.Block;
import io.surfworks.tessera.ir.InternalValueNode;
import io.surfworks.tessera.ir.OperationNode;
import io.surfworks.tessera.ir.ValueInference;
import io.surfworks.tessera.ir.ValueNode;
import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.ConstValue;
import io.surfworks.tessera.types.SymbolicAlgebra;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * {@code cond}: selects the outputs of the {@code true} or {@code false} branch
 * depending on scalar {@code pred}.
 *
 * <p>Each branch is described by a builder function in an internal slot. The
 * function fills a fresh nested block and returns the values the branch yields;
 * both branches must yield the same number of values with compatible types.
 */
final class CondKind extends AbstractOpKind {

    static final String TRUE_FN = "_true_fn";
    static final String FALSE_FN = "_false_fn";

    CondKind() {
        super("cond", InputSpec.of(
                InputType.tensor("pred", "T_BOOL"),
                InputType.internal(TRUE_FN),
                InputType.internal(FALSE_FN)));
    }

    @Override
    public void buildNestedBlocks(OperationNode op) {
        buildBranch(op, "true", TRUE_FN);
        buildBranch(op, "false", FALSE_FN);
    }

    private void buildBranch(OperationNode op, String blockName, String slot) {
        Block block = op.newBlock(blockName);
        List<ValueNode> yielded = branchFunction(op, slot).apply(block);
        if (yielded == null || yielded.isEmpty()) {
            throw invalid(op, slot, "branch " + blockName + " must yield at least one value");
        }
        block.setOutputs(yielded);
    }

    @SuppressWarnings("unchecked")
    private Function<Block, List<ValueNode>> branchFunction(OperationNode op, String slot) {
        InternalValueNode node = op.internalInputs().get(slot);
        if (!(node.payload() instanceof Function<?, ?> fn)) {
            throw invalid(op, slot, "branch payload must be a Function<Block, List<ValueNode>>");
        }
        return (Function<Block, List<ValueNode>>) fn;
    }

    @Override
    public List<SymbolicType> inferTypes(OperationNode op) {
        TensorValue pred = tensorValue(op, "pred");
        if (pred != null && pred.size() != 1) {
            throw invalid(op, "pred", "pred must be a scalar, got shape " + pred);
        }
        List<ValueNode> trueOut = branch(op, true).outputs();
        List<ValueNode> falseOut = branch(op, false).outputs();
        if (trueOut.size() != falseOut.size()) {
            throw invalid(op, FALSE_FN, String.format("branches yield %d and %d values",
                    trueOut.size(), falseOut.size()));
        }
        SymbolicAlgebra algebra = op.context().algebra();
        List<SymbolicType> types = new ArrayList<>(trueOut.size());
        for (int i = 0; i < trueOut.size(); i++) {
            SymbolicType t = trueOut.get(i).type();
            SymbolicType f = falseOut.get(i).type();
            if (!algebra.typesCompatible(t, f)) {
                throw invalid(op, FALSE_FN, String.format("branch output %d differs: %s vs %s", i, t, f));
            }
            types.add(t);
        }
        return types;
    }

    @Override
    public Optional<ValueInference> valueInference() {
        return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED), op -> {
            boolean taken = Boolean.TRUE.equals(tensorValue(op, "pred").get(0));
            List<ConstValue> values = new ArrayList<>();
            for (ValueNode out : branch(op, taken).outputs()) {
                values.add(out.value());
            }
            return values;
        }));
    }

    private static Block branch(OperationNode op, boolean which) {
        List<Block> blocks = op.blocks();
        if (blocks.size() != 2) {
            throw new IllegalStateException("cond " + op.name() + " has no branch blocks");
        }
        return blocks.get(which ? 0 : 1);
    }
}
