package io.surfworks.tessera.ir;

import io.surfworks.tessera.ir.contract.InputSpec;
import io.surfworks.tessera.ir.contract.InputType;
import io.surfworks.tessera.ir.infer.InputClass;
import io.surfworks.tessera.types.Dim;
import io.surfworks.tessera.types.ElementType;
import io.surfworks.tessera.types.SymbolicType;
import io.surfworks.tessera.types.SymbolicType.ListType;
import io.surfworks.tessera.types.SymbolicType.TensorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal operation kinds for exercising the operation node in isolation.
 */
final class TestKinds {

    private TestKinds() {}

    /** {@code echo(x)}: forwards the type and value of {@code x}; tolerates every input class. */
    static final OpKind ECHO = new OpKind() {
        private final InputSpec spec = InputSpec.of(InputType.tensor("x", "T_ALL"));

        @Override
        public String name() {
            return "echo";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            return List.of(op.input("x").type());
        }

        @Override
        public Optional<ValueInference> valueInference() {
            return Optional.of(op -> Collections.singletonList(op.input("x").value()));
        }
    };

    /**
     * {@code pick(x, y?)}: forwards {@code x}. Value inference only runs over
     * materialized inputs.
     */
    static final OpKind PICK = new OpKind() {
        private final InputSpec spec = InputSpec.of(
                InputType.tensor("x", "T_ALL"),
                InputType.tensor("y", "T_ALL").asOptional());

        @Override
        public String name() {
            return "pick";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            return List.of(op.input("x").type());
        }

        @Override
        public Optional<ValueInference> valueInference() {
            return Optional.of(ValueInference.tolerating(Set.of(InputClass.MATERIALIZED),
                    op -> List.of(op.input("x").value())));
        }
    };

    /** {@code join(values[2])}: a pair tuple; typed like its first element, never valued. */
    static final OpKind JOIN = new OpKind() {
        private final InputSpec spec = InputSpec.of(InputType.tuple("values", "T_ALL").length(2));

        @Override
        public String name() {
            return "join";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            return List.of(op.inputList("values").get(0).type());
        }
    };

    /** {@code dup(x)}: two copies of {@code x}, named {@code <op>_a} and {@code <op>_b}. */
    static final OpKind DUP = new OpKind() {
        private final InputSpec spec = InputSpec.of(InputType.tensor("x", Set.of(ElementType.FP32, ElementType.INT32)));

        @Override
        public String name() {
            return "dup";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            SymbolicType t = op.input("x").type();
            return List.of(t, t);
        }

        @Override
        public Optional<List<String>> outputNames(OperationNode op) {
            return Optional.of(List.of("a", "b"));
        }
    };

    /** {@code list(_rank)}: an fp32 list whose elements have rank {@code _rank}. */
    static final OpKind LIST = new OpKind() {
        private final InputSpec spec = InputSpec.of(InputType.internal("_rank"));

        @Override
        public String name() {
            return "list";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            int rank = op.internalInputs().get("_rank").payload(Integer.class);
            List<Dim> shape = new ArrayList<>();
            for (int i = 0; i < rank; i++) {
                shape.add(Dim.of(2));
            }
            return List.of(new ListType(new TensorType(ElementType.FP32, shape), Dim.of(1), true));
        }
    };

    /** {@code region(x)}: echoes {@code x} through a nested block named {@code body}. */
    static final OpKind REGION = new OpKind() {
        private final InputSpec spec = InputSpec.of(InputType.tensor("x", "T_ALL"));

        @Override
        public String name() {
            return "region";
        }

        @Override
        public InputSpec inputSpec() {
            return spec;
        }

        @Override
        public void buildNestedBlocks(OperationNode op) {
            Block body = op.newBlock("body");
            OperationNode inner = body.add(OperationNode.builder(ECHO).input("x", op.input("x")));
            body.setOutputs(inner.outputs());
        }

        @Override
        public List<SymbolicType> inferTypes(OperationNode op) {
            return List.of(op.blocks().get(0).outputs().get(0).type());
        }
    };
}
