package io.surfworks.tessera.ir;

import java.util.List;

/**
 * What is bound to one input slot: a single node, or an ordered tuple of nodes.
 */
public sealed interface Binding permits Binding.Single, Binding.Tuple {

    /**
     * The bound nodes in order; one element for a single binding.
     */
    List<ValueNode> nodes();

    boolean isTuple();

    record Single(ValueNode node) implements Binding {
        public Single {
            if (node == null) {
                throw new IllegalArgumentException("Bound node must not be null");
            }
        }

        @Override
        public List<ValueNode> nodes() {
            return List.of(node);
        }

        @Override
        public boolean isTuple() {
            return false;
        }
    }

    record Tuple(List<ValueNode> nodes) implements Binding {
        public Tuple {
            nodes = List.copyOf(nodes);
        }

        @Override
        public boolean isTuple() {
            return true;
        }

        public int size() {
            return nodes.size();
        }
    }

    static Binding of(ValueNode node) {
        return new Single(node);
    }

    static Binding of(List<? extends ValueNode> nodes) {
        return new Tuple(List.copyOf(nodes));
    }
}
