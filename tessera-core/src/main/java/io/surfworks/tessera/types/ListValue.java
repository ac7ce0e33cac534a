package io.surfworks.tessera.types;

import java.util.List;

/**
 * Materialized contents of a list-typed value.
 */
public record ListValue(List<TensorValue> elements) implements ConstValue {

    public ListValue {
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    @Override
    public boolean isSymbolic() {
        for (TensorValue e : elements) {
            if (e.isSymbolic()) {
                return true;
            }
        }
        return false;
    }
}
