package io.surfworks.tessera.types;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An unresolved quantity: a dimension or value element that is only known at
 * a later compile or run stage.
 *
 * <p>Two symbols are equal when their names are equal.
 */
public record Symbol(String name) {

    private static final AtomicLong FRESH = new AtomicLong();

    public Symbol {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
    }

    /**
     * Creates a symbol with a generated, process-unique name ({@code is0}, {@code is1}, ...).
     */
    public static Symbol fresh() {
        return new Symbol("is" + FRESH.getAndIncrement());
    }

    @Override
    public String toString() {
        return name;
    }
}
