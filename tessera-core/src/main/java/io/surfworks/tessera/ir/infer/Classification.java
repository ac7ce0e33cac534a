package io.surfworks.tessera.ir.infer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which input classes occur among an operation's required inputs.
 */
public record Classification(boolean hasMaterialized, boolean hasSymbolic, boolean hasAbsent) {

    public static final Classification EMPTY = new Classification(false, false, false);

    public Classification with(InputClass inputClass) {
        return switch (inputClass) {
            case MATERIALIZED -> new Classification(true, hasSymbolic, hasAbsent);
            case SYMBOLIC -> new Classification(hasMaterialized, true, hasAbsent);
            case ABSENT -> new Classification(hasMaterialized, hasSymbolic, true);
        };
    }

    public boolean has(InputClass inputClass) {
        return switch (inputClass) {
            case MATERIALIZED -> hasMaterialized;
            case SYMBOLIC -> hasSymbolic;
            case ABSENT -> hasAbsent;
        };
    }

    public Set<InputClass> present() {
        Set<InputClass> out = EnumSet.noneOf(InputClass.class);
        for (InputClass c : InputClass.values()) {
            if (has(c)) {
                out.add(c);
            }
        }
        return out;
    }
}
