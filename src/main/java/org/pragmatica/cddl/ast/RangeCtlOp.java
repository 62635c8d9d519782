package org.pragmatica.cddl.ast;

/**
 * Operator kind joining the two halves of a {@link Type1}.
 */
public sealed interface RangeCtlOp {

    /**
     * {@code ..} when inclusive, {@code ...} otherwise.
     */
    record Range(boolean inclusive) implements RangeCtlOp {
        @Override
        public String toString() {
            return inclusive ? ".." : "...";
        }
    }

    /**
     * Control operator such as {@code .size} or {@code .regexp}. The name excludes the dot.
     */
    record Control(String name) implements RangeCtlOp {
        @Override
        public String toString() {
            return "." + name;
        }
    }
}
