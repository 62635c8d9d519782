package org.pragmatica.cddl.ast;

import java.util.Optional;

/**
 * Repetition bounds of a group entry.
 */
public sealed interface Occur {
    Occur ZERO_OR_ONE = new ZeroOrOne();
    Occur ZERO_OR_MORE = new ZeroOrMore();
    Occur ONE_OR_MORE = new OneOrMore();

    /**
     * {@code ?}
     */
    record ZeroOrOne() implements Occur {
        @Override
        public String toString() {
            return "?";
        }
    }

    /**
     * {@code *}
     */
    record ZeroOrMore() implements Occur {
        @Override
        public String toString() {
            return "*";
        }
    }

    /**
     * {@code +}
     */
    record OneOrMore() implements Occur {
        @Override
        public String toString() {
            return "+";
        }
    }

    /**
     * {@code n*m}, {@code n*}, {@code *m}. At least one bound is present. Bounds are unsigned 64-bit.
     */
    record Bounded(Optional<Long> lower, Optional<Long> upper) implements Occur {
        @Override
        public String toString() {
            return lower.map(Long::toUnsignedString)
                        .orElse("") + "*" + upper.map(Long::toUnsignedString)
                                                 .orElse("");
        }
    }
}
