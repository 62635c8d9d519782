package org.pragmatica.cddl.ast;

import java.util.Optional;

/**
 * A {@link Type2} optionally followed by a range or control operator. For ranges {@code type2}
 * is the lower bound and the operator carries the upper one.
 */
public record Type1(Span span, Type2 type2, Optional<Operator> operator) implements CddlNode {

    @Override
    public String toString() {
        return type2 + operator.map(Operator::toString)
                               .orElse("");
    }
}
