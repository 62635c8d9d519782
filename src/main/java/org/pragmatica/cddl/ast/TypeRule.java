package org.pragmatica.cddl.ast;

import java.util.Optional;

public record TypeRule(Span span,
                       Identifier name,
                       Optional<GenericParams> genericParams,
                       Assignment assignment,
                       Type value) implements CddlNode {

    public boolean isTypeChoiceAlternate() {
        return assignment == Assignment.TYPE_CHOICE_ALT;
    }

    @Override
    public String toString() {
        return name + genericParams.map(GenericParams::toString)
                                   .orElse("") + " " + assignment.symbol() + " " + value;
    }
}
