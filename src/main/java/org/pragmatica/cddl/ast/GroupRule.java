package org.pragmatica.cddl.ast;

import java.util.Optional;

public record GroupRule(Span span,
                        Identifier name,
                        Optional<GenericParams> genericParams,
                        Assignment assignment,
                        GroupEntry entry) implements CddlNode {

    public boolean isGroupChoiceAlternate() {
        return assignment == Assignment.GROUP_CHOICE_ALT;
    }

    @Override
    public String toString() {
        return name + genericParams.map(GenericParams::toString)
                                   .orElse("") + " " + assignment.symbol() + " " + entry;
    }
}
