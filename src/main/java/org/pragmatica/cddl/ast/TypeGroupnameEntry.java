package org.pragmatica.cddl.ast;

import java.util.Optional;

public record TypeGroupnameEntry(Span span,
                                 Optional<Occurrence> occurrence,
                                 Identifier name,
                                 Optional<GenericArgs> genericArgs) implements CddlNode {
    @Override
    public String toString() {
        return occurrence.map(o -> o + " ")
                         .orElse("") + name + genericArgs.map(GenericArgs::toString)
                                                         .orElse("");
    }
}
