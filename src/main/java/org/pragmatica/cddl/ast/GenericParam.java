package org.pragmatica.cddl.ast;

public record GenericParam(Span span, Identifier name) implements CddlNode {
    @Override
    public String toString() {
        return name.toString();
    }
}
