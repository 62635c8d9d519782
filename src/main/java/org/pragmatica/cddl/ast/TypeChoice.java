package org.pragmatica.cddl.ast;

public record TypeChoice(Span span, Type1 type1) implements CddlNode {
    @Override
    public String toString() {
        return type1.toString();
    }
}
