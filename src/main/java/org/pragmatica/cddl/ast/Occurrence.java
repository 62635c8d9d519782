package org.pragmatica.cddl.ast;

public record Occurrence(Span span, Occur occur) implements CddlNode {
    @Override
    public String toString() {
        return occur.toString();
    }
}
