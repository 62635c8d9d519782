package org.pragmatica.cddl.ast;

public record GenericArg(Span span, Type1 arg) implements CddlNode {
    @Override
    public String toString() {
        return arg.toString();
    }
}
