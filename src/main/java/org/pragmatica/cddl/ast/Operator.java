package org.pragmatica.cddl.ast;

public record Operator(Span span, RangeCtlOp operator, Type2 type2) implements CddlNode {

    public boolean isRange() {
        return operator instanceof RangeCtlOp.Range;
    }

    @Override
    public String toString() {
        return isRange()
               ? operator + type2.toString()
               : " " + operator + " " + type2;
    }
}
