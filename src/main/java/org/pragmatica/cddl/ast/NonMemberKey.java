package org.pragmatica.cddl.ast;

public sealed interface NonMemberKey extends CddlNode {
    Span span();

    record OfGroup(Span span, Group group) implements NonMemberKey {
        @Override
        public String toString() {
            return "(" + group + ")";
        }
    }

    record OfType(Span span, Type type) implements NonMemberKey {
        @Override
        public String toString() {
            return "(" + type + ")";
        }
    }
}
