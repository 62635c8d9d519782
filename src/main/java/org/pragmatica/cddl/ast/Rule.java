package org.pragmatica.cddl.ast;

/**
 * Top-level binding of a name to either a type or a group entry.
 */
public sealed interface Rule extends CddlNode {
    Span span();

    Identifier name();

    /**
     * {@code name = type}, {@code name /= type}
     */
    record OfType(Span span, TypeRule rule) implements Rule {
        @Override
        public Identifier name() {
            return rule.name();
        }

        @Override
        public String toString() {
            return rule.toString();
        }
    }

    /**
     * {@code name = grpent}, {@code name //= grpent}
     */
    record OfGroup(Span span, GroupRule rule) implements Rule {
        @Override
        public Identifier name() {
            return rule.name();
        }

        @Override
        public String toString() {
            return rule.toString();
        }
    }
}
