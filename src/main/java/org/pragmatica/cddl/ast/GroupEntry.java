package org.pragmatica.cddl.ast;

import java.util.Optional;

public sealed interface GroupEntry extends CddlNode {
    Span span();

    Optional<Occurrence> occurrence();

    /**
     * Entry with an optional member key: {@code ? key: type}, {@code type}
     */
    record ValueMemberKey(Span span, ValueMemberKeyEntry entry) implements GroupEntry {
        @Override
        public Optional<Occurrence> occurrence() {
            return entry.occurrence();
        }

        @Override
        public String toString() {
            return entry.toString();
        }
    }

    /**
     * Bare name that may refer to either a type or a group: {@code * name<args>}
     */
    record TypeGroupname(Span span, TypeGroupnameEntry entry) implements GroupEntry {
        @Override
        public Optional<Occurrence> occurrence() {
            return entry.occurrence();
        }

        @Override
        public String toString() {
            return entry.toString();
        }
    }

    /**
     * Parenthesized group inlined into the enclosing one: {@code ? ( group )}
     */
    record InlineGroup(Span span, Optional<Occurrence> occurrence, Group group) implements GroupEntry {
        @Override
        public String toString() {
            return occurrence.map(o -> o + " ")
                             .orElse("") + "(" + group + ")";
        }
    }
}
