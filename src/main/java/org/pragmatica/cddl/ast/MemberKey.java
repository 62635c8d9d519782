package org.pragmatica.cddl.ast;

/**
 * Key position of a map-like group entry.
 */
public sealed interface MemberKey extends CddlNode {
    Span span();

    /**
     * {@code type1 =>}, or {@code type1 ^ =>} when {@code cut} is set.
     */
    record Type1Key(Span span, Type1 type1, boolean cut) implements MemberKey {
        @Override
        public String toString() {
            return type1 + (cut ? " ^ =>" : " =>");
        }
    }

    /**
     * {@code name:}
     */
    record Bareword(Span span, Identifier name) implements MemberKey {
        @Override
        public String toString() {
            return name + ":";
        }
    }

    /**
     * {@code "literal":}, {@code 1:}
     */
    record ValueKey(Span span, Value value) implements MemberKey {
        @Override
        public String toString() {
            return value + ":";
        }
    }

    /**
     * Parenthesized group or type in key position: {@code ( ... ) =>}
     */
    record NonMember(Span span, NonMemberKey key, boolean cut) implements MemberKey {
        @Override
        public String toString() {
            return key + (cut ? " ^ =>" : " =>");
        }
    }
}
