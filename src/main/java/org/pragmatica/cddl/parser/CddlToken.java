package org.pragmatica.cddl.parser;

import org.pragmatica.cddl.ast.Span;
import org.pragmatica.cddl.ast.Value;

import java.util.Optional;

/**
 * Tokens produced by {@link CddlLexer}.
 */
public sealed interface CddlToken {
    Span span();

    /**
     * Human-readable form used in error messages.
     */
    String describe();

    record Identifier(Span span, String name) implements CddlToken {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    /**
     * Text, byte string or numeric literal.
     */
    record Literal(Span span, Value value) implements CddlToken {
        @Override
        public String describe() {
            return "literal " + value;
        }
    }

    /**
     * Numeric range written without blanks, {@code 1..10} or {@code 0...256}.
     */
    record Range(Span span,
                 Value lower,
                 Span lowerSpan,
                 Value upper,
                 Span upperSpan,
                 boolean inclusive) implements CddlToken {
        @Override
        public String describe() {
            return "range " + lower + (inclusive ? ".." : "...") + upper;
        }
    }

    /**
     * Range operator standing on its own, between operands that are not both numbers.
     */
    record RangeOp(Span span, boolean inclusive) implements CddlToken {
        @Override
        public String describe() {
            return inclusive ? "'..'" : "'...'";
        }
    }

    /**
     * Control operator {@code .name}
     */
    record ControlOp(Span span, String name) implements CddlToken {
        @Override
        public String describe() {
            return "control operator '." + name + "'";
        }
    }

    /**
     * {@code #n} or {@code #n.m}
     */
    record Tag(Span span, int major, Optional<Long> constraint) implements CddlToken {
        @Override
        public String describe() {
            return "'#" + major + constraint.map(c -> "." + Long.toUnsignedString(c))
                                            .orElse("") + "'";
        }
    }

    /**
     * Token with fixed text.
     */
    record Punct(Span span, Symbol symbol) implements CddlToken {
        @Override
        public String describe() {
            return "'" + symbol.text() + "'";
        }
    }

    record Eof(Span span) implements CddlToken {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    enum Symbol {
        ASSIGN("="),
        TYPE_CHOICE_ALT("/="),
        GROUP_CHOICE_ALT("//="),
        TYPE_CHOICE("/"),
        GROUP_CHOICE("//"),
        LANGLE("<"),
        RANGLE(">"),
        LPAREN("("),
        RPAREN(")"),
        LBRACE("{"),
        RBRACE("}"),
        LBRACKET("["),
        RBRACKET("]"),
        COMMA(","),
        COLON(":"),
        ARROW("=>"),
        CARET("^"),
        QUESTION("?"),
        ASTERISK("*"),
        PLUS("+"),
        TILDE("~"),
        AMPERSAND("&"),
        HASH("#");

        private final String text;

        Symbol(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }
}
