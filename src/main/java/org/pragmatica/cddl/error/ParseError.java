package org.pragmatica.cddl.error;

import org.pragmatica.cddl.ast.Position;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    Position location();

    String message();

    /**
     * Fatal errors stop the parse at once; the others allow resynchronizing at the next rule.
     */
    default boolean fatal() {
        return false;
    }

    /**
     * A token does not fit the production being parsed.
     */
    record UnexpectedToken(Position location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Token not allowed inside a bracketed list.
     */
    record IllegalToken(Position location, String found, String context) implements ParseError {
        @Override
        public String message() {
            return "Illegal " + found + " in " + context + " at " + location;
        }
    }

    /**
     * Rule name not followed by {@code =}, {@code /=} or {@code //=}.
     */
    record ExpectedAssignment(Position location, String found) implements ParseError {
        @Override
        public String message() {
            return "Expected assignment '=', '/=' or '//=' at " + location + ", found " + found;
        }

        @Override
        public boolean fatal() {
            return true;
        }
    }

    /**
     * Token cannot start a type2 expression.
     */
    record UnrecognizedType2(Position location, String found) implements ParseError {
        @Override
        public String message() {
            return "Unrecognized type at " + location + ": " + found;
        }
    }

    /**
     * Failure reported by the token source.
     */
    record LexError(Position location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }

        @Override
        public boolean fatal() {
            return true;
        }
    }

    /**
     * Recognized construct that this parser does not handle.
     */
    record Unimplemented(Position location, String construct) implements ParseError {
        @Override
        public String message() {
            return "Not implemented: " + construct + " at " + location;
        }

        @Override
        public boolean fatal() {
            return true;
        }
    }
}
