package org.pragmatica.cddl.ast;

/**
 * Literal payload. Values carry no source span, so equal literals are equal nodes wherever they
 * appear in a document.
 */
public sealed interface Value extends CddlNode {

    /**
     * Negative integer, down to {@link Long#MIN_VALUE}. Literals below that are rejected by the lexer.
     */
    record IntValue(long value) implements Value {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * Unsigned integer. {@code value} holds the full unsigned 64-bit range, so values above
     * {@link Long#MAX_VALUE} read as negative longs; use {@link Long#compareUnsigned} and
     * {@link Long#toUnsignedString} on it.
     */
    record UintValue(long value) implements Value {
        @Override
        public String toString() {
            return Long.toUnsignedString(value);
        }
    }

    record FloatValue(double value) implements Value {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * Text string. {@code text} is kept exactly as written between the quotes, escapes included,
     * and is quoted once when rendered.
     */
    record TextValue(String text) implements Value {
        @Override
        public String toString() {
            return "\"" + text + "\"";
        }
    }

    /**
     * Byte string. {@code text} is the raw content between the quotes.
     */
    record ByteValue(ByteEncoding encoding, String text) implements Value {
        @Override
        public String toString() {
            return encoding.prefix() + "'" + text + "'";
        }
    }
}
