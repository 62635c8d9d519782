package org.pragmatica.cddl.ast;

/**
 * A point in CDDL source text. Line and column are 1-based, offset is 0-based.
 */
public record Position(int line, int column, int offset) {
    public static final Position START = new Position(1, 1, 0);

    public static Position at(int line, int column, int offset) {
        return new Position(line, column, offset);
    }

    public boolean isBefore(Position other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
