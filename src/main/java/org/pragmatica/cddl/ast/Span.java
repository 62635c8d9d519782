package org.pragmatica.cddl.ast;

/**
 * Source range of a node or token, start inclusive, end exclusive.
 */
public record Span(Position start, Position end) {

    public static Span of(Position start, Position end) {
        return new Span(start, end);
    }

    public static Span empty(Position position) {
        return new Span(position, position);
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public Span to(Span other) {
        var first = other.start.isBefore(start) ? other.start : start;
        var last = end.isBefore(other.end) ? other.end : end;
        return new Span(first, last);
    }

    public boolean adjoins(Span next) {
        return end.offset() == next.start.offset();
    }

    public String text(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
