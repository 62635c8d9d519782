package org.pragmatica.cddl.error;

import org.pragmatica.cddl.ast.Position;

public class LexerException extends Exception {

    private final Position position;
    private final String reason;

    public LexerException(Position pos, String reason) {
        super(reason + " at " + pos);
        this.position = pos;
        this.reason = reason;
    }

    public Position getPosition() {
        return position;
    }

    public ParseError toParseError() {
        return new ParseError.LexError(position, reason);
    }
}
