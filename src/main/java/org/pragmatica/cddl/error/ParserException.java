package org.pragmatica.cddl.error;

/**
 * Thrown by parser productions; carries the error that aborted the current construct.
 */
public class ParserException extends Exception {

    private final ParseError error;

    public ParserException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParserException(ParseError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
