package org.pragmatica.cddl.parser;

import org.pragmatica.cddl.ast.ByteEncoding;
import org.pragmatica.cddl.ast.Position;
import org.pragmatica.cddl.ast.Span;
import org.pragmatica.cddl.ast.Value;
import org.pragmatica.cddl.error.LexerException;
import org.pragmatica.cddl.parser.CddlToken.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lexer for CDDL source text. Tokens are produced on demand, one per {@link #next()} call.
 */
public final class CddlLexer implements TokenSource {
    static final int MAX_INPUT_SIZE = 16_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private CddlLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Lexer over {@code input}. Oversized input is reported by the first {@link #next()} call.
     */
    public static CddlLexer of(String input) {
        return new CddlLexer(input);
    }

    /**
     * Lex the whole input. The last token of the returned list is always {@link CddlToken.Eof}.
     */
    public static List<CddlToken> tokenize(String input) throws LexerException {
        var lexer = of(input);
        var tokens = new ArrayList<CddlToken>();
        CddlToken token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!(token instanceof CddlToken.Eof));
        return tokens;
    }

    @Override
    public CddlToken next() throws LexerException {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new LexerException(Position.START,
                                     "CDDL input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new CddlToken.Eof(Span.empty(currentLocation()));
        }
        var start = currentLocation();
        char c = peek();
        if (c == '"') {
            return scanText(start);
        }
        if (c == '\'') {
            return scanBytes(start, ByteEncoding.UTF8);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekAt(1)))) {
            return scanNumberOrRange(start);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '.') {
            return scanDotted(start);
        }
        if (c == '#') {
            return scanHash(start);
        }
        return scanOperator(start);
    }

    private CddlToken scanIdentifier(Position start) throws LexerException {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd()) {
            char c = peek();
            if (isIdentifierStart(c) || isDigit(c)) {
                sb.append(advance());
                continue;
            }
            // '-' and '.' only count when more identifier characters follow them
            int run = 0;
            while (isJoiner(peekAt(run))) {
                run++ ;
            }
            if (run == 0 || !(isIdentifierStart(peekAt(run)) || isDigit(peekAt(run)))) {
                break;
            }
            for (int i = 0; i < run; i++ ) {
                sb.append(advance());
            }
        }
        var name = sb.toString();
        if (!isAtEnd() && peek() == '\'') {
            if (name.equals("h")) {
                return scanBytes(start, ByteEncoding.BASE16);
            }
            if (name.equals("b64")) {
                return scanBytes(start, ByteEncoding.BASE64);
            }
        }
        return new CddlToken.Identifier(span(start), name);
    }

    private CddlToken scanText(Position start) throws LexerException {
        return new CddlToken.Literal(span(start), new Value.TextValue(scanQuoted(start, '"')));
    }

    private CddlToken scanBytes(Position start, ByteEncoding encoding) throws LexerException {
        var content = scanQuoted(start, '\'');
        return new CddlToken.Literal(span(start), new Value.ByteValue(encoding, content));
    }

    /**
     * Content between the quotes, escapes preserved verbatim.
     */
    private String scanQuoted(Position start, char quote) throws LexerException {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            throw new LexerException(start, quote == '"'
                                            ? "Unterminated text string"
                                            : "Unterminated byte string");
        }
        advance();
        // skip closing quote
        return sb.toString();
    }

    private CddlToken scanNumberOrRange(Position start) throws LexerException {
        var lower = scanNumber(start);
        var lowerSpan = span(start);
        if (peekAt(0) != '.' || peekAt(1) != '.') {
            return new CddlToken.Literal(lowerSpan, lower);
        }
        boolean inclusive = peekAt(2) != '.';
        int upperOffset = inclusive ? 2 : 3;
        char u = peekAt(upperOffset);
        if (!(isDigit(u) || (u == '-' && isDigit(peekAt(upperOffset + 1))))) {
            // operator followed by something else, e.g. 0..max
            return new CddlToken.Literal(lowerSpan, lower);
        }
        for (int i = 0; i < upperOffset; i++ ) {
            advance();
        }
        var upperStart = currentLocation();
        var upper = scanNumber(upperStart);
        return new CddlToken.Range(span(start), lower, lowerSpan, upper, span(upperStart), inclusive);
    }

    private Value scanNumber(Position start) throws LexerException {
        boolean negative = false;
        if (peek() == '-') {
            negative = true;
            advance();
        }
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'b')) {
            advance();
            int radix = advance() == 'x' ? 16 : 2;
            var digits = scanDigits(radix);
            return integer(start, digits, radix, negative);
        }
        var digits = new StringBuilder(scanDigits(10));
        boolean fractional = false;
        if (peekAt(0) == '.' && isDigit(peekAt(1))) {
            fractional = true;
            digits.append(advance());
            digits.append(scanDigits(10));
        }
        if ((peekAt(0) == 'e' || peekAt(0) == 'E') && (isDigit(peekAt(1))
                                                      || ((peekAt(1) == '+' || peekAt(1) == '-') && isDigit(peekAt(2))))) {
            fractional = true;
            digits.append(advance());
            if (peek() == '+' || peek() == '-') {
                digits.append(advance());
            }
            digits.append(scanDigits(10));
        }
        if (fractional) {
            var value = Double.parseDouble(digits.toString());
            return new Value.FloatValue(negative ? -value : value);
        }
        return integer(start, digits.toString(), 10, negative);
    }

    private Value integer(Position start, String digits, int radix, boolean negative) throws LexerException {
        if (digits.isEmpty()) {
            throw new LexerException(start, "Malformed number");
        }
        try{
            if (negative) {
                return new Value.IntValue(Long.parseLong("-" + digits, radix));
            }
            return new Value.UintValue(Long.parseUnsignedLong(digits, radix));
        } catch (NumberFormatException e) {
            throw new LexerException(start, "Number out of range: " + digits);
        }
    }

    private String scanDigits(int radix) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && Character.digit(peek(), radix) >= 0) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private CddlToken scanDotted(Position start) throws LexerException {
        advance();
        // skip first '.'
        if (!isAtEnd() && peek() == '.') {
            advance();
            if (!isAtEnd() && peek() == '.') {
                advance();
                return new CddlToken.RangeOp(span(start), false);
            }
            return new CddlToken.RangeOp(span(start), true);
        }
        if (isAtEnd() || !isIdentifierStart(peek())) {
            throw new LexerException(start, "Expected control operator name after '.'");
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isIdentifierStart(peek()) || isDigit(peek()) || peek() == '-')) {
            sb.append(advance());
        }
        return new CddlToken.ControlOp(span(start), sb.toString());
    }

    private CddlToken scanHash(Position start) throws LexerException {
        advance();
        // skip '#'
        if (isAtEnd() || !isDigit(peek())) {
            return new CddlToken.Punct(span(start), Symbol.HASH);
        }
        int major = advance() - '0';
        Optional<Long> constraint = Optional.empty();
        if (peekAt(0) == '.' && isDigit(peekAt(1))) {
            advance();
            var digits = scanDigits(10);
            try{
                constraint = Optional.of(Long.parseUnsignedLong(digits));
            } catch (NumberFormatException e) {
                throw new LexerException(start, "Tag number out of range: " + digits);
            }
        }
        return new CddlToken.Tag(span(start), major, constraint);
    }

    private CddlToken scanOperator(Position start) throws LexerException {
        char c = advance();
        var symbol = switch (c) {
            case'=' -> match('>') ? Symbol.ARROW : Symbol.ASSIGN;
            case'/' -> {
                if (match('/')) {
                    yield match('=') ? Symbol.GROUP_CHOICE_ALT : Symbol.GROUP_CHOICE;
                }
                yield match('=') ? Symbol.TYPE_CHOICE_ALT : Symbol.TYPE_CHOICE;
            }
            case'<' -> Symbol.LANGLE;
            case'>' -> Symbol.RANGLE;
            case'(' -> Symbol.LPAREN;
            case')' -> Symbol.RPAREN;
            case'{' -> Symbol.LBRACE;
            case'}' -> Symbol.RBRACE;
            case'[' -> Symbol.LBRACKET;
            case']' -> Symbol.RBRACKET;
            case',' -> Symbol.COMMA;
            case':' -> Symbol.COLON;
            case'^' -> Symbol.CARET;
            case'?' -> Symbol.QUESTION;
            case'*' -> Symbol.ASTERISK;
            case'+' -> Symbol.PLUS;
            case'~' -> Symbol.TILDE;
            case'&' -> Symbol.AMPERSAND;
            default -> null;
        };
        if (symbol == null) {
            throw new LexerException(start, "Unexpected character: " + c);
        }
        return new CddlToken.Punct(span(start), symbol);
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            }else if (c == ';') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            }else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    /**
     * Character {@code offset} positions ahead, or {@code '\0'} past the end of input.
     */
    private char peekAt(int offset) {
        return pos + offset < input.length()
               ? input.charAt(pos + offset)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private Position currentLocation() {
        return Position.at(line, column, pos);
    }

    private Span span(Position start) {
        return Span.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '@' || c == '$';
    }

    private static boolean isJoiner(char c) {
        return c == '-' || c == '.';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
