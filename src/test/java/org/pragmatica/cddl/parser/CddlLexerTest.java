package org.pragmatica.cddl.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.cddl.ast.ByteEncoding;
import org.pragmatica.cddl.ast.Value;
import org.pragmatica.cddl.error.LexerException;
import org.pragmatica.cddl.parser.CddlToken.Symbol;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CddlLexerTest {

    @Test
    void tokenize_simpleRule_producesIdentifierAssignIdentifierEof() throws LexerException {
        var tokens = CddlLexer.tokenize("a = b");

        assertEquals(4, tokens.size());
        assertEquals("a", ((CddlToken.Identifier) tokens.get(0)).name());
        assertEquals(Symbol.ASSIGN, ((CddlToken.Punct) tokens.get(1)).symbol());
        assertEquals("b", ((CddlToken.Identifier) tokens.get(2)).name());
        assertInstanceOf(CddlToken.Eof.class, tokens.get(3));
    }

    @Test
    void tokenize_tracksLineColumnAndOffset() throws LexerException {
        var tokens = CddlLexer.tokenize("a = b\n  c = d");

        var b = tokens.get(2).span();
        assertEquals(1, b.start().line());
        assertEquals(5, b.start().column());
        assertEquals(4, b.start().offset());
        assertEquals(5, b.end().offset());

        var c = tokens.get(3).span();
        assertEquals(2, c.start().line());
        assertEquals(3, c.start().column());
        assertEquals(8, c.start().offset());
    }

    @Test
    void tokenize_identifierWithDashesAndDots_isOneIdentifier() throws LexerException {
        var tokens = CddlLexer.tokenize("foo-bar.baz_1 $x @y");

        assertThat(names(tokens)).containsExactly("foo-bar.baz_1", "$x", "@y");
    }

    @Test
    void tokenize_trailingDash_isNotPartOfIdentifier() {
        // a trailing '-' followed by a space cannot start any token
        var error = assertThrows(LexerException.class, () -> CddlLexer.tokenize("foo- bar"));

        assertThat(error.getMessage()).contains("Unexpected character: -");
    }

    @Test
    void tokenize_assignmentAndChoiceOperators_areDistinguished() throws LexerException {
        var tokens = CddlLexer.tokenize("= /= //= / // =>");

        assertThat(symbols(tokens)).containsExactly(Symbol.ASSIGN,
                                                    Symbol.TYPE_CHOICE_ALT,
                                                    Symbol.GROUP_CHOICE_ALT,
                                                    Symbol.TYPE_CHOICE,
                                                    Symbol.GROUP_CHOICE,
                                                    Symbol.ARROW);
    }

    @Test
    void tokenize_punctuation_mapsEverySymbol() throws LexerException {
        var tokens = CddlLexer.tokenize("<>(){}[],:^?*+~&");

        assertThat(symbols(tokens)).containsExactly(Symbol.LANGLE,
                                                    Symbol.RANGLE,
                                                    Symbol.LPAREN,
                                                    Symbol.RPAREN,
                                                    Symbol.LBRACE,
                                                    Symbol.RBRACE,
                                                    Symbol.LBRACKET,
                                                    Symbol.RBRACKET,
                                                    Symbol.COMMA,
                                                    Symbol.COLON,
                                                    Symbol.CARET,
                                                    Symbol.QUESTION,
                                                    Symbol.ASTERISK,
                                                    Symbol.PLUS,
                                                    Symbol.TILDE,
                                                    Symbol.AMPERSAND);
    }

    @Test
    void tokenize_textString_keepsEscapesVerbatim() throws LexerException {
        var tokens = CddlLexer.tokenize("\"say \\\"hi\\\"\"");

        assertEquals(new Value.TextValue("say \\\"hi\\\""), ((CddlToken.Literal) tokens.get(0)).value());
    }

    @Test
    void tokenize_byteStrings_recordEncoding() throws LexerException {
        var tokens = CddlLexer.tokenize("'raw' h'00ff' b64'AQ=='");

        assertThat(values(tokens)).containsExactly(new Value.ByteValue(ByteEncoding.UTF8, "raw"),
                                                   new Value.ByteValue(ByteEncoding.BASE16, "00ff"),
                                                   new Value.ByteValue(ByteEncoding.BASE64, "AQ=="));
    }

    @Test
    void tokenize_numbers_produceMatchingValueKinds() throws LexerException {
        var tokens = CddlLexer.tokenize("42 -7 0x1f 0b101 1.5 1e3");

        assertThat(values(tokens)).containsExactly(new Value.UintValue(42),
                                                   new Value.IntValue(-7),
                                                   new Value.UintValue(31),
                                                   new Value.UintValue(5),
                                                   new Value.FloatValue(1.5),
                                                   new Value.FloatValue(1000.0));
    }

    @Test
    void tokenize_numberOutOfRange_fails() {
        var error = assertThrows(LexerException.class, () -> CddlLexer.tokenize("99999999999999999999999"));

        assertThat(error.getMessage()).startsWith("Number out of range");
    }

    @Test
    void tokenize_numericRange_producesCompoundToken() throws LexerException {
        var tokens = CddlLexer.tokenize("0..10 1...5");

        var inclusive = (CddlToken.Range) tokens.get(0);
        assertEquals(new Value.UintValue(0), inclusive.lower());
        assertEquals(new Value.UintValue(10), inclusive.upper());
        assertTrue(inclusive.inclusive());
        assertEquals(0, inclusive.lowerSpan().start().offset());
        assertEquals(3, inclusive.upperSpan().start().offset());

        var exclusive = (CddlToken.Range) tokens.get(1);
        assertFalse(exclusive.inclusive());
        assertEquals(new Value.UintValue(5), exclusive.upper());
    }

    @Test
    void tokenize_rangeToName_producesSeparateTokens() throws LexerException {
        var tokens = CddlLexer.tokenize("0..max");

        assertInstanceOf(CddlToken.Literal.class, tokens.get(0));
        assertTrue(((CddlToken.RangeOp) tokens.get(1)).inclusive());
        assertEquals("max", ((CddlToken.Identifier) tokens.get(2)).name());
    }

    @Test
    void tokenize_controlOperator_keepsName() throws LexerException {
        var tokens = CddlLexer.tokenize("tstr .size 3");

        assertEquals("size", ((CddlToken.ControlOp) tokens.get(1)).name());
        assertEquals(new Value.UintValue(3), ((CddlToken.Literal) tokens.get(2)).value());
    }

    @Test
    void tokenize_hashForms_produceTagsAndAny() throws LexerException {
        var tokens = CddlLexer.tokenize("#6.32 #1 #");

        var tagged = (CddlToken.Tag) tokens.get(0);
        assertEquals(6, tagged.major());
        assertEquals(Optional.of(32L), tagged.constraint());

        var major = (CddlToken.Tag) tokens.get(1);
        assertEquals(1, major.major());
        assertTrue(major.constraint().isEmpty());

        assertEquals(Symbol.HASH, ((CddlToken.Punct) tokens.get(2)).symbol());
    }

    @Test
    void tokenize_comments_areSkipped() throws LexerException {
        var tokens = CddlLexer.tokenize("; leading comment\na ; trailing\n; last");

        assertThat(names(tokens)).containsExactly("a");
        assertEquals(2, tokens.size());
    }

    @Test
    void tokenize_unterminatedText_failsAtOpeningQuote() {
        var error = assertThrows(LexerException.class, () -> CddlLexer.tokenize("a = \"open"));

        assertEquals(4, error.getPosition().offset());
        assertThat(error.getMessage()).startsWith("Unterminated text string");
    }

    @Test
    void tokenize_unexpectedCharacter_fails() {
        var error = assertThrows(LexerException.class, () -> CddlLexer.tokenize("a = !"));

        assertThat(error.getMessage()).contains("Unexpected character: !");
        assertThat(error.toParseError().fatal()).isTrue();
    }

    @Test
    void next_afterEnd_keepsReturningEof() throws LexerException {
        var lexer = CddlLexer.of("");

        assertInstanceOf(CddlToken.Eof.class, lexer.next());
        assertInstanceOf(CddlToken.Eof.class, lexer.next());
    }

    private static List<String> names(List<CddlToken> tokens) {
        return tokens.stream()
                     .filter(CddlToken.Identifier.class::isInstance)
                     .map(t -> ((CddlToken.Identifier) t).name())
                     .toList();
    }

    private static List<Symbol> symbols(List<CddlToken> tokens) {
        return tokens.stream()
                     .filter(CddlToken.Punct.class::isInstance)
                     .map(t -> ((CddlToken.Punct) t).symbol())
                     .toList();
    }

    private static List<Value> values(List<CddlToken> tokens) {
        return tokens.stream()
                     .filter(CddlToken.Literal.class::isInstance)
                     .map(t -> ((CddlToken.Literal) t).value())
                     .toList();
    }
}
