package org.pragmatica.cddl.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.cddl.error.ParseError;
import org.pragmatica.cddl.error.ParserException;
import org.pragmatica.cddl.error.RecoveryStrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Error reporting and resynchronization between rules.
 */
class ErrorRecoveryTest {

    private static final String TWO_BROKEN_RULES = """
        a = b
        c = }
        d = e
        f = ]
        g = h
        """;

    @Test
    void basicRecovery_collectsEveryIndependentError() {
        var result = CddlParser.parse(TWO_BROKEN_RULES, new ParserConfig(RecoveryStrategy.BASIC));

        assertTrue(result.isFailure());
        assertEquals(2, result.errors().size());
        assertThat(result.errors()).allMatch(ParseError.UnrecognizedType2.class::isInstance);
        assertEquals(2, result.errors().get(0).location().line());
        assertEquals(4, result.errors().get(1).location().line());
        assertTrue(result.document().isEmpty());
    }

    @Test
    void noRecovery_stopsAtFirstError() {
        var result = CddlParser.parse(TWO_BROKEN_RULES, new ParserConfig(RecoveryStrategy.NONE));

        assertEquals(1, result.errors().size());
        assertEquals(2, result.errors().get(0).location().line());
    }

    @Test
    void defaultConfig_usesBasicRecovery() {
        assertEquals(RecoveryStrategy.BASIC, ParserConfig.DEFAULT.recovery());
        assertEquals(2, CddlParser.parse(TWO_BROKEN_RULES).errors().size());
    }

    @Test
    void missingAssignment_isFatal() {
        var result = CddlParser.parse("""
            a b
            c = }
            """);

        assertEquals(1, result.errors().size());
        var error = assertInstanceOf(ParseError.ExpectedAssignment.class, result.errors().get(0));
        assertTrue(error.fatal());
        assertEquals("identifier 'b'", error.found());
    }

    @Test
    void inlineGroupRuleBody_failsAsUnimplemented() {
        var result = CddlParser.parse("a = ( b: int )\nc = d");

        assertEquals(1, result.errors().size());
        var error = assertInstanceOf(ParseError.Unimplemented.class, result.errors().get(0));
        assertTrue(error.fatal());
        assertEquals(4, error.location().offset());
    }

    @Test
    void lexerFailure_midDocument_isFatal() {
        var result = CddlParser.parse("a = b\nc = !\nd = }");

        assertEquals(1, result.errors().size());
        var error = assertInstanceOf(ParseError.LexError.class, result.errors().get(0));
        assertEquals("Unexpected character: !", error.reason());
        assertEquals(2, error.location().line());
    }

    @Test
    void lexerFailure_onFirstToken_isReported() {
        var result = CddlParser.parse("!");

        assertInstanceOf(ParseError.LexError.class, result.errors().get(0));
    }

    @Test
    void oversizedInput_isReportedAsLexError() {
        var result = CddlParser.parse("a".repeat(CddlLexer.MAX_INPUT_SIZE + 1));

        assertTrue(result.isFailure());
        var error = assertInstanceOf(ParseError.LexError.class, result.errors().get(0));
        assertThat(error.reason()).contains("exceeds maximum size");
        assertEquals(1, error.location().line());
    }

    @Test
    void ruleStartingWithPunctuation_reportsUnexpectedToken() {
        var result = CddlParser.parse("= b\nc = d");

        assertEquals(1, result.errors().size());
        var error = assertInstanceOf(ParseError.UnexpectedToken.class, result.errors().get(0));
        assertEquals("rule name", error.expected());
        assertEquals("'='", error.found());
    }

    @Test
    void literalInGenericParams_reportsIllegalToken() {
        var result = CddlParser.parse("a<1> = b");

        var error = assertInstanceOf(ParseError.IllegalToken.class, result.errors().get(0));
        assertEquals("generic parameters", error.context());
    }

    @Test
    void emptyGenericParams_reportsUnexpectedToken() {
        assertThrows(ParserException.class, () -> CddlParser.create("<>").parseGenericParams());
    }

    @Test
    void unclosedMap_reportsExpectedBrace() {
        var result = CddlParser.parse("a = { b: int");

        var error = assertInstanceOf(ParseError.UnexpectedToken.class, result.errors().get(0));
        assertEquals("'}'", error.expected());
        assertEquals("end of input", error.found());
    }

    @Test
    void unwrap_onFailure_listsMessages() {
        var result = CddlParser.parse("a = }");

        var error = assertThrows(IllegalStateException.class, result::unwrap);
        assertThat(error.getMessage()).contains("Unrecognized type at 1:5");
    }

    @Test
    void parseError_messages_includeLocation() {
        var result = CddlParser.parse("a = { b: int");

        assertEquals("Unexpected end of input at 1:13, expected '}'", result.errors().get(0).message());
    }
}
