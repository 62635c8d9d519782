package org.pragmatica.cddl;

import org.junit.jupiter.api.Test;
import org.pragmatica.cddl.error.ParseError;
import org.pragmatica.cddl.error.RecoveryStrategy;
import org.pragmatica.cddl.tree.Interning;
import org.pragmatica.cddl.tree.OverwritePolicy;
import org.pragmatica.cddl.tree.TreeError;
import org.pragmatica.cddl.tree.TreeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CddlTest {

    private static final String DUPLICATED_LITERALS = """
        a = "x"
        b = "x"
        """;

    @Test
    void parse_validText_succeeds() {
        var result = Cddl.parse("""
            person = {
                name: tstr,
                ? age: uint,   ; optional
            }
            """);

        assertTrue(result.isSuccess());
        assertEquals("person", result.unwrap().rules().get(0).name().name());
    }

    @Test
    void index_defaults_shareIdenticalLiterals() throws TreeException {
        var index = Cddl.index(DUPLICATED_LITERALS);

        // Document, 2 x (Rule, TypeRule, Identifier, Type, TypeChoice, Type1, Type2), one shared Value
        assertEquals(16, index.size());
    }

    @Test
    void builder_identityInterning_keepsLiteralsApart() throws TreeException {
        var index = Cddl.builder(DUPLICATED_LITERALS)
                        .interning(Interning.IDENTITY)
                        .index();

        assertEquals(17, index.size());
    }

    @Test
    void builder_rejectPolicy_failsOnSharedLiteral() {
        var builder = Cddl.builder(DUPLICATED_LITERALS)
                          .overwritePolicy(OverwritePolicy.REJECT);

        var error = assertThrows(TreeException.class, builder::index);

        assertEquals(TreeError.OVERWRITE, error.error());
    }

    @Test
    void builder_recoveryNone_reportsOnlyFirstError() {
        var result = Cddl.builder("a = }\nb = ]")
                         .recovery(RecoveryStrategy.NONE)
                         .parse();

        assertThat(result.errors()).hasSize(1)
                                   .allMatch(ParseError.UnrecognizedType2.class::isInstance);
    }

    @Test
    void index_invalidText_failsWithParseErrors() {
        var error = assertThrows(IllegalStateException.class, () -> Cddl.index("a = }"));

        assertThat(error.getMessage()).startsWith("Parsing failed");
    }
}
