package org.pragmatica.cddl.visitor;

import org.junit.jupiter.api.Test;
import org.pragmatica.cddl.ast.Document;
import org.pragmatica.cddl.ast.Identifier;
import org.pragmatica.cddl.ast.Occurrence;
import org.pragmatica.cddl.ast.Type2;
import org.pragmatica.cddl.ast.TypeRule;
import org.pragmatica.cddl.ast.Value;
import org.pragmatica.cddl.parser.CddlParser;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AstVisitorTest {

    private static final String SAMPLE = """
        message<t, v> = { type: t, ? value: v }
        reboot = message<"reboot", "now">
        pair = [2*2 int, &(red: 1), ~base]
        keyed = { (tstr / int) => any, 0..10 => #6.32(tstr) }
        sized = bstr .size 16
        """;

    @Test
    void identifierVisitor_reachesIdentifiersAtEveryDepth() {
        var names = new ArrayList<String>();
        var visitor = new AstVisitor<RuntimeException>() {
            @Override
            public void visitIdentifier(Identifier identifier) {
                names.add(identifier.name());
            }
        };

        visitor.visitDocument(parse(SAMPLE));

        assertThat(names).containsExactly("message", "t", "v", "type", "t", "value", "v",
                                          "reboot", "message",
                                          "pair", "int", "red", "base",
                                          "keyed", "tstr", "int", "any", "tstr",
                                          "sized", "bstr");
    }

    @Test
    void valueVisitor_reachesLiteralsInKeysArgsAndRanges() {
        var values = new ArrayList<Value>();
        var visitor = new AstVisitor<RuntimeException>() {
            @Override
            public void visitValue(Value value) {
                values.add(value);
            }
        };

        visitor.visitDocument(parse(SAMPLE));

        assertThat(values).extracting(Value::toString)
                          .containsExactly("\"reboot\"", "\"now\"", "1", "0", "10", "16");
    }

    @Test
    void occurrenceVisitor_reachesOccurrences() {
        var occurrences = new ArrayList<String>();
        var visitor = new AstVisitor<RuntimeException>() {
            @Override
            public void visitOccurrence(Occurrence occurrence) {
                occurrences.add(occurrence.toString());
            }
        };

        visitor.visitDocument(parse(SAMPLE));

        assertThat(occurrences).containsExactly("?", "2*2");
    }

    @Test
    void overriddenVisit_canStopDescent() {
        var type2s = new ArrayList<Type2>();
        var visitor = new AstVisitor<RuntimeException>() {
            @Override
            public void visitType2(Type2 type2) {
                type2s.add(type2);
                // no Walk call: nested types stay unvisited
            }
        };

        visitor.visitDocument(parse("a = [int, tstr]\nb = c"));

        assertEquals(2, type2s.size());
        assertInstanceOf(Type2.Array.class, type2s.get(0));
    }

    @Test
    void checkedFailure_propagatesOutOfWalk() {
        class FoundLiteral extends Exception {
            FoundLiteral(Value value) {
                super(value.toString());
            }
        }
        var visitor = new AstVisitor<FoundLiteral>() {
            @Override
            public void visitValue(Value value) throws FoundLiteral {
                throw new FoundLiteral(value);
            }
        };

        var error = assertThrows(FoundLiteral.class, () -> visitor.visitDocument(parse("a = b\nc = { d: 42 }")));

        assertEquals("42", error.getMessage());
    }

    @Test
    void walk_visitsRulesInSourceOrder() {
        List<String> names = new ArrayList<>();
        var visitor = new AstVisitor<RuntimeException>() {
            @Override
            public void visitTypeRule(TypeRule rule) {
                names.add(rule.name().name());
                Walk.typeRule(this, rule);
            }
        };

        visitor.visitDocument(parse("z = a\ny = b\nx = c"));

        assertThat(names).containsExactly("z", "y", "x");
    }

    private static Document parse(String text) {
        return CddlParser.parse(text).unwrap();
    }
}
