package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.pragmatica.cddl.parser.CddlParser;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class AstNodeTest {

    private static final Span SPAN = Span.empty(Position.START);

    @Test
    void emptyCollections_areRejected() {
        assertThatThrownBy(() -> new Type(SPAN, ImmutableList.of())).isInstanceOf(IllegalArgumentException.class)
                                                                      .hasMessageContaining("at least one choice");
        assertThatThrownBy(() -> new Group(SPAN, ImmutableList.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GenericParams(SPAN, ImmutableList.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GenericArgs(SPAN, ImmutableList.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Identifier(SPAN, "")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void values_withoutSpan_areEqualWhereverTheyOccur() {
        var first = literalOf("a = \"x\"");
        var second = literalOf("bb = \"x\"");

        assertEquals(first.value(), second.value());
        assertNotEquals(first, second);
    }

    @Test
    void span_to_coversBothSpans() {
        var left = Span.of(Position.at(1, 1, 0), Position.at(1, 4, 3));
        var right = Span.of(Position.at(1, 6, 5), Position.at(1, 9, 8));

        var covered = left.to(right);

        assertEquals(0, covered.start().offset());
        assertEquals(8, covered.end().offset());
        assertEquals(covered, right.to(left));
    }

    @Test
    void span_adjoins_requiresTouchingOffsets() {
        var star = Span.of(Position.at(1, 1, 0), Position.at(1, 2, 1));

        assertTrue(star.adjoins(Span.of(Position.at(1, 2, 1), Position.at(1, 3, 2))));
        assertFalse(star.adjoins(Span.of(Position.at(1, 3, 2), Position.at(1, 4, 3))));
    }

    @Test
    void document_rule_findsFirstBinding() {
        var document = CddlParser.parse("""
            color = "red"
            color /= "blue"
            size = uint
            """).unwrap();

        var color = document.rule("color").orElseThrow();
        assertEquals("color = \"red\"", color.toString());
        assertTrue(document.rule("missing").isEmpty());
    }

    @Test
    void occur_rendersIndicator() {
        assertEquals("?", Occur.ZERO_OR_ONE.toString());
        assertEquals("*", Occur.ZERO_OR_MORE.toString());
        assertEquals("+", Occur.ONE_OR_MORE.toString());
        assertEquals("1*3", new Occur.Bounded(Optional.of(1L), Optional.of(3L)).toString());
        assertEquals("*3", new Occur.Bounded(Optional.empty(), Optional.of(3L)).toString());
    }

    @Test
    void value_rendersLiteralSyntax() {
        assertEquals("\"hi\"", new Value.TextValue("hi").toString());
        assertEquals("h'00ff'", new Value.ByteValue(ByteEncoding.BASE16, "00ff").toString());
        assertEquals("b64'AQ=='", new Value.ByteValue(ByteEncoding.BASE64, "AQ==").toString());
        assertEquals("'raw'", new Value.ByteValue(ByteEncoding.UTF8, "raw").toString());
        assertEquals("-3", new Value.IntValue(-3).toString());
    }

    @Test
    void groupRule_rendersEntry() {
        var document = CddlParser.parse("point //= ? x: int").unwrap();

        assertThat(document.toString()).isEqualTo("point //= ? x: int");
    }

    private static Type2.Literal literalOf(String text) {
        var rule = (Rule.OfType) CddlParser.parse(text).unwrap().rules().get(0);
        return (Type2.Literal) rule.rule().value().choices().get(0).type1().type2();
    }
}
