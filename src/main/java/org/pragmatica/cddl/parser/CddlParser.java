package org.pragmatica.cddl.parser;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cddl.ast.Assignment;
import org.pragmatica.cddl.ast.Document;
import org.pragmatica.cddl.ast.GenericArg;
import org.pragmatica.cddl.ast.GenericArgs;
import org.pragmatica.cddl.ast.GenericParam;
import org.pragmatica.cddl.ast.GenericParams;
import org.pragmatica.cddl.ast.Group;
import org.pragmatica.cddl.ast.GroupChoice;
import org.pragmatica.cddl.ast.GroupEntry;
import org.pragmatica.cddl.ast.GroupRule;
import org.pragmatica.cddl.ast.Identifier;
import org.pragmatica.cddl.ast.MemberKey;
import org.pragmatica.cddl.ast.NonMemberKey;
import org.pragmatica.cddl.ast.Occur;
import org.pragmatica.cddl.ast.Occurrence;
import org.pragmatica.cddl.ast.Operator;
import org.pragmatica.cddl.ast.Position;
import org.pragmatica.cddl.ast.RangeCtlOp;
import org.pragmatica.cddl.ast.Rule;
import org.pragmatica.cddl.ast.Span;
import org.pragmatica.cddl.ast.Type;
import org.pragmatica.cddl.ast.Type1;
import org.pragmatica.cddl.ast.Type2;
import org.pragmatica.cddl.ast.TypeChoice;
import org.pragmatica.cddl.ast.TypeGroupnameEntry;
import org.pragmatica.cddl.ast.TypeRule;
import org.pragmatica.cddl.ast.Value;
import org.pragmatica.cddl.ast.ValueMemberKeyEntry;
import org.pragmatica.cddl.error.LexerException;
import org.pragmatica.cddl.error.ParseError;
import org.pragmatica.cddl.error.ParserException;
import org.pragmatica.cddl.error.RecoveryStrategy;
import org.pragmatica.cddl.parser.CddlToken.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for CDDL.
 *
 * <p>The parser keeps two tokens of lookahead, {@code current} and {@code peek}, and has one
 * method per grammar construct. A parser instance parses one input, once.
 */
public final class CddlParser {
    private static final Logger log = LoggerFactory.getLogger(CddlParser.class);

    private final TokenSource tokens;
    private final ParserConfig config;
    private final List<ParseError> errors = new ArrayList<>();

    private CddlToken current;
    private CddlToken peek;
    private Position previousEnd = Position.START;

    private CddlParser(TokenSource tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
    }

    /**
     * Parse CDDL text into a document.
     */
    public static ParseResult parse(String text) {
        return parse(text, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(String text, ParserConfig config) {
        return parse(CddlLexer.of(text), config);
    }

    public static ParseResult parse(TokenSource tokens) {
        return parse(tokens, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(TokenSource tokens, ParserConfig config) {
        try{
            return create(tokens, config).parseDocument();
        } catch (ParserException e) {
            return ParseResult.failure(List.of(e.error()));
        }
    }

    /**
     * Create a parser positioned on the first token of {@code tokens}.
     */
    public static CddlParser create(TokenSource tokens, ParserConfig config) throws ParserException {
        var parser = new CddlParser(tokens, config);
        parser.advance();
        parser.advance();
        return parser;
    }

    public static CddlParser create(String text) throws ParserException {
        return create(CddlLexer.of(text), ParserConfig.DEFAULT);
    }

    /**
     * Parse rules until end of input.
     *
     * <p>Non-fatal errors are recorded; with {@link RecoveryStrategy#BASIC} the parser then skips
     * to the next rule definition and continues. Fatal errors end the pass at once.
     */
    public ParseResult parseDocument() {
        var rules = ImmutableList.<Rule>builder();
        while (!isAtEnd()) {
            try{
                var rule = parseRule();
                log.trace("Parsed rule '{}'", rule.name());
                rules.add(rule);
            } catch (ParserException e) {
                var error = e.error();
                errors.add(error);
                if (error.fatal() || config.recovery() == RecoveryStrategy.NONE) {
                    log.debug("Parsing stopped: {}", error.message());
                    break;
                }
                log.debug("Skipping to next rule after error: {}", error.message());
                if (!synchronize()) {
                    break;
                }
            }
        }
        if (errors.isEmpty()) {
            return ParseResult.success(new Document(rules.build()));
        }
        return ParseResult.failure(errors);
    }

    /**
     * {@code name [genericparm] ("=" / "/=" / "//=") (type / grpent)}
     */
    public Rule parseRule() throws ParserException {
        var start = current.span()
                           .start();
        if (!(current instanceof CddlToken.Identifier)) {
            throw unexpected("rule name");
        }
        var name = identifier((CddlToken.Identifier) current);
        advance();

        Optional<GenericParams> params = Optional.empty();
        if (is(Symbol.LANGLE)) {
            params = Optional.of(parseGenericParams());
        }

        var assignment = assignment().orElseThrow(() -> new ParserException(
        new ParseError.ExpectedAssignment(current.span()
                                                 .start(),
                                          current.describe())));
        advance();

        if (is(Symbol.LPAREN)) {
            throw new ParserException(new ParseError.Unimplemented(current.span()
                                                                          .start(),
                                                                   "parenthesized group entry as rule body"));
        }

        if (assignment == Assignment.GROUP_CHOICE_ALT
            || (assignment == Assignment.DEFINE && startsKeyedOrRepeatedEntry())) {
            return groupRule(start, name, params, assignment, parseGroupEntry());
        }

        var bodyStart = current.span()
                               .start();
        var type = parseType();
        if (assignment == Assignment.DEFINE && startsArrow()) {
            return groupRule(start, name, params, assignment, finishEntry(bodyStart, Optional.empty(), type));
        }
        var span = spanFrom(start);
        return new Rule.OfType(span, new TypeRule(span, name, params, assignment, type));
    }

    private Rule groupRule(Position start,
                           Identifier name,
                           Optional<GenericParams> params,
                           Assignment assignment,
                           GroupEntry entry) {
        var span = spanFrom(start);
        return new Rule.OfGroup(span, new GroupRule(span, name, params, assignment, entry));
    }

    /**
     * {@code "<" id *("," id) ">"}
     */
    public GenericParams parseGenericParams() throws ParserException {
        var start = current.span()
                           .start();
        expect(Symbol.LANGLE, "'<'");
        var params = ImmutableList.<GenericParam>builder();
        boolean empty = true;
        while (!is(Symbol.RANGLE)) {
            if (current instanceof CddlToken.Identifier id) {
                params.add(new GenericParam(id.span(), identifier(id)));
                empty = false;
                advance();
            }else if (is(Symbol.COMMA)) {
                advance();
            }else {
                throw new ParserException(new ParseError.IllegalToken(current.span()
                                                                             .start(),
                                                                      current.describe(),
                                                                      "generic parameters"));
            }
        }
        if (empty) {
            throw unexpected("generic parameter name");
        }
        advance();
        return new GenericParams(spanFrom(start), params.build());
    }

    /**
     * {@code "<" type1 *("," type1) ">"}
     */
    public GenericArgs parseGenericArgs() throws ParserException {
        var start = current.span()
                           .start();
        expect(Symbol.LANGLE, "'<'");
        var args = ImmutableList.<GenericArg>builder();
        do {
            var arg = parseType1();
            args.add(new GenericArg(arg.span(), arg));
            if (is(Symbol.COMMA)) {
                advance();
            }else if (!is(Symbol.RANGLE)) {
                throw unexpected("',' or '>'");
            }
        } while (!is(Symbol.RANGLE));
        advance();
        return new GenericArgs(spanFrom(start), args.build());
    }

    /**
     * {@code type1 *("/" type1)}
     */
    public Type parseType() throws ParserException {
        var start = current.span()
                           .start();
        var choices = ImmutableList.<TypeChoice>builder();
        var first = parseType1();
        choices.add(new TypeChoice(first.span(), first));
        while (is(Symbol.TYPE_CHOICE)) {
            advance();
            var next = parseType1();
            choices.add(new TypeChoice(next.span(), next));
        }
        return new Type(spanFrom(start), choices.build());
    }

    /**
     * {@code type2 [(rangeop / ctlop) type2]}
     */
    Type1 parseType1() throws ParserException {
        if (current instanceof CddlToken.Range range) {
            advance();
            var lower = new Type2.Literal(range.lowerSpan(), range.lower());
            var upper = new Type2.Literal(range.upperSpan(), range.upper());
            var operator = new Operator(Span.of(range.lowerSpan()
                                                     .end(),
                                                range.span()
                                                     .end()),
                                        new RangeCtlOp.Range(range.inclusive()),
                                        upper);
            return new Type1(range.span(), lower, Optional.of(operator));
        }

        var start = current.span()
                           .start();
        var type2 = parseType2();
        var opStart = current.span()
                             .start();
        RangeCtlOp op;
        if (current instanceof CddlToken.RangeOp rangeOp) {
            op = new RangeCtlOp.Range(rangeOp.inclusive());
        }else if (current instanceof CddlToken.ControlOp controlOp) {
            op = new RangeCtlOp.Control(controlOp.name());
        }else {
            return new Type1(spanFrom(start), type2, Optional.empty());
        }
        advance();
        var operand = parseType2();
        var operator = new Operator(spanFrom(opStart), op, operand);
        return new Type1(spanFrom(start), type2, Optional.of(operator));
    }

    Type2 parseType2() throws ParserException {
        var token = current;
        var start = token.span()
                         .start();

        if (token instanceof CddlToken.Literal literal) {
            advance();
            return new Type2.Literal(literal.span(), literal.value());
        }

        // typename [genericarg]
        if (token instanceof CddlToken.Identifier id) {
            var name = identifier(id);
            advance();
            var args = optionalGenericArgs();
            return new Type2.Typename(spanFrom(start), name, args);
        }

        if (is(Symbol.LPAREN)) {
            advance();
            var type = parseType();
            expect(Symbol.RPAREN, "')'");
            return new Type2.Parenthesized(spanFrom(start), type);
        }

        if (is(Symbol.LBRACE)) {
            advance();
            var group = parseGroup();
            expect(Symbol.RBRACE, "'}'");
            return new Type2.Map(spanFrom(start), group);
        }

        if (is(Symbol.LBRACKET)) {
            advance();
            var group = parseGroup();
            expect(Symbol.RBRACKET, "']'");
            return new Type2.Array(spanFrom(start), group);
        }

        if (is(Symbol.TILDE)) {
            advance();
            var name = expectIdentifier("type name after '~'");
            return new Type2.Unwrap(spanFrom(start), name, optionalGenericArgs());
        }

        if (is(Symbol.AMPERSAND)) {
            advance();
            if (is(Symbol.LPAREN)) {
                advance();
                var group = parseGroup();
                expect(Symbol.RPAREN, "')'");
                return new Type2.ChoiceFromInlineGroup(spanFrom(start), group);
            }
            var name = expectIdentifier("group name or '(' after '&'");
            return new Type2.ChoiceFromGroup(spanFrom(start), name, optionalGenericArgs());
        }

        if (token instanceof CddlToken.Tag tag) {
            advance();
            if (tag.major() == 6 && is(Symbol.LPAREN)) {
                advance();
                var type = parseType();
                expect(Symbol.RPAREN, "')'");
                return new Type2.TaggedData(spanFrom(start), tag.constraint(), type);
            }
            return new Type2.DataMajorType(tag.span(), tag.major(), tag.constraint());
        }

        if (is(Symbol.HASH)) {
            advance();
            return new Type2.Any(token.span());
        }

        throw new ParserException(new ParseError.UnrecognizedType2(start, token.describe()));
    }

    private Optional<GenericArgs> optionalGenericArgs() throws ParserException {
        return is(Symbol.LANGLE)
               ? Optional.of(parseGenericArgs())
               : Optional.empty();
    }

    /**
     * {@code grpchoice *("//" grpchoice)}
     */
    Group parseGroup() throws ParserException {
        var start = current.span()
                           .start();
        var choices = ImmutableList.<GroupChoice>builder();
        choices.add(parseGroupChoice());
        while (is(Symbol.GROUP_CHOICE)) {
            advance();
            choices.add(parseGroupChoice());
        }
        return new Group(spanFrom(start), choices.build());
    }

    private GroupChoice parseGroupChoice() throws ParserException {
        var start = current.span()
                           .start();
        var entries = ImmutableList.<GroupChoice.Entry>builder();
        while (!endsGroupChoice()) {
            var entry = parseGroupEntry();
            boolean comma = is(Symbol.COMMA);
            if (comma) {
                advance();
            }
            entries.add(new GroupChoice.Entry(entry, comma));
        }
        return new GroupChoice(spanFrom(start), entries.build());
    }

    private boolean endsGroupChoice() {
        return isAtEnd() || is(Symbol.GROUP_CHOICE) || is(Symbol.RPAREN) || is(Symbol.RBRACE) || is(Symbol.RBRACKET);
    }

    /**
     * {@code [occur] ( "(" group ")" / memberkey type / type )}
     */
    GroupEntry parseGroupEntry() throws ParserException {
        var start = current.span()
                           .start();
        var occurrence = parseOccurrence();

        if (is(Symbol.LPAREN)) {
            var groupStart = current.span()
                                    .start();
            advance();
            var group = parseGroup();
            expect(Symbol.RPAREN, "')'");
            if (!startsArrow()) {
                return new GroupEntry.InlineGroup(spanFrom(start), occurrence, group);
            }
            var nonMemberKey = nonMemberKey(spanFrom(groupStart), group);
            boolean cut = parseArrow();
            MemberKey key = new MemberKey.NonMember(spanFrom(groupStart), nonMemberKey, cut);
            return valueMemberKey(start, occurrence, Optional.of(key), parseType());
        }

        if (peekIs(Symbol.COLON) && current instanceof CddlToken.Identifier id) {
            advance();
            advance();
            MemberKey key = new MemberKey.Bareword(spanFrom(id.span()
                                                              .start()), identifier(id));
            return valueMemberKey(start, occurrence, Optional.of(key), parseType());
        }

        if (peekIs(Symbol.COLON) && current instanceof CddlToken.Literal literal) {
            advance();
            advance();
            MemberKey key = new MemberKey.ValueKey(spanFrom(literal.span()
                                                                   .start()), literal.value());
            return valueMemberKey(start, occurrence, Optional.of(key), parseType());
        }

        return finishEntry(start, occurrence, parseType());
    }

    /**
     * Complete an entry whose leading type is parsed: either it was a {@code type1 =>} key, or
     * it is the entry type itself.
     */
    private GroupEntry finishEntry(Position start, Optional<Occurrence> occurrence, Type type) throws ParserException {
        if (startsArrow()) {
            if (type.choices()
                    .size() != 1) {
                throw unexpected("a single type1 before '=>'");
            }
            var type1 = type.choices()
                            .get(0)
                            .type1();
            boolean cut = parseArrow();
            MemberKey key = new MemberKey.Type1Key(spanFrom(type1.span()
                                                                 .start()), type1, cut);
            return valueMemberKey(start, occurrence, Optional.of(key), parseType());
        }
        var typename = bareTypename(type);
        if (typename.isPresent()) {
            var span = spanFrom(start);
            var entry = new TypeGroupnameEntry(span,
                                               occurrence,
                                               typename.get()
                                                       .name(),
                                               typename.get()
                                                       .genericArgs());
            return new GroupEntry.TypeGroupname(span, entry);
        }
        return valueMemberKey(start, occurrence, Optional.empty(), type);
    }

    private GroupEntry valueMemberKey(Position start,
                                      Optional<Occurrence> occurrence,
                                      Optional<MemberKey> key,
                                      Type type) {
        var span = spanFrom(start);
        return new GroupEntry.ValueMemberKey(span, new ValueMemberKeyEntry(span, occurrence, key, type));
    }

    /**
     * A lone name may refer to a type or a group; it is kept as a name until resolved.
     */
    private static Optional<Type2.Typename> bareTypename(Type type) {
        if (type.choices()
                .size() != 1) {
            return Optional.empty();
        }
        var type1 = type.choices()
                        .get(0)
                        .type1();
        if (type1.operator()
                 .isPresent() || !(type1.type2() instanceof Type2.Typename)) {
            return Optional.empty();
        }
        return Optional.of((Type2.Typename) type1.type2());
    }

    /**
     * A parenthesized key holding a single keyless value entry is a type; anything else is a group.
     */
    private static NonMemberKey nonMemberKey(Span span, Group group) {
        if (group.choices()
                 .size() == 1 && group.choices()
                                      .get(0)
                                      .entries()
                                      .size() == 1) {
            var entry = group.choices()
                             .get(0)
                             .entries()
                             .get(0)
                             .entry();
            if (entry instanceof GroupEntry.ValueMemberKey valueEntry
                && valueEntry.entry()
                             .occurrence()
                             .isEmpty()
                && valueEntry.entry()
                             .memberKey()
                             .isEmpty()) {
                return new NonMemberKey.OfType(span,
                                               valueEntry.entry()
                                                         .entryType());
            }
        }
        return new NonMemberKey.OfGroup(span, group);
    }

    /**
     * {@code "?" / "+" / [uint] "*" [uint]}. The upper bound must directly follow the {@code *}.
     */
    private Optional<Occurrence> parseOccurrence() throws ParserException {
        var start = current.span()
                           .start();
        if (is(Symbol.QUESTION)) {
            advance();
            return Optional.of(new Occurrence(spanFrom(start), Occur.ZERO_OR_ONE));
        }
        if (is(Symbol.PLUS)) {
            advance();
            return Optional.of(new Occurrence(spanFrom(start), Occur.ONE_OR_MORE));
        }
        var lower = uintValue(current).filter(v -> peekIs(Symbol.ASTERISK));
        if (lower.isPresent()) {
            advance();
        }
        if (!is(Symbol.ASTERISK)) {
            return Optional.empty();
        }
        var star = current.span();
        advance();
        Optional<Long> upper = Optional.empty();
        if (star.adjoins(current.span())) {
            upper = uintValue(current);
            if (upper.isPresent()) {
                advance();
            }
        }
        var occur = lower.isEmpty() && upper.isEmpty()
                    ? Occur.ZERO_OR_MORE
                    : new Occur.Bounded(lower, upper);
        return Optional.of(new Occurrence(spanFrom(start), occur));
    }

    private static Optional<Long> uintValue(CddlToken token) {
        if (token instanceof CddlToken.Literal literal && literal.value() instanceof Value.UintValue uint) {
            return Optional.of(uint.value());
        }
        return Optional.empty();
    }

    private boolean startsKeyedOrRepeatedEntry() {
        if (is(Symbol.QUESTION) || is(Symbol.PLUS) || is(Symbol.ASTERISK)) {
            return true;
        }
        if (uintValue(current).isPresent() && peekIs(Symbol.ASTERISK)) {
            return true;
        }
        return peekIs(Symbol.COLON)
               && (current instanceof CddlToken.Identifier || current instanceof CddlToken.Literal);
    }

    private boolean startsArrow() {
        return is(Symbol.ARROW) || is(Symbol.CARET);
    }

    /**
     * Consume {@code ["^"] "=>"}, returning whether the cut was present.
     */
    private boolean parseArrow() throws ParserException {
        boolean cut = is(Symbol.CARET);
        if (cut) {
            advance();
        }
        expect(Symbol.ARROW, "'=>'");
        return cut;
    }

    private Optional<Assignment> assignment() {
        if (is(Symbol.ASSIGN)) {
            return Optional.of(Assignment.DEFINE);
        }
        if (is(Symbol.TYPE_CHOICE_ALT)) {
            return Optional.of(Assignment.TYPE_CHOICE_ALT);
        }
        if (is(Symbol.GROUP_CHOICE_ALT)) {
            return Optional.of(Assignment.GROUP_CHOICE_ALT);
        }
        return Optional.empty();
    }

    /**
     * Skip tokens until the next {@code name =}, {@code name /=} or {@code name //=}.
     */
    private boolean synchronize() {
        try{
            do {
                advance();
            } while (!isAtEnd() && !atRuleStart());
            return true;
        } catch (ParserException e) {
            errors.add(e.error());
            return false;
        }
    }

    private boolean atRuleStart() {
        return current instanceof CddlToken.Identifier
               && (peekIs(Symbol.ASSIGN) || peekIs(Symbol.TYPE_CHOICE_ALT) || peekIs(Symbol.GROUP_CHOICE_ALT));
    }

    // === Token handling ===

    private void advance() throws ParserException {
        if (current != null) {
            previousEnd = current.span()
                                 .end();
        }
        current = peek;
        try{
            peek = tokens.next();
        } catch (LexerException e) {
            throw new ParserException(e.toParseError(), e);
        }
    }

    private boolean isAtEnd() {
        return current instanceof CddlToken.Eof;
    }

    private boolean is(Symbol symbol) {
        return current instanceof CddlToken.Punct punct && punct.symbol() == symbol;
    }

    private boolean peekIs(Symbol symbol) {
        return peek instanceof CddlToken.Punct punct && punct.symbol() == symbol;
    }

    private void expect(Symbol symbol, String expected) throws ParserException {
        if (!is(symbol)) {
            throw unexpected(expected);
        }
        advance();
    }

    private Identifier expectIdentifier(String expected) throws ParserException {
        if (!(current instanceof CddlToken.Identifier id)) {
            throw unexpected(expected);
        }
        advance();
        return identifier(id);
    }

    private ParserException unexpected(String expected) {
        return new ParserException(new ParseError.UnexpectedToken(current.span()
                                                                         .start(),
                                                                  current.describe(),
                                                                  expected));
    }

    private static Identifier identifier(CddlToken.Identifier token) {
        return new Identifier(token.span(), token.name());
    }

    /**
     * Span from {@code start} to the end of the last consumed token.
     */
    private Span spanFrom(Position start) {
        return previousEnd.isBefore(start)
               ? Span.empty(start)
               : Span.of(start, previousEnd);
    }
}
