package org.pragmatica.cddl.visitor;

import org.pragmatica.cddl.ast.Document;
import org.pragmatica.cddl.ast.GenericArg;
import org.pragmatica.cddl.ast.GenericArgs;
import org.pragmatica.cddl.ast.GenericParam;
import org.pragmatica.cddl.ast.GenericParams;
import org.pragmatica.cddl.ast.Group;
import org.pragmatica.cddl.ast.GroupChoice;
import org.pragmatica.cddl.ast.GroupEntry;
import org.pragmatica.cddl.ast.GroupRule;
import org.pragmatica.cddl.ast.MemberKey;
import org.pragmatica.cddl.ast.NonMemberKey;
import org.pragmatica.cddl.ast.Occurrence;
import org.pragmatica.cddl.ast.Operator;
import org.pragmatica.cddl.ast.Rule;
import org.pragmatica.cddl.ast.Type;
import org.pragmatica.cddl.ast.Type1;
import org.pragmatica.cddl.ast.Type2;
import org.pragmatica.cddl.ast.TypeChoice;
import org.pragmatica.cddl.ast.TypeGroupnameEntry;
import org.pragmatica.cddl.ast.TypeRule;
import org.pragmatica.cddl.ast.ValueMemberKeyEntry;

import java.util.Optional;

/**
 * Default descent for {@link AstVisitor}: each function hands the direct children of a node back
 * to the visitor, in the order they appear in the source.
 */
public final class Walk {
    private Walk() {}

    public static <X extends Exception> void document(AstVisitor<X> visitor, Document document) throws X {
        for (var rule : document.rules()) {
            visitor.visitRule(rule);
        }
    }

    public static <X extends Exception> void rule(AstVisitor<X> visitor, Rule rule) throws X {
        if (rule instanceof Rule.OfType ofType) {
            visitor.visitTypeRule(ofType.rule());
        }else if (rule instanceof Rule.OfGroup ofGroup) {
            visitor.visitGroupRule(ofGroup.rule());
        }
    }

    public static <X extends Exception> void typeRule(AstVisitor<X> visitor, TypeRule rule) throws X {
        visitor.visitIdentifier(rule.name());
        if (rule.genericParams()
                .isPresent()) {
            visitor.visitGenericParams(rule.genericParams()
                                           .get());
        }
        visitor.visitType(rule.value());
    }

    public static <X extends Exception> void groupRule(AstVisitor<X> visitor, GroupRule rule) throws X {
        visitor.visitIdentifier(rule.name());
        if (rule.genericParams()
                .isPresent()) {
            visitor.visitGenericParams(rule.genericParams()
                                           .get());
        }
        visitor.visitGroupEntry(rule.entry());
    }

    public static <X extends Exception> void type(AstVisitor<X> visitor, Type type) throws X {
        for (var choice : type.choices()) {
            visitor.visitTypeChoice(choice);
        }
    }

    public static <X extends Exception> void typeChoice(AstVisitor<X> visitor, TypeChoice choice) throws X {
        visitor.visitType1(choice.type1());
    }

    public static <X extends Exception> void type1(AstVisitor<X> visitor, Type1 type1) throws X {
        visitor.visitType2(type1.type2());
        if (type1.operator()
                 .isPresent()) {
            visitor.visitOperator(type1.operator()
                                       .get());
        }
    }

    public static <X extends Exception> void operator(AstVisitor<X> visitor, Operator operator) throws X {
        visitor.visitType2(operator.type2());
    }

    public static <X extends Exception> void type2(AstVisitor<X> visitor, Type2 type2) throws X {
        if (type2 instanceof Type2.Literal literal) {
            visitor.visitValue(literal.value());
        }else if (type2 instanceof Type2.Typename typename) {
            visitor.visitIdentifier(typename.name());
            optionalArgs(visitor, typename.genericArgs());
        }else if (type2 instanceof Type2.Parenthesized parenthesized) {
            visitor.visitType(parenthesized.type());
        }else if (type2 instanceof Type2.Map map) {
            visitor.visitGroup(map.group());
        }else if (type2 instanceof Type2.Array array) {
            visitor.visitGroup(array.group());
        }else if (type2 instanceof Type2.Unwrap unwrap) {
            visitor.visitIdentifier(unwrap.name());
            optionalArgs(visitor, unwrap.genericArgs());
        }else if (type2 instanceof Type2.ChoiceFromInlineGroup inline) {
            visitor.visitGroup(inline.group());
        }else if (type2 instanceof Type2.ChoiceFromGroup fromGroup) {
            visitor.visitIdentifier(fromGroup.name());
            optionalArgs(visitor, fromGroup.genericArgs());
        }else if (type2 instanceof Type2.TaggedData tagged) {
            visitor.visitType(tagged.type());
        }
        // DataMajorType and Any are leaves
    }

    public static <X extends Exception> void group(AstVisitor<X> visitor, Group group) throws X {
        for (var choice : group.choices()) {
            visitor.visitGroupChoice(choice);
        }
    }

    public static <X extends Exception> void groupChoice(AstVisitor<X> visitor, GroupChoice choice) throws X {
        for (var entry : choice.entries()) {
            visitor.visitGroupEntry(entry.entry());
        }
    }

    public static <X extends Exception> void groupEntry(AstVisitor<X> visitor, GroupEntry entry) throws X {
        if (entry instanceof GroupEntry.ValueMemberKey valueMemberKey) {
            visitor.visitValueMemberKeyEntry(valueMemberKey.entry());
        }else if (entry instanceof GroupEntry.TypeGroupname typeGroupname) {
            visitor.visitTypeGroupnameEntry(typeGroupname.entry());
        }else if (entry instanceof GroupEntry.InlineGroup inlineGroup) {
            if (inlineGroup.occurrence()
                           .isPresent()) {
                visitor.visitOccurrence(inlineGroup.occurrence()
                                                   .get());
            }
            visitor.visitGroup(inlineGroup.group());
        }
    }

    public static <X extends Exception> void valueMemberKeyEntry(AstVisitor<X> visitor,
                                                                 ValueMemberKeyEntry entry) throws X {
        if (entry.occurrence()
                 .isPresent()) {
            visitor.visitOccurrence(entry.occurrence()
                                         .get());
        }
        if (entry.memberKey()
                 .isPresent()) {
            visitor.visitMemberKey(entry.memberKey()
                                        .get());
        }
        visitor.visitType(entry.entryType());
    }

    public static <X extends Exception> void typeGroupnameEntry(AstVisitor<X> visitor,
                                                                TypeGroupnameEntry entry) throws X {
        if (entry.occurrence()
                 .isPresent()) {
            visitor.visitOccurrence(entry.occurrence()
                                         .get());
        }
        visitor.visitIdentifier(entry.name());
        optionalArgs(visitor, entry.genericArgs());
    }

    /**
     * Occurrences have no child nodes.
     */
    public static <X extends Exception> void occurrence(AstVisitor<X> visitor, Occurrence occurrence) throws X {}

    public static <X extends Exception> void memberKey(AstVisitor<X> visitor, MemberKey key) throws X {
        if (key instanceof MemberKey.Type1Key type1Key) {
            visitor.visitType1(type1Key.type1());
        }else if (key instanceof MemberKey.Bareword bareword) {
            visitor.visitIdentifier(bareword.name());
        }else if (key instanceof MemberKey.ValueKey valueKey) {
            visitor.visitValue(valueKey.value());
        }else if (key instanceof MemberKey.NonMember nonMember) {
            visitor.visitNonMemberKey(nonMember.key());
        }
    }

    public static <X extends Exception> void nonMemberKey(AstVisitor<X> visitor, NonMemberKey key) throws X {
        if (key instanceof NonMemberKey.OfGroup ofGroup) {
            visitor.visitGroup(ofGroup.group());
        }else if (key instanceof NonMemberKey.OfType ofType) {
            visitor.visitType(ofType.type());
        }
    }

    public static <X extends Exception> void genericParams(AstVisitor<X> visitor, GenericParams params) throws X {
        for (var param : params.params()) {
            visitor.visitGenericParam(param);
        }
    }

    public static <X extends Exception> void genericParam(AstVisitor<X> visitor, GenericParam param) throws X {
        visitor.visitIdentifier(param.name());
    }

    public static <X extends Exception> void genericArgs(AstVisitor<X> visitor, GenericArgs args) throws X {
        for (var arg : args.args()) {
            visitor.visitGenericArg(arg);
        }
    }

    public static <X extends Exception> void genericArg(AstVisitor<X> visitor, GenericArg arg) throws X {
        visitor.visitType1(arg.arg());
    }

    private static <X extends Exception> void optionalArgs(AstVisitor<X> visitor,
                                                           Optional<GenericArgs> args) throws X {
        if (args.isPresent()) {
            visitor.visitGenericArgs(args.get());
        }
    }
}
