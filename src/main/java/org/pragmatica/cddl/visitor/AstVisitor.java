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
import org.pragmatica.cddl.ast.Identifier;
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
import org.pragmatica.cddl.ast.Value;
import org.pragmatica.cddl.ast.ValueMemberKeyEntry;

/**
 * Visitor over the CDDL syntax tree.
 *
 * <p>Every method defaults to the matching {@link Walk} function, which visits the node's direct
 * children in source order. Implementations override only the node kinds they are interested in
 * and call {@code Walk} themselves to keep descending.
 *
 * @param <X> checked exception a visitor may raise to abort the walk
 */
public interface AstVisitor<X extends Exception> {

    default void visitDocument(Document document) throws X {
        Walk.document(this, document);
    }

    default void visitRule(Rule rule) throws X {
        Walk.rule(this, rule);
    }

    default void visitTypeRule(TypeRule rule) throws X {
        Walk.typeRule(this, rule);
    }

    default void visitGroupRule(GroupRule rule) throws X {
        Walk.groupRule(this, rule);
    }

    default void visitType(Type type) throws X {
        Walk.type(this, type);
    }

    default void visitTypeChoice(TypeChoice choice) throws X {
        Walk.typeChoice(this, choice);
    }

    default void visitType1(Type1 type1) throws X {
        Walk.type1(this, type1);
    }

    default void visitOperator(Operator operator) throws X {
        Walk.operator(this, operator);
    }

    default void visitType2(Type2 type2) throws X {
        Walk.type2(this, type2);
    }

    default void visitGroup(Group group) throws X {
        Walk.group(this, group);
    }

    default void visitGroupChoice(GroupChoice choice) throws X {
        Walk.groupChoice(this, choice);
    }

    default void visitGroupEntry(GroupEntry entry) throws X {
        Walk.groupEntry(this, entry);
    }

    default void visitValueMemberKeyEntry(ValueMemberKeyEntry entry) throws X {
        Walk.valueMemberKeyEntry(this, entry);
    }

    default void visitTypeGroupnameEntry(TypeGroupnameEntry entry) throws X {
        Walk.typeGroupnameEntry(this, entry);
    }

    default void visitOccurrence(Occurrence occurrence) throws X {
        Walk.occurrence(this, occurrence);
    }

    default void visitMemberKey(MemberKey key) throws X {
        Walk.memberKey(this, key);
    }

    default void visitNonMemberKey(NonMemberKey key) throws X {
        Walk.nonMemberKey(this, key);
    }

    default void visitGenericParams(GenericParams params) throws X {
        Walk.genericParams(this, params);
    }

    default void visitGenericParam(GenericParam param) throws X {
        Walk.genericParam(this, param);
    }

    default void visitGenericArgs(GenericArgs args) throws X {
        Walk.genericArgs(this, args);
    }

    default void visitGenericArg(GenericArg arg) throws X {
        Walk.genericArg(this, arg);
    }

    /**
     * Leaf; nothing to walk by default.
     */
    default void visitIdentifier(Identifier identifier) throws X {}

    /**
     * Leaf; nothing to walk by default.
     */
    default void visitValue(Value value) throws X {}
}
