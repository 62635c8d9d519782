package org.pragmatica.cddl.tree;

import org.pragmatica.cddl.ast.CddlNode;
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
import org.pragmatica.cddl.visitor.AstVisitor;
import org.pragmatica.cddl.visitor.Walk;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Visitor that fills an {@link Arena}: every node is interned and linked under the node being
 * visited above it.
 */
final class ParentIndexer implements AstVisitor<TreeException> {
    private final Arena arena;
    private final Deque<Integer> parents = new ArrayDeque<>();

    ParentIndexer(Arena arena) {
        this.arena = arena;
    }

    @FunctionalInterface
    private interface Descent {
        void run() throws TreeException;
    }

    private void enter(CddlNode node, Descent descent) throws TreeException {
        int index = arena.intern(node);
        if (!parents.isEmpty()) {
            arena.link(parents.peek(), index);
        }
        parents.push(index);
        try{
            descent.run();
        } finally{
            parents.pop();
        }
    }

    @Override
    public void visitDocument(Document document) throws TreeException {
        enter(document, () -> Walk.document(this, document));
    }

    @Override
    public void visitRule(Rule rule) throws TreeException {
        enter(rule, () -> Walk.rule(this, rule));
    }

    @Override
    public void visitTypeRule(TypeRule rule) throws TreeException {
        enter(rule, () -> Walk.typeRule(this, rule));
    }

    @Override
    public void visitGroupRule(GroupRule rule) throws TreeException {
        enter(rule, () -> Walk.groupRule(this, rule));
    }

    @Override
    public void visitType(Type type) throws TreeException {
        enter(type, () -> Walk.type(this, type));
    }

    @Override
    public void visitTypeChoice(TypeChoice choice) throws TreeException {
        enter(choice, () -> Walk.typeChoice(this, choice));
    }

    @Override
    public void visitType1(Type1 type1) throws TreeException {
        enter(type1, () -> Walk.type1(this, type1));
    }

    @Override
    public void visitOperator(Operator operator) throws TreeException {
        enter(operator, () -> Walk.operator(this, operator));
    }

    @Override
    public void visitType2(Type2 type2) throws TreeException {
        enter(type2, () -> Walk.type2(this, type2));
    }

    @Override
    public void visitGroup(Group group) throws TreeException {
        enter(group, () -> Walk.group(this, group));
    }

    @Override
    public void visitGroupChoice(GroupChoice choice) throws TreeException {
        enter(choice, () -> Walk.groupChoice(this, choice));
    }

    @Override
    public void visitGroupEntry(GroupEntry entry) throws TreeException {
        enter(entry, () -> Walk.groupEntry(this, entry));
    }

    @Override
    public void visitValueMemberKeyEntry(ValueMemberKeyEntry entry) throws TreeException {
        enter(entry, () -> Walk.valueMemberKeyEntry(this, entry));
    }

    @Override
    public void visitTypeGroupnameEntry(TypeGroupnameEntry entry) throws TreeException {
        enter(entry, () -> Walk.typeGroupnameEntry(this, entry));
    }

    @Override
    public void visitOccurrence(Occurrence occurrence) throws TreeException {
        enter(occurrence, () -> Walk.occurrence(this, occurrence));
    }

    @Override
    public void visitMemberKey(MemberKey key) throws TreeException {
        enter(key, () -> Walk.memberKey(this, key));
    }

    @Override
    public void visitNonMemberKey(NonMemberKey key) throws TreeException {
        enter(key, () -> Walk.nonMemberKey(this, key));
    }

    @Override
    public void visitGenericParams(GenericParams params) throws TreeException {
        enter(params, () -> Walk.genericParams(this, params));
    }

    @Override
    public void visitGenericParam(GenericParam param) throws TreeException {
        enter(param, () -> Walk.genericParam(this, param));
    }

    @Override
    public void visitGenericArgs(GenericArgs args) throws TreeException {
        enter(args, () -> Walk.genericArgs(this, args));
    }

    @Override
    public void visitGenericArg(GenericArg arg) throws TreeException {
        enter(arg, () -> Walk.genericArg(this, arg));
    }

    @Override
    public void visitIdentifier(Identifier identifier) throws TreeException {
        enter(identifier, () -> {});
    }

    @Override
    public void visitValue(Value value) throws TreeException {
        enter(value, () -> {});
    }
}
