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

/**
 * Tag of an arena slot, one per node kind of the syntax tree.
 */
public enum NodeKind {
    DOCUMENT(Document.class),
    RULE(Rule.class),
    TYPE_RULE(TypeRule.class),
    GROUP_RULE(GroupRule.class),
    TYPE(Type.class),
    TYPE_CHOICE(TypeChoice.class),
    TYPE1(Type1.class),
    OPERATOR(Operator.class),
    TYPE2(Type2.class),
    GROUP(Group.class),
    GROUP_CHOICE(GroupChoice.class),
    GROUP_ENTRY(GroupEntry.class),
    VALUE_MEMBER_KEY_ENTRY(ValueMemberKeyEntry.class),
    TYPE_GROUPNAME_ENTRY(TypeGroupnameEntry.class),
    OCCURRENCE(Occurrence.class),
    MEMBER_KEY(MemberKey.class),
    NON_MEMBER_KEY(NonMemberKey.class),
    GENERIC_PARAMS(GenericParams.class),
    GENERIC_PARAM(GenericParam.class),
    GENERIC_ARGS(GenericArgs.class),
    GENERIC_ARG(GenericArg.class),
    IDENTIFIER(Identifier.class),
    VALUE(Value.class);

    private final Class<? extends CddlNode> nodeType;

    NodeKind(Class<? extends CddlNode> nodeType) {
        this.nodeType = nodeType;
    }

    public boolean matches(CddlNode node) {
        return nodeType.isInstance(node);
    }

    public static NodeKind of(CddlNode node) {
        for (var kind : values()) {
            if (kind.matches(node)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass()
                                                                       .getName());
    }
}
