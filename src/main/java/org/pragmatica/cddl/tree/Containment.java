package org.pragmatica.cddl.tree;

import com.google.common.collect.ImmutableList;
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
 * Typed parent-child relation used by {@link ParentIndex#parentOf(CddlNode, Containment)}.
 *
 * <p>There is one constant for every place a node kind can occur inside another.
 *
 * @param <C> child node type
 * @param <P> parent node type
 */
public final class Containment<C extends CddlNode, P extends CddlNode> {
    public static final Containment<Rule, Document> RULE_IN_DOCUMENT = of(Rule.class, Document.class);

    public static final Containment<TypeRule, Rule> TYPE_RULE_IN_RULE = of(TypeRule.class, Rule.class);
    public static final Containment<GroupRule, Rule> GROUP_RULE_IN_RULE = of(GroupRule.class, Rule.class);

    public static final Containment<Identifier, TypeRule> IDENTIFIER_IN_TYPE_RULE = of(Identifier.class,
                                                                                      TypeRule.class);
    public static final Containment<GenericParams, TypeRule> GENERIC_PARAMS_IN_TYPE_RULE = of(GenericParams.class,
                                                                                             TypeRule.class);
    public static final Containment<Type, TypeRule> TYPE_IN_TYPE_RULE = of(Type.class, TypeRule.class);

    public static final Containment<Identifier, GroupRule> IDENTIFIER_IN_GROUP_RULE = of(Identifier.class,
                                                                                        GroupRule.class);
    public static final Containment<GenericParams, GroupRule> GENERIC_PARAMS_IN_GROUP_RULE = of(GenericParams.class,
                                                                                               GroupRule.class);
    public static final Containment<GroupEntry, GroupRule> GROUP_ENTRY_IN_GROUP_RULE = of(GroupEntry.class,
                                                                                         GroupRule.class);

    public static final Containment<TypeChoice, Type> TYPE_CHOICE_IN_TYPE = of(TypeChoice.class, Type.class);
    public static final Containment<Type1, TypeChoice> TYPE1_IN_TYPE_CHOICE = of(Type1.class, TypeChoice.class);
    public static final Containment<Type2, Type1> TYPE2_IN_TYPE1 = of(Type2.class, Type1.class);
    public static final Containment<Operator, Type1> OPERATOR_IN_TYPE1 = of(Operator.class, Type1.class);
    public static final Containment<Type2, Operator> TYPE2_IN_OPERATOR = of(Type2.class, Operator.class);

    public static final Containment<Value, Type2> VALUE_IN_TYPE2 = of(Value.class, Type2.class);
    public static final Containment<Identifier, Type2> IDENTIFIER_IN_TYPE2 = of(Identifier.class, Type2.class);
    public static final Containment<GenericArgs, Type2> GENERIC_ARGS_IN_TYPE2 = of(GenericArgs.class, Type2.class);
    public static final Containment<Type, Type2> TYPE_IN_TYPE2 = of(Type.class, Type2.class);
    public static final Containment<Group, Type2> GROUP_IN_TYPE2 = of(Group.class, Type2.class);

    public static final Containment<GroupChoice, Group> GROUP_CHOICE_IN_GROUP = of(GroupChoice.class, Group.class);
    public static final Containment<GroupEntry, GroupChoice> GROUP_ENTRY_IN_GROUP_CHOICE = of(GroupEntry.class,
                                                                                             GroupChoice.class);

    public static final Containment<ValueMemberKeyEntry, GroupEntry> VALUE_MEMBER_KEY_ENTRY_IN_GROUP_ENTRY =
    of(ValueMemberKeyEntry.class, GroupEntry.class);
    public static final Containment<TypeGroupnameEntry, GroupEntry> TYPE_GROUPNAME_ENTRY_IN_GROUP_ENTRY =
    of(TypeGroupnameEntry.class, GroupEntry.class);
    public static final Containment<Occurrence, GroupEntry> OCCURRENCE_IN_GROUP_ENTRY = of(Occurrence.class,
                                                                                          GroupEntry.class);
    public static final Containment<Group, GroupEntry> GROUP_IN_GROUP_ENTRY = of(Group.class, GroupEntry.class);

    public static final Containment<Occurrence, ValueMemberKeyEntry> OCCURRENCE_IN_VALUE_MEMBER_KEY_ENTRY =
    of(Occurrence.class, ValueMemberKeyEntry.class);
    public static final Containment<MemberKey, ValueMemberKeyEntry> MEMBER_KEY_IN_VALUE_MEMBER_KEY_ENTRY =
    of(MemberKey.class, ValueMemberKeyEntry.class);
    public static final Containment<Type, ValueMemberKeyEntry> TYPE_IN_VALUE_MEMBER_KEY_ENTRY =
    of(Type.class, ValueMemberKeyEntry.class);

    public static final Containment<Occurrence, TypeGroupnameEntry> OCCURRENCE_IN_TYPE_GROUPNAME_ENTRY =
    of(Occurrence.class, TypeGroupnameEntry.class);
    public static final Containment<Identifier, TypeGroupnameEntry> IDENTIFIER_IN_TYPE_GROUPNAME_ENTRY =
    of(Identifier.class, TypeGroupnameEntry.class);
    public static final Containment<GenericArgs, TypeGroupnameEntry> GENERIC_ARGS_IN_TYPE_GROUPNAME_ENTRY =
    of(GenericArgs.class, TypeGroupnameEntry.class);

    public static final Containment<Type1, MemberKey> TYPE1_IN_MEMBER_KEY = of(Type1.class, MemberKey.class);
    public static final Containment<Identifier, MemberKey> IDENTIFIER_IN_MEMBER_KEY = of(Identifier.class,
                                                                                        MemberKey.class);
    public static final Containment<Value, MemberKey> VALUE_IN_MEMBER_KEY = of(Value.class, MemberKey.class);
    public static final Containment<NonMemberKey, MemberKey> NON_MEMBER_KEY_IN_MEMBER_KEY = of(NonMemberKey.class,
                                                                                              MemberKey.class);

    public static final Containment<Group, NonMemberKey> GROUP_IN_NON_MEMBER_KEY = of(Group.class,
                                                                                     NonMemberKey.class);
    public static final Containment<Type, NonMemberKey> TYPE_IN_NON_MEMBER_KEY = of(Type.class, NonMemberKey.class);

    public static final Containment<GenericParam, GenericParams> GENERIC_PARAM_IN_GENERIC_PARAMS =
    of(GenericParam.class, GenericParams.class);
    public static final Containment<Identifier, GenericParam> IDENTIFIER_IN_GENERIC_PARAM = of(Identifier.class,
                                                                                              GenericParam.class);
    public static final Containment<GenericArg, GenericArgs> GENERIC_ARG_IN_GENERIC_ARGS = of(GenericArg.class,
                                                                                             GenericArgs.class);
    public static final Containment<Type1, GenericArg> TYPE1_IN_GENERIC_ARG = of(Type1.class, GenericArg.class);

    private static final ImmutableList<Containment<?, ?>> ALL = ImmutableList.of(
    RULE_IN_DOCUMENT,
    TYPE_RULE_IN_RULE,
    GROUP_RULE_IN_RULE,
    IDENTIFIER_IN_TYPE_RULE,
    GENERIC_PARAMS_IN_TYPE_RULE,
    TYPE_IN_TYPE_RULE,
    IDENTIFIER_IN_GROUP_RULE,
    GENERIC_PARAMS_IN_GROUP_RULE,
    GROUP_ENTRY_IN_GROUP_RULE,
    TYPE_CHOICE_IN_TYPE,
    TYPE1_IN_TYPE_CHOICE,
    TYPE2_IN_TYPE1,
    OPERATOR_IN_TYPE1,
    TYPE2_IN_OPERATOR,
    VALUE_IN_TYPE2,
    IDENTIFIER_IN_TYPE2,
    GENERIC_ARGS_IN_TYPE2,
    TYPE_IN_TYPE2,
    GROUP_IN_TYPE2,
    GROUP_CHOICE_IN_GROUP,
    GROUP_ENTRY_IN_GROUP_CHOICE,
    VALUE_MEMBER_KEY_ENTRY_IN_GROUP_ENTRY,
    TYPE_GROUPNAME_ENTRY_IN_GROUP_ENTRY,
    OCCURRENCE_IN_GROUP_ENTRY,
    GROUP_IN_GROUP_ENTRY,
    OCCURRENCE_IN_VALUE_MEMBER_KEY_ENTRY,
    MEMBER_KEY_IN_VALUE_MEMBER_KEY_ENTRY,
    TYPE_IN_VALUE_MEMBER_KEY_ENTRY,
    OCCURRENCE_IN_TYPE_GROUPNAME_ENTRY,
    IDENTIFIER_IN_TYPE_GROUPNAME_ENTRY,
    GENERIC_ARGS_IN_TYPE_GROUPNAME_ENTRY,
    TYPE1_IN_MEMBER_KEY,
    IDENTIFIER_IN_MEMBER_KEY,
    VALUE_IN_MEMBER_KEY,
    NON_MEMBER_KEY_IN_MEMBER_KEY,
    GROUP_IN_NON_MEMBER_KEY,
    TYPE_IN_NON_MEMBER_KEY,
    GENERIC_PARAM_IN_GENERIC_PARAMS,
    IDENTIFIER_IN_GENERIC_PARAM,
    GENERIC_ARG_IN_GENERIC_ARGS,
    TYPE1_IN_GENERIC_ARG);

    private final Class<C> child;
    private final Class<P> parent;

    private Containment(Class<C> child, Class<P> parent) {
        this.child = child;
        this.parent = parent;
    }

    private static <C extends CddlNode, P extends CddlNode> Containment<C, P> of(Class<C> child, Class<P> parent) {
        return new Containment<>(child, parent);
    }

    public static ImmutableList<Containment<?, ?>> all() {
        return ALL;
    }

    public Class<C> child() {
        return child;
    }

    public Class<P> parent() {
        return parent;
    }

    /**
     * Whether {@code node} fits the parent side of this relation.
     */
    public boolean admitsParent(CddlNode node) {
        return parent.isInstance(node);
    }

    @Override
    public String toString() {
        return child.getSimpleName() + " in " + parent.getSimpleName();
    }
}
